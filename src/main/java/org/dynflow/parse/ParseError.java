package org.dynflow.parse;

/**
 * 源码不符合语法。解析阶段一旦抛出就不会产生任何分析结果。
 */
public class ParseError extends RuntimeException {

    private final int line;
    private final int column;
    private final String problem;

    public ParseError(int line, int column, String problem) {
        super("line " + line + ":" + column + ": " + problem);
        this.line = line;
        this.column = column;
        this.problem = problem;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getProblem() {
        return problem;
    }
}
