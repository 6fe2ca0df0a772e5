package org.dynflow.interp;

/**
 * 被分析程序自身在运行中出错，例如除零、名字未定义、下标越界或者执行了 raise。
 * <p>
 * type 是脚本层面的错误类型名（ZeroDivisionError、NameError ...），line 为出错时正在执行的行，未知时为 -1。
 */
public class ProgramError extends RuntimeException {

    private final String type;
    private final String detail;
    private int line;

    public ProgramError(String type, String detail) {
        this(type, detail, -1);
    }

    public ProgramError(String type, String detail, int line) {
        super(type + (detail == null || detail.isEmpty() ? "" : ": " + detail));
        this.type = type;
        this.detail = detail == null ? "" : detail;
        this.line = line;
    }

    public String getType() {
        return type;
    }

    public String getDetail() {
        return detail;
    }

    public int getLine() {
        return line;
    }

    /**
     * 记录出错行；只在第一次设置时生效，保证报告的是最内层的位置
     */
    public ProgramError atLine(int line) {
        if (this.line < 0) {
            this.line = line;
        }
        return this;
    }

    /**
     * 面向调用方的一行描述，例如 {@code ZeroDivisionError: division by zero (line 3)}
     */
    public String describe() {
        return getMessage() + (line > 0 ? " (line " + line + ")" : "");
    }

    static ProgramError typeError(String detail) {
        return new ProgramError("TypeError", detail);
    }

    static ProgramError valueError(String detail) {
        return new ProgramError("ValueError", detail);
    }

    static ProgramError indexError(String detail) {
        return new ProgramError("IndexError", detail);
    }
}
