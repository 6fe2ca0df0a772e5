package org.dynflow.parse;

/**
 * 词法单元。value 只对字面量有意义：INT 为 Long，FLOAT 为 Double，STRING 为解码后的 String。
 */
public record Token(TokenType type, String text, Object value, int line, int column) {

    public boolean is(TokenType t, String s) {
        return type == t && text.equals(s);
    }

    public boolean isOp(String s) {
        return is(TokenType.OP, s);
    }

    public boolean isKeyword(String s) {
        return is(TokenType.KEYWORD, s);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NEWLINE -> "NEWLINE";
            case INDENT -> "INDENT";
            case DEDENT -> "DEDENT";
            case END -> "end of input";
            default -> "'" + text + "'";
        };
    }
}
