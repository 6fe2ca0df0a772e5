package org.dynflow.parse;

public enum TokenType {
    NAME, KEYWORD, INT, FLOAT, STRING, OP, NEWLINE, INDENT, DEDENT, END
}
