package org.dynflow.ast;

public enum UnaryOperator {
    NEG("-"), POS("+"), NOT("not");

    public final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }
}
