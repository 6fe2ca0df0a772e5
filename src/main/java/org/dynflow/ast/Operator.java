package org.dynflow.ast;

public enum Operator {
    ADD("+"), SUB("-"), MULT("*"), DIV("/"), FLOOR_DIV("//"), MOD("%"), POW("**");

    public final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }
}
