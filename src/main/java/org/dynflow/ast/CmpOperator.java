package org.dynflow.ast;

public enum CmpOperator {
    EQ("=="), NOT_EQ("!="), LT("<"), LTE("<="), GT(">"), GTE(">="), IN("in"), NOT_IN("not in"), IS("is"), IS_NOT("is not");

    public final String symbol;

    CmpOperator(String symbol) {
        this.symbol = symbol;
    }
}
