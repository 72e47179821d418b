package org.pyonjava.frontend.astnode;

public enum BooleanOperator {
    AND("and", "And", Precedence.AND),
    OR("or", "Or", Precedence.OR);

    public final String symbol;
    public final String displayName;
    public final int precedence;

    BooleanOperator(String symbol, String displayName, int precedence) {
        this.symbol = symbol;
        this.displayName = displayName;
        this.precedence = precedence;
    }
}
