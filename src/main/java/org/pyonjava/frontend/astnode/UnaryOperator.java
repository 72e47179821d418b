package org.pyonjava.frontend.astnode;

public enum UnaryOperator {
    INVERT("~", "Invert", Precedence.FACTOR),
    NOT("not", "Not", Precedence.NOT),
    UADD("+", "UAdd", Precedence.FACTOR),
    USUB("-", "USub", Precedence.FACTOR);

    public final String symbol;
    public final String displayName;
    public final int precedence;

    UnaryOperator(String symbol, String displayName, int precedence) {
        this.symbol = symbol;
        this.displayName = displayName;
        this.precedence = precedence;
    }
}
