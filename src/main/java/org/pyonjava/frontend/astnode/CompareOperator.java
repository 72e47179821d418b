package org.pyonjava.frontend.astnode;

/**
 * Comparison operators. All of them share one precedence level and chain:
 * {@code a < b < c} is a single comparison with two operators.
 */
public enum CompareOperator {
    EQ("==", "Eq"),
    NOT_EQ("!=", "NotEq"),
    LT("<", "Lt"),
    LT_E("<=", "LtE"),
    GT(">", "Gt"),
    GT_E(">=", "GtE"),
    IS("is", "Is"),
    IS_NOT("is not", "IsNot"),
    IN("in", "In"),
    NOT_IN("not in", "NotIn");

    public final String symbol;
    public final String displayName;

    CompareOperator(String symbol, String displayName) {
        this.symbol = symbol;
        this.displayName = displayName;
    }
}
