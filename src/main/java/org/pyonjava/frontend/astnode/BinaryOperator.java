package org.pyonjava.frontend.astnode;

/**
 * Binary arithmetic and bitwise operators.
 */
public enum BinaryOperator {
    ADD("+", "Add", Precedence.ARITH),
    SUB("-", "Sub", Precedence.ARITH),
    MULT("*", "Mult", Precedence.TERM),
    MATMULT("@", "MatMult", Precedence.TERM),
    DIV("/", "Div", Precedence.TERM),
    MOD("%", "Mod", Precedence.TERM),
    POW("**", "Pow", Precedence.POWER),
    LSHIFT("<<", "LShift", Precedence.SHIFT),
    RSHIFT(">>", "RShift", Precedence.SHIFT),
    BITOR("|", "BitOr", Precedence.BIT_OR),
    BITXOR("^", "BitXor", Precedence.BIT_XOR),
    BITAND("&", "BitAnd", Precedence.BIT_AND),
    FLOORDIV("//", "FloorDiv", Precedence.TERM);

    public final String symbol;
    public final String displayName;
    public final int precedence;

    BinaryOperator(String symbol, String displayName, int precedence) {
        this.symbol = symbol;
        this.displayName = displayName;
        this.precedence = precedence;
    }

    /**
     * Only {@code **} groups to the right.
     */
    public boolean isRightAssociative() {
        return this == POW;
    }
}
