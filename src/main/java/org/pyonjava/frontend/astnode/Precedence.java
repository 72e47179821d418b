package org.pyonjava.frontend.astnode;

/**
 * Binding strength of the expression forms, lowest to highest.
 * <p>
 * The parser climbs these levels and the generator uses them to decide where
 * parentheses are required: an operand whose level is lower than the level its
 * position demands must be parenthesized.
 */
public final class Precedence {
    // Bare yield; only an expression statement or an assigned value may hold one
    public static final int YIELD = -2;
    // Assignment expression; always parenthesized when nested
    public static final int NAMED_EXPR = -1;
    // Bare tuples
    public static final int TUPLE = 0;
    // Lambda and conditional expression
    public static final int TEST = 1;
    public static final int OR = 2;
    public static final int AND = 3;
    public static final int NOT = 4;
    public static final int COMPARISON = 5;
    public static final int BIT_OR = 6;
    public static final int BIT_XOR = 7;
    public static final int BIT_AND = 8;
    public static final int SHIFT = 9;
    public static final int ARITH = 10;
    public static final int TERM = 11;
    // Unary + - ~
    public static final int FACTOR = 12;
    public static final int POWER = 13;
    public static final int AWAIT = 14;
    public static final int ATOM = 15;

    // Prevent instantiation
    private Precedence() {
    }
}
