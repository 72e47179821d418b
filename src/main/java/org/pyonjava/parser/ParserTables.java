package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.BinaryOperator;
import org.pyonjava.frontend.astnode.CompareOperator;
import org.pyonjava.frontend.astnode.Precedence;
import org.pyonjava.frontend.astnode.UnaryOperator;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.pyonjava.lexer.LexerTokenType.*;

public class ParserTables {
    // Tokens that can start an expression.
    public static final Set<LexerTokenType> EXPRESSION_START = EnumSet.of(
            NAME, NUMBER, STRING, FSTRING, LPAR, LSQB, LBRACE, MINUS, PLUS, TILDE, NOT, LAMBDA, AWAIT,
            NONE, TRUE, FALSE, ELLIPSIS, STAR, MATCH, CASE, TYPE);

    // Tokens that end a simple statement.
    public static final Set<LexerTokenType> STATEMENT_END = EnumSet.of(NEWLINE, SEMI, ENDMARKER, DEDENT);

    // Infix arithmetic and bitwise operators.
    static final Map<LexerTokenType, BinaryOperator> BINARY_OPERATORS = new EnumMap<>(LexerTokenType.class);
    // Augmented assignment operators, mapped to the operation they apply.
    static final Map<LexerTokenType, BinaryOperator> AUGMENTED_ASSIGN = new EnumMap<>(LexerTokenType.class);
    // Single-token comparison operators; "not in" and "is not" are resolved by lookahead.
    static final Map<LexerTokenType, CompareOperator> COMPARISON_OPERATORS = new EnumMap<>(LexerTokenType.class);
    // Prefix arithmetic operators.
    static final Map<LexerTokenType, UnaryOperator> UNARY_OPERATORS = new EnumMap<>(LexerTokenType.class);

    static {
        BINARY_OPERATORS.put(PLUS, BinaryOperator.ADD);
        BINARY_OPERATORS.put(MINUS, BinaryOperator.SUB);
        BINARY_OPERATORS.put(STAR, BinaryOperator.MULT);
        BINARY_OPERATORS.put(AT, BinaryOperator.MATMULT);
        BINARY_OPERATORS.put(SLASH, BinaryOperator.DIV);
        BINARY_OPERATORS.put(PERCENT, BinaryOperator.MOD);
        BINARY_OPERATORS.put(DOUBLESTAR, BinaryOperator.POW);
        BINARY_OPERATORS.put(LEFTSHIFT, BinaryOperator.LSHIFT);
        BINARY_OPERATORS.put(RIGHTSHIFT, BinaryOperator.RSHIFT);
        BINARY_OPERATORS.put(VBAR, BinaryOperator.BITOR);
        BINARY_OPERATORS.put(CIRCUMFLEX, BinaryOperator.BITXOR);
        BINARY_OPERATORS.put(AMPER, BinaryOperator.BITAND);
        BINARY_OPERATORS.put(DOUBLESLASH, BinaryOperator.FLOORDIV);

        AUGMENTED_ASSIGN.put(PLUSEQUAL, BinaryOperator.ADD);
        AUGMENTED_ASSIGN.put(MINEQUAL, BinaryOperator.SUB);
        AUGMENTED_ASSIGN.put(STAREQUAL, BinaryOperator.MULT);
        AUGMENTED_ASSIGN.put(ATEQUAL, BinaryOperator.MATMULT);
        AUGMENTED_ASSIGN.put(SLASHEQUAL, BinaryOperator.DIV);
        AUGMENTED_ASSIGN.put(PERCENTEQUAL, BinaryOperator.MOD);
        AUGMENTED_ASSIGN.put(DOUBLESTAREQUAL, BinaryOperator.POW);
        AUGMENTED_ASSIGN.put(LEFTSHIFTEQUAL, BinaryOperator.LSHIFT);
        AUGMENTED_ASSIGN.put(RIGHTSHIFTEQUAL, BinaryOperator.RSHIFT);
        AUGMENTED_ASSIGN.put(VBAREQUAL, BinaryOperator.BITOR);
        AUGMENTED_ASSIGN.put(CIRCUMFLEXEQUAL, BinaryOperator.BITXOR);
        AUGMENTED_ASSIGN.put(AMPEREQUAL, BinaryOperator.BITAND);
        AUGMENTED_ASSIGN.put(DOUBLESLASHEQUAL, BinaryOperator.FLOORDIV);

        COMPARISON_OPERATORS.put(EQEQUAL, CompareOperator.EQ);
        COMPARISON_OPERATORS.put(NOTEQUAL, CompareOperator.NOT_EQ);
        COMPARISON_OPERATORS.put(LESS, CompareOperator.LT);
        COMPARISON_OPERATORS.put(LESSEQUAL, CompareOperator.LT_E);
        COMPARISON_OPERATORS.put(GREATER, CompareOperator.GT);
        COMPARISON_OPERATORS.put(GREATEREQUAL, CompareOperator.GT_E);
        COMPARISON_OPERATORS.put(IN, CompareOperator.IN);
        COMPARISON_OPERATORS.put(IS, CompareOperator.IS);

        UNARY_OPERATORS.put(MINUS, UnaryOperator.USUB);
        UNARY_OPERATORS.put(PLUS, UnaryOperator.UADD);
        UNARY_OPERATORS.put(TILDE, UnaryOperator.INVERT);
    }

    public static boolean canStartExpression(LexerToken token) {
        return EXPRESSION_START.contains(token.type);
    }

    /**
     * Returns the precedence of the token at the current position when used as an
     * infix operator, or -1 if it is not one.
     *
     * @param parser The parser, used to look past {@code not} for {@code not in}.
     * @param token  The token at the current position.
     * @return The precedence level from {@link Precedence}, or -1.
     */
    static int infixPrecedence(Parser parser, LexerToken token) {
        switch (token.type) {
            case OR:
                return Precedence.OR;
            case AND:
                return Precedence.AND;
            case NOT:
                return TokenUtils.peek(parser, 1).type == IN ? Precedence.COMPARISON : -1;
            default:
                break;
        }
        if (COMPARISON_OPERATORS.containsKey(token.type)) {
            return Precedence.COMPARISON;
        }
        BinaryOperator operator = BINARY_OPERATORS.get(token.type);
        return operator == null ? -1 : operator.precedence;
    }
}
