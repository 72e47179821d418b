package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.BinOpNode;
import org.pyonjava.frontend.astnode.BinaryOperator;
import org.pyonjava.frontend.astnode.BoolOpNode;
import org.pyonjava.frontend.astnode.BooleanOperator;
import org.pyonjava.frontend.astnode.CompareNode;
import org.pyonjava.frontend.astnode.CompareOperator;
import org.pyonjava.frontend.astnode.ExpressionNode;
import org.pyonjava.frontend.astnode.Precedence;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyonjava.parser.TokenUtils.consume;
import static org.pyonjava.parser.TokenUtils.peek;

/**
 * The ParseInfix class is responsible for parsing infix operations: boolean
 * operators, comparison chains and binary arithmetic and bitwise operators.
 */
public class ParseInfix {

    /**
     * Parses an infix operator and its right-hand operand.
     *
     * @param parser     The parser instance used for parsing.
     * @param left       The left-hand operand of the infix operation.
     * @param precedence The precedence of the operator at the current position.
     * @param start      Index of the first token of the left operand.
     * @return A node representing the parsed infix operation.
     */
    public static ExpressionNode parseInfixOperation(Parser parser, ExpressionNode left, int precedence, int start) {
        LexerToken token = peek(parser);

        switch (token.type) {
            case OR:
                return parseBoolOp(parser, BooleanOperator.OR, LexerTokenType.OR, left, start);
            case AND:
                return parseBoolOp(parser, BooleanOperator.AND, LexerTokenType.AND, left, start);
            default:
                break;
        }

        if (precedence == Precedence.COMPARISON) {
            return parseComparison(parser, left, start);
        }

        consume(parser);
        BinaryOperator operator = ParserTables.BINARY_OPERATORS.get(token.type);
        ExpressionNode right;
        if (operator.isRightAssociative()) {
            // The right operand of ** is a unary expression, so -x is allowed there
            right = parser.parseExpression(Precedence.FACTOR - 1);
        } else {
            right = parser.parseExpression(precedence);
        }
        return new BinOpNode(left, operator, right, TokenUtils.spanFrom(parser, start));
    }

    // a or b or c is a single node with three values
    private static ExpressionNode parseBoolOp(Parser parser, BooleanOperator operator, LexerTokenType tokenType,
                                              ExpressionNode left, int start) {
        List<ExpressionNode> values = new ArrayList<>();
        values.add(left);
        while (TokenUtils.consumeIf(parser, tokenType)) {
            values.add(parser.parseExpression(operator.precedence));
        }
        return new BoolOpNode(operator, values, TokenUtils.spanFrom(parser, start));
    }

    /**
     * Parses a chain of comparisons such as {@code a < b <= c} into one CompareNode.
     */
    private static ExpressionNode parseComparison(Parser parser, ExpressionNode left, int start) {
        List<CompareOperator> operators = new ArrayList<>();
        List<ExpressionNode> comparators = new ArrayList<>();
        CompareOperator operator;
        while ((operator = consumeComparisonOperator(parser)) != null) {
            operators.add(operator);
            comparators.add(parser.parseExpression(Precedence.COMPARISON));
        }
        return new CompareNode(left, operators, comparators, TokenUtils.spanFrom(parser, start));
    }

    private static CompareOperator consumeComparisonOperator(Parser parser) {
        LexerToken token = peek(parser);
        if (token.type == LexerTokenType.NOT) {
            if (TokenUtils.peek(parser, 1).type != LexerTokenType.IN) {
                return null;
            }
            consume(parser);
            consume(parser);
            return CompareOperator.NOT_IN;
        }
        CompareOperator operator = ParserTables.COMPARISON_OPERATORS.get(token.type);
        if (operator == null) {
            return null;
        }
        consume(parser);
        if (operator == CompareOperator.IS && TokenUtils.consumeIf(parser, LexerTokenType.NOT)) {
            return CompareOperator.IS_NOT;
        }
        return operator;
    }
}
