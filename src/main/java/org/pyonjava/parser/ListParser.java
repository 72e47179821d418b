package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.CallNode;
import org.pyonjava.frontend.astnode.ComprehensionNode;
import org.pyonjava.frontend.astnode.ExprContext;
import org.pyonjava.frontend.astnode.ExpressionNode;
import org.pyonjava.frontend.astnode.GeneratorExpNode;
import org.pyonjava.frontend.astnode.KeywordNode;
import org.pyonjava.frontend.astnode.Precedence;
import org.pyonjava.frontend.astnode.SliceNode;
import org.pyonjava.frontend.astnode.StarredNode;
import org.pyonjava.frontend.astnode.SubscriptNode;
import org.pyonjava.frontend.astnode.TupleNode;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyonjava.parser.TokenUtils.consume;
import static org.pyonjava.parser.TokenUtils.peek;

/**
 * Parses comma-separated lists: call arguments, subscripts with slices, and the
 * target lists of {@code for} loops and comprehensions.
 */
public class ListParser {

    /**
     * Holds the positional and keyword arguments of a call or a class header.
     */
    public static class CallArguments {
        public final List<ExpressionNode> args = new ArrayList<>();
        public final List<KeywordNode> keywords = new ArrayList<>();
    }

    /**
     * Parses a call {@code func(args)} with the opening parenthesis at the current
     * position.
     */
    static ExpressionNode parseCall(Parser parser, ExpressionNode func, int start) {
        CallArguments arguments = parseCallArguments(parser);
        return new CallNode(func, arguments.args, arguments.keywords, TokenUtils.spanFrom(parser, start));
    }

    /**
     * Parses {@code ( arguments )}.
     * <p>
     * Each argument is one of {@code value}, {@code *iterable}, {@code name=value} or
     * {@code **mapping}; the last one is a keyword with a null name. A generator
     * expression is accepted without its own parentheses: {@code f(x for x in y)}.
     *
     * @throws ParseException if an argument is not followed by ',' or ')'
     */
    public static CallArguments parseCallArguments(Parser parser) {
        CallArguments arguments = new CallArguments();
        consume(parser, LexerTokenType.LPAR);

        while (!TokenUtils.consumeIf(parser, LexerTokenType.RPAR)) {
            int start = TokenUtils.startIndex(parser);
            LexerToken token = peek(parser);
            if (token.type == LexerTokenType.STAR) {
                consume(parser);
                ExpressionNode value = parser.parseTest();
                arguments.args.add(new StarredNode(value, ExprContext.LOAD, TokenUtils.spanFrom(parser, start)));
            } else if (token.type == LexerTokenType.DOUBLESTAR) {
                consume(parser);
                ExpressionNode value = parser.parseTest();
                arguments.keywords.add(new KeywordNode(null, value, TokenUtils.spanFrom(parser, start)));
            } else if (token.isName() && TokenUtils.peek(parser, 1).type == LexerTokenType.EQUAL) {
                // EQEQUAL is a different token, so f(a == b) is a positional argument
                consume(parser);
                consume(parser, LexerTokenType.EQUAL);
                ExpressionNode value = parser.parseTest();
                arguments.keywords.add(new KeywordNode(token.text, value, TokenUtils.spanFrom(parser, start)));
            } else {
                ExpressionNode value = parser.parseNamedExpressionTest();
                if (ParsePrimary.isComprehensionStart(parser)) {
                    List<ComprehensionNode> generators = ParsePrimary.parseComprehensionClauses(parser);
                    value = new GeneratorExpNode(value, generators, TokenUtils.spanFrom(parser, start));
                }
                arguments.args.add(value);
            }

            if (peek(parser).type == LexerTokenType.RPAR) {
                continue;
            }
            if (!TokenUtils.consumeIf(parser, LexerTokenType.COMMA)) {
                throw parser.error(ParseException.Kind.EXPECTED_TOKEN, peek(parser),
                        "Expected ',' or ')' in function call but got " + TokenUtils.describe(peek(parser)));
            }
        }
        return arguments;
    }

    /**
     * Parses a subscript {@code value[...]} with the opening bracket at the current
     * position. Several comma-separated items form a tuple index; each item may be a
     * slice.
     */
    static ExpressionNode parseSubscript(Parser parser, ExpressionNode value, int start) {
        consume(parser, LexerTokenType.LSQB);
        int indexStart = TokenUtils.startIndex(parser);

        ExpressionNode first = parseSliceItem(parser);
        ExpressionNode index = first;
        if (peek(parser).type == LexerTokenType.COMMA) {
            List<ExpressionNode> items = new ArrayList<>();
            items.add(first);
            while (TokenUtils.consumeIf(parser, LexerTokenType.COMMA)) {
                if (peek(parser).type == LexerTokenType.RSQB) {
                    break;
                }
                items.add(parseSliceItem(parser));
            }
            index = new TupleNode(items, ExprContext.LOAD, TokenUtils.spanFrom(parser, indexStart));
        }
        consume(parser, LexerTokenType.RSQB);
        return new SubscriptNode(value, index, ExprContext.LOAD, TokenUtils.spanFrom(parser, start));
    }

    // lower:upper:step with every part optional, or a plain index
    private static ExpressionNode parseSliceItem(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        ExpressionNode lower = null;
        if (peek(parser).type != LexerTokenType.COLON) {
            lower = parser.parseStarNamedExpression();
            if (peek(parser).type != LexerTokenType.COLON) {
                return lower;
            }
        }
        consume(parser, LexerTokenType.COLON);
        ExpressionNode upper = null;
        ExpressionNode step = null;
        if (!isSliceBoundaryEnd(parser) && peek(parser).type != LexerTokenType.COLON) {
            upper = parser.parseTest();
        }
        if (TokenUtils.consumeIf(parser, LexerTokenType.COLON) && !isSliceBoundaryEnd(parser)) {
            step = parser.parseTest();
        }
        return new SliceNode(lower, upper, step, TokenUtils.spanFrom(parser, start));
    }

    private static boolean isSliceBoundaryEnd(Parser parser) {
        LexerTokenType type = peek(parser).type;
        return type == LexerTokenType.COMMA || type == LexerTokenType.RSQB;
    }

    /**
     * Parses the target of a {@code for} loop or comprehension clause, stopping before
     * {@code in}. Several comma-separated targets form a tuple. The result has Store
     * context.
     */
    static ExpressionNode parseTargetList(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        ExpressionNode first = parseTarget(parser);
        ExpressionNode target = first;
        if (peek(parser).type == LexerTokenType.COMMA) {
            List<ExpressionNode> elements = new ArrayList<>();
            elements.add(first);
            while (TokenUtils.consumeIf(parser, LexerTokenType.COMMA)) {
                if (peek(parser).type == LexerTokenType.IN) {
                    break;
                }
                elements.add(parseTarget(parser));
            }
            target = new TupleNode(elements, ExprContext.LOAD, TokenUtils.spanFrom(parser, start));
        }
        return ParserNodeUtils.toTarget(parser, target, ExprContext.STORE);
    }

    private static ExpressionNode parseTarget(Parser parser) {
        if (peek(parser).type == LexerTokenType.STAR) {
            int start = TokenUtils.startIndex(parser);
            consume(parser);
            ExpressionNode value = parser.parseExpression(Precedence.BIT_OR - 1);
            return new StarredNode(value, ExprContext.LOAD, TokenUtils.spanFrom(parser, start));
        }
        // Stops at 'in', which is a comparison operator
        return parser.parseExpression(Precedence.BIT_OR - 1);
    }
}
