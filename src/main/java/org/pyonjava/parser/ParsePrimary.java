package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.ArgumentsNode;
import org.pyonjava.frontend.astnode.AttributeNode;
import org.pyonjava.frontend.astnode.AwaitNode;
import org.pyonjava.frontend.astnode.ComprehensionNode;
import org.pyonjava.frontend.astnode.ConstantNode;
import org.pyonjava.frontend.astnode.DictCompNode;
import org.pyonjava.frontend.astnode.DictNode;
import org.pyonjava.frontend.astnode.ExprContext;
import org.pyonjava.frontend.astnode.ExpressionNode;
import org.pyonjava.frontend.astnode.GeneratorExpNode;
import org.pyonjava.frontend.astnode.LambdaNode;
import org.pyonjava.frontend.astnode.ListCompNode;
import org.pyonjava.frontend.astnode.ListNode;
import org.pyonjava.frontend.astnode.NameNode;
import org.pyonjava.frontend.astnode.Precedence;
import org.pyonjava.frontend.astnode.SetCompNode;
import org.pyonjava.frontend.astnode.SetNode;
import org.pyonjava.frontend.astnode.TupleNode;
import org.pyonjava.frontend.astnode.UnaryOpNode;
import org.pyonjava.frontend.astnode.UnaryOperator;
import org.pyonjava.frontend.astnode.YieldFromNode;
import org.pyonjava.frontend.astnode.YieldNode;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyonjava.parser.TokenUtils.consume;
import static org.pyonjava.parser.TokenUtils.peek;

/**
 * The ParsePrimary class is responsible for parsing primary expressions.
 *
 * <p>Primary expressions are the operands of the infix operators:
 * <ul>
 *   <li>Prefix operators ({@code not}, unary {@code + - ~}, {@code await})</li>
 *   <li>Atoms (names, literals, parenthesized forms, displays and comprehensions)</li>
 *   <li>Postfix operations (call, subscript and attribute access), chained left to right</li>
 * </ul>
 *
 * <p>A prefix operator is only accepted when it binds tighter than the level the
 * caller is parsing at, so {@code a == not b} is rejected while {@code a == -b} is not.
 *
 * @see Parser
 */
public class ParsePrimary {

    /**
     * Parses a primary expression from the parser's token stream.
     *
     * @param parser     The parser instance.
     * @param precedence The level of the enclosing expression.
     * @return The parsed operand.
     * @throws ParseException if the next token cannot start an operand at this level.
     */
    public static ExpressionNode parsePrimary(Parser parser, int precedence) {
        int start = TokenUtils.startIndex(parser);
        LexerToken token = peek(parser);

        switch (token.type) {
            case NOT:
                if (Precedence.NOT <= precedence) {
                    throw parser.unexpected();
                }
                consume(parser);
                ExpressionNode negated = parser.parseExpression(Precedence.NOT - 1);
                return new UnaryOpNode(UnaryOperator.NOT, negated, TokenUtils.spanFrom(parser, start));
            case MINUS:
            case PLUS:
            case TILDE:
                if (Precedence.FACTOR <= precedence) {
                    throw parser.unexpected();
                }
                consume(parser);
                // Only ** binds tighter than a unary operator: -2 ** 2 is -(2 ** 2)
                ExpressionNode operand = parser.parseExpression(Precedence.FACTOR - 1);
                return new UnaryOpNode(ParserTables.UNARY_OPERATORS.get(token.type), operand,
                        TokenUtils.spanFrom(parser, start));
            case AWAIT:
                if (Precedence.AWAIT <= precedence) {
                    throw parser.unexpected();
                }
                consume(parser);
                ExpressionNode awaited = parsePostfix(parser, parseAtom(parser), start);
                return new AwaitNode(awaited, TokenUtils.spanFrom(parser, start));
            default:
                return parsePostfix(parser, parseAtom(parser), start);
        }
    }

    /**
     * Parses call, subscript and attribute suffixes following an atom.
     */
    static ExpressionNode parsePostfix(Parser parser, ExpressionNode expression, int start) {
        while (true) {
            LexerToken token = peek(parser);
            switch (token.type) {
                case LPAR:
                    expression = ListParser.parseCall(parser, expression, start);
                    break;
                case LSQB:
                    expression = ListParser.parseSubscript(parser, expression, start);
                    break;
                case DOT:
                    consume(parser);
                    String attribute = TokenUtils.consumeName(parser);
                    expression = new AttributeNode(expression, attribute, ExprContext.LOAD,
                            TokenUtils.spanFrom(parser, start));
                    break;
                default:
                    return expression;
            }
        }
    }

    /**
     * Parses an atom: a name, a literal, or a bracketed form.
     */
    static ExpressionNode parseAtom(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        LexerToken token = peek(parser);

        if (token.isName()) {
            consume(parser);
            return new NameNode(token.text, ExprContext.LOAD, TokenUtils.spanFrom(parser, start));
        }
        switch (token.type) {
            case NUMBER:
                consume(parser);
                return NumberParser.parseNumber(parser, token);
            case STRING:
            case FSTRING:
                return StringParser.parseStrings(parser);
            case NONE:
                consume(parser);
                return ConstantNode.none(TokenUtils.spanFrom(parser, start));
            case TRUE:
            case FALSE:
                consume(parser);
                return ConstantNode.ofBoolean(token.type == LexerTokenType.TRUE, TokenUtils.spanFrom(parser, start));
            case ELLIPSIS:
                consume(parser);
                return ConstantNode.ellipsis(TokenUtils.spanFrom(parser, start));
            case LPAR:
                return parseParenthesized(parser);
            case LSQB:
                return parseList(parser);
            case LBRACE:
                return parseDictOrSet(parser);
            default:
                throw parser.unexpected();
        }
    }

    /**
     * Parses {@code ( ... )}: the empty tuple, a parenthesized expression, a tuple, a
     * generator expression or a parenthesized yield.
     */
    private static ExpressionNode parseParenthesized(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.LPAR);

        if (TokenUtils.consumeIf(parser, LexerTokenType.RPAR)) {
            return new TupleNode(List.of(), ExprContext.LOAD, TokenUtils.spanFrom(parser, start));
        }
        if (peek(parser).type == LexerTokenType.YIELD) {
            ExpressionNode yield = parseYield(parser);
            consume(parser, LexerTokenType.RPAR);
            return yield;
        }

        ExpressionNode first = parser.parseStarNamedExpression();
        if (isComprehensionStart(parser)) {
            List<ComprehensionNode> generators = parseComprehensionClauses(parser);
            consume(parser, LexerTokenType.RPAR);
            return new GeneratorExpNode(first, generators, TokenUtils.spanFrom(parser, start));
        }
        if (TokenUtils.consumeIf(parser, LexerTokenType.RPAR)) {
            return first;
        }

        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        parseElements(parser, elements, LexerTokenType.RPAR);
        return new TupleNode(elements, ExprContext.LOAD, TokenUtils.spanFrom(parser, start));
    }

    private static ExpressionNode parseList(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.LSQB);

        List<ExpressionNode> elements = new ArrayList<>();
        if (TokenUtils.consumeIf(parser, LexerTokenType.RSQB)) {
            return new ListNode(elements, ExprContext.LOAD, TokenUtils.spanFrom(parser, start));
        }
        ExpressionNode first = parser.parseStarNamedExpression();
        if (isComprehensionStart(parser)) {
            List<ComprehensionNode> generators = parseComprehensionClauses(parser);
            consume(parser, LexerTokenType.RSQB);
            return new ListCompNode(first, generators, TokenUtils.spanFrom(parser, start));
        }
        elements.add(first);
        if (!TokenUtils.consumeIf(parser, LexerTokenType.RSQB)) {
            parseElements(parser, elements, LexerTokenType.RSQB);
        }
        return new ListNode(elements, ExprContext.LOAD, TokenUtils.spanFrom(parser, start));
    }

    /**
     * Parses {@code , elt , elt ... close} after the first element of a display.
     */
    private static void parseElements(Parser parser, List<ExpressionNode> elements, LexerTokenType close) {
        while (true) {
            if (TokenUtils.consumeIf(parser, close)) {
                return;
            }
            consume(parser, LexerTokenType.COMMA);
            if (TokenUtils.consumeIf(parser, close)) {
                return;
            }
            elements.add(parser.parseStarNamedExpression());
        }
    }

    /**
     * Parses a dict or set display or comprehension. {@code {}} is an empty dict.
     * A {@code **mapping} entry is stored with a null key.
     */
    private static ExpressionNode parseDictOrSet(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.LBRACE);

        List<ExpressionNode> keys = new ArrayList<>();
        List<ExpressionNode> values = new ArrayList<>();
        if (TokenUtils.consumeIf(parser, LexerTokenType.RBRACE)) {
            return new DictNode(keys, values, TokenUtils.spanFrom(parser, start));
        }

        if (peek(parser).type == LexerTokenType.DOUBLESTAR
                || (peek(parser).type != LexerTokenType.STAR && isDictEntry(parser))) {
            parseDictEntry(parser, keys, values);
            if (keys.get(0) != null && isComprehensionStart(parser)) {
                List<ComprehensionNode> generators = parseComprehensionClauses(parser);
                consume(parser, LexerTokenType.RBRACE);
                return new DictCompNode(keys.get(0), values.get(0), generators, TokenUtils.spanFrom(parser, start));
            }
            while (!TokenUtils.consumeIf(parser, LexerTokenType.RBRACE)) {
                consume(parser, LexerTokenType.COMMA);
                if (TokenUtils.consumeIf(parser, LexerTokenType.RBRACE)) {
                    break;
                }
                parseDictEntry(parser, keys, values);
            }
            return new DictNode(keys, values, TokenUtils.spanFrom(parser, start));
        }

        ExpressionNode first = parser.parseStarNamedExpression();
        if (isComprehensionStart(parser)) {
            List<ComprehensionNode> generators = parseComprehensionClauses(parser);
            consume(parser, LexerTokenType.RBRACE);
            return new SetCompNode(first, generators, TokenUtils.spanFrom(parser, start));
        }
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        parseElements(parser, elements, LexerTokenType.RBRACE);
        return new SetNode(elements, TokenUtils.spanFrom(parser, start));
    }

    // Looks ahead for the ':' that makes the first element a dict key
    private static boolean isDictEntry(Parser parser) {
        int depth = 0;
        for (int offset = 0; ; offset++) {
            LexerToken token = TokenUtils.peek(parser, offset);
            switch (token.type) {
                case LPAR, LSQB, LBRACE -> depth++;
                case RPAR, RSQB, RBRACE -> {
                    if (depth == 0) {
                        return false;
                    }
                    depth--;
                }
                case COLON -> {
                    if (depth == 0) {
                        return true;
                    }
                }
                case COMMA, FOR -> {
                    if (depth == 0) {
                        return false;
                    }
                }
                case LAMBDA -> {
                    // The ':' of a lambda belongs to it
                    if (depth == 0) {
                        return false;
                    }
                }
                case NEWLINE, ENDMARKER -> {
                    return false;
                }
                default -> {
                }
            }
        }
    }

    private static void parseDictEntry(Parser parser, List<ExpressionNode> keys, List<ExpressionNode> values) {
        if (TokenUtils.consumeIf(parser, LexerTokenType.DOUBLESTAR)) {
            keys.add(null);
            values.add(parser.parseExpression(Precedence.BIT_OR - 1));
            return;
        }
        keys.add(parser.parseTest());
        consume(parser, LexerTokenType.COLON);
        values.add(parser.parseTest());
    }

    static boolean isComprehensionStart(Parser parser) {
        LexerTokenType type = peek(parser).type;
        return type == LexerTokenType.FOR
                || (type == LexerTokenType.ASYNC && TokenUtils.peek(parser, 1).type == LexerTokenType.FOR);
    }

    /**
     * Parses one or more {@code [async] for target in iter [if cond]...} clauses.
     */
    static List<ComprehensionNode> parseComprehensionClauses(Parser parser) {
        List<ComprehensionNode> generators = new ArrayList<>();
        while (isComprehensionStart(parser)) {
            int start = TokenUtils.startIndex(parser);
            boolean isAsync = TokenUtils.consumeIf(parser, LexerTokenType.ASYNC);
            consume(parser, LexerTokenType.FOR);
            ExpressionNode target = ListParser.parseTargetList(parser);
            consume(parser, LexerTokenType.IN);
            ExpressionNode iter = parser.parseExpression(Precedence.TEST);
            List<ExpressionNode> ifs = new ArrayList<>();
            while (TokenUtils.consumeIf(parser, LexerTokenType.IF)) {
                ifs.add(parser.parseExpression(Precedence.TEST));
            }
            generators.add(new ComprehensionNode(target, iter, ifs, isAsync, TokenUtils.spanFrom(parser, start)));
        }
        parser.ctx.logDebug("comprehension: " + generators.size() + " clauses");
        return generators;
    }

    /**
     * Parses {@code lambda params: body}. Lambda parameters take no annotations.
     */
    static ExpressionNode parseLambda(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.LAMBDA);
        ArgumentsNode args = SignatureParser.parseParameters(parser, LexerTokenType.COLON, false);
        consume(parser, LexerTokenType.COLON);
        ExpressionNode body = parser.parseTest();
        return new LambdaNode(args, body, TokenUtils.spanFrom(parser, start));
    }

    /**
     * Parses {@code yield}, {@code yield value(s)} or {@code yield from value}.
     */
    static ExpressionNode parseYield(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.YIELD);
        if (TokenUtils.consumeIf(parser, LexerTokenType.FROM)) {
            ExpressionNode value = parser.parseTest();
            return new YieldFromNode(value, TokenUtils.spanFrom(parser, start));
        }
        ExpressionNode value = null;
        if (ParserTables.canStartExpression(peek(parser))) {
            value = parser.parseStarExpressions();
        }
        return new YieldNode(value, TokenUtils.spanFrom(parser, start));
    }
}
