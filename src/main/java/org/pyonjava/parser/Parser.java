package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.ExprContext;
import org.pyonjava.frontend.astnode.ExpressionNode;
import org.pyonjava.frontend.astnode.IfExpNode;
import org.pyonjava.frontend.astnode.ModuleNode;
import org.pyonjava.frontend.astnode.NameNode;
import org.pyonjava.frontend.astnode.NamedExprNode;
import org.pyonjava.frontend.astnode.Precedence;
import org.pyonjava.frontend.astnode.StarredNode;
import org.pyonjava.frontend.astnode.TupleNode;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyonjava.parser.TokenUtils.peek;

/**
 * The Parser class is responsible for parsing a list of tokens into an abstract syntax tree (AST).
 * <p>
 * Statements are parsed by recursive descent (see {@link ParseStatement} and
 * {@link StatementParser}). Binary, boolean and comparison operators are parsed by
 * precedence climbing over the levels of {@link Precedence}; prefix operators and
 * postfix call, subscript and attribute access are handled by {@link ParsePrimary}.
 * <p>
 * The token list is consumed once, left to right. The first syntax error aborts the
 * parse with a {@link ParseException}.
 */
public class Parser {
    // Context with the options and the error formatter.
    public final ParserContext ctx;
    // List of tokens to be parsed.
    public final List<LexerToken> tokens;
    // Current index in the token list.
    public int tokenIndex = 0;

    /**
     * Constructs a Parser with the given context and tokens.
     *
     * @param ctx    The parser context.
     * @param tokens The list of tokens to parse, terminated by ENDMARKER.
     */
    public Parser(ParserContext ctx, List<LexerToken> tokens) {
        this.ctx = ctx;
        this.tokens = tokens;
    }

    /**
     * Parses the tokens into a module.
     *
     * @return The root node of the parsed AST.
     * @throws ParseException at the first syntax error.
     */
    public ModuleNode parse() {
        ModuleNode module = ParseBlock.parseModule(this);
        ctx.logDebug("parse: " + module.body.size() + " top-level statements");
        return module;
    }

    /**
     * Parses an expression based on operator precedence.
     * <p>
     * Higher precedence means tighter: `*` has higher precedence than `+`.
     * Only operators whose precedence is greater than {@code precedence} are consumed.
     * <p>
     * Explanation of the  <a href="https://en.wikipedia.org/wiki/Operator-precedence_parser">precedence climbing method</a>
     * can be found in Wikipedia.
     * </p>
     *
     * @param precedence The precedence level of the current expression.
     * @return The root node of the parsed expression.
     */
    public ExpressionNode parseExpression(int precedence) {
        int start = TokenUtils.startIndex(this);
        // First, parse the operand, including prefix operators that bind at this level.
        ExpressionNode left = ParsePrimary.parsePrimary(this, precedence);

        while (true) {
            LexerToken token = peek(this);
            int tokenPrecedence = ParserTables.infixPrecedence(this, token);
            // Stop at anything that is not an operator binding tighter than the current level.
            if (tokenPrecedence <= precedence) {
                break;
            }
            ctx.logDebug("parseExpression `" + token.text + "` precedence: " + tokenPrecedence);
            left = ParseInfix.parseInfixOperation(this, left, tokenPrecedence, start);
        }
        return left;
    }

    /**
     * Parses a full expression without tuples: a lambda, a conditional expression, or
     * anything binding tighter.
     */
    public ExpressionNode parseTest() {
        if (peek(this).type == LexerTokenType.LAMBDA) {
            return ParsePrimary.parseLambda(this);
        }
        int start = TokenUtils.startIndex(this);
        ExpressionNode body = parseExpression(Precedence.TEST);
        if (peek(this).type != LexerTokenType.IF) {
            return body;
        }
        TokenUtils.consume(this);
        ExpressionNode test = parseExpression(Precedence.TEST);
        TokenUtils.consume(this, LexerTokenType.ELSE);
        ExpressionNode orElse = parseTest();
        return new IfExpNode(test, body, orElse, TokenUtils.spanFrom(this, start));
    }

    /**
     * Parses an expression that may be an assignment expression {@code name := value}.
     */
    public ExpressionNode parseNamedExpressionTest() {
        LexerToken token = peek(this);
        if (token.isName() && TokenUtils.peek(this, 1).type == LexerTokenType.COLONEQUAL) {
            int start = TokenUtils.startIndex(this);
            TokenUtils.consume(this);
            NameNode target = new NameNode(token.text, ExprContext.STORE, TokenUtils.spanFrom(this, start));
            TokenUtils.consume(this, LexerTokenType.COLONEQUAL);
            ExpressionNode value = parseTest();
            return new NamedExprNode(target, value, TokenUtils.spanFrom(this, start));
        }
        return parseTest();
    }

    /**
     * Parses an expression that may be starred, as an element of a tuple or an
     * assignment value: {@code *rest}.
     */
    public ExpressionNode parseStarExpression() {
        if (peek(this).type == LexerTokenType.STAR) {
            int start = TokenUtils.startIndex(this);
            TokenUtils.consume(this);
            ExpressionNode value = parseExpression(Precedence.BIT_OR - 1);
            return new StarredNode(value, ExprContext.LOAD, TokenUtils.spanFrom(this, start));
        }
        return parseTest();
    }

    /**
     * Like {@link #parseStarExpression()} but also accepts assignment expressions, as
     * in list, set and parenthesized displays.
     */
    public ExpressionNode parseStarNamedExpression() {
        if (peek(this).type == LexerTokenType.STAR) {
            return parseStarExpression();
        }
        return parseNamedExpressionTest();
    }

    /**
     * Parses a comma-separated list of starred expressions. A single expression without
     * a trailing comma is returned unchanged; otherwise the result is a tuple.
     */
    public ExpressionNode parseStarExpressions() {
        int start = TokenUtils.startIndex(this);
        ExpressionNode first = parseStarExpression();
        if (peek(this).type != LexerTokenType.COMMA) {
            return first;
        }
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        while (TokenUtils.consumeIf(this, LexerTokenType.COMMA)) {
            if (!ParserTables.canStartExpression(peek(this))) {
                break;
            }
            elements.add(parseStarExpression());
        }
        return new TupleNode(elements, ExprContext.LOAD, TokenUtils.spanFrom(this, start));
    }

    /**
     * Creates an exception for an error at the given token.
     */
    public ParseException error(ParseException.Kind kind, LexerToken token, String message) {
        return new ParseException(kind, token.line, token.column, message, ctx.errorUtil);
    }

    /**
     * Creates an exception for an error at the given position, such as the start of a
     * node that turned out to be invalid.
     */
    public ParseException error(ParseException.Kind kind, int line, int column, String message) {
        return new ParseException(kind, line, column, message, ctx.errorUtil);
    }

    /**
     * Creates an "unexpected token" error at the current position.
     */
    public ParseException unexpected() {
        LexerToken token = peek(this);
        if (token.type == LexerTokenType.INDENT) {
            return error(ParseException.Kind.UNEXPECTED_TOKEN, token, "Unexpected indent");
        }
        return error(ParseException.Kind.UNEXPECTED_TOKEN, token, "Unexpected token " + TokenUtils.describe(token));
    }
}
