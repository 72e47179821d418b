package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.ArgNode;
import org.pyonjava.frontend.astnode.ArgumentsNode;
import org.pyonjava.frontend.astnode.ExpressionNode;
import org.pyonjava.frontend.astnode.TypeParamNode;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyonjava.parser.TokenUtils.consume;
import static org.pyonjava.parser.TokenUtils.peek;

/**
 * Parses the parameter lists of functions and lambdas, and type parameter lists.
 *
 * <p>A parameter list has up to five sections, in this order:
 * <pre>
 * def f(a, b, /, c, d=1, *args, e, f=2, **kwargs): ...
 *       ^^^^ positional-only
 *                ^^^^^^ positional or keyword
 *                        ^^^^^ variadic positional (or a bare '*')
 *                               ^^^^^^ keyword-only
 *                                       ^^^^^^^^ variadic keyword
 * </pre>
 */
public class SignatureParser {

    /**
     * Parses parameters up to (not including) the closing token.
     *
     * @param parser           The parser instance.
     * @param closing          RPAR for a def, COLON for a lambda.
     * @param allowAnnotations Whether {@code name: annotation} is accepted.
     * @return The parameters.
     */
    public static ArgumentsNode parseParameters(Parser parser, LexerTokenType closing, boolean allowAnnotations) {
        int start = TokenUtils.startIndex(parser);
        List<ArgNode> posonlyargs = new ArrayList<>();
        List<ArgNode> args = new ArrayList<>();
        List<ArgNode> kwonlyargs = new ArrayList<>();
        List<ExpressionNode> kwDefaults = new ArrayList<>();
        List<ExpressionNode> defaults = new ArrayList<>();
        ArgNode vararg = null;
        ArgNode kwarg = null;
        boolean keywordOnly = false;

        while (peek(parser).type != closing) {
            LexerToken token = peek(parser);
            if (kwarg != null) {
                throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token,
                        "Parameter after '**' parameter");
            }
            switch (token.type) {
                case SLASH:
                    if (!posonlyargs.isEmpty() || keywordOnly || args.isEmpty()) {
                        throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token, "Unexpected '/' in parameter list");
                    }
                    consume(parser);
                    posonlyargs.addAll(args);
                    args.clear();
                    break;
                case STAR:
                    if (keywordOnly) {
                        throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token, "'*' can only appear once");
                    }
                    consume(parser);
                    keywordOnly = true;
                    if (peek(parser).isName()) {
                        vararg = parseParameter(parser, allowAnnotations, true);
                    }
                    break;
                case DOUBLESTAR:
                    consume(parser);
                    kwarg = parseParameter(parser, allowAnnotations, false);
                    break;
                default:
                    ArgNode arg = parseParameter(parser, allowAnnotations, false);
                    ExpressionNode defaultValue = null;
                    if (TokenUtils.consumeIf(parser, LexerTokenType.EQUAL)) {
                        defaultValue = parser.parseTest();
                    }
                    if (keywordOnly) {
                        kwonlyargs.add(arg);
                        kwDefaults.add(defaultValue);
                    } else if (defaultValue != null) {
                        args.add(arg);
                        defaults.add(defaultValue);
                    } else if (!defaults.isEmpty()) {
                        throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token,
                                "Parameter without a default follows parameter with a default");
                    } else {
                        args.add(arg);
                    }
            }
            if (peek(parser).type != closing) {
                consume(parser, LexerTokenType.COMMA);
            }
        }
        if (keywordOnly && vararg == null && kwonlyargs.isEmpty()) {
            throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, peek(parser),
                    "Named parameters must follow bare '*'");
        }
        return new ArgumentsNode(posonlyargs, args, vararg, kwonlyargs, kwDefaults, kwarg, defaults,
                TokenUtils.spanFrom(parser, start));
    }

    private static ArgNode parseParameter(Parser parser, boolean allowAnnotations, boolean starAnnotation) {
        int start = TokenUtils.startIndex(parser);
        String name = TokenUtils.consumeName(parser);
        ExpressionNode annotation = null;
        if (allowAnnotations && TokenUtils.consumeIf(parser, LexerTokenType.COLON)) {
            // def f(*args: *Ts)
            annotation = starAnnotation ? parser.parseStarExpression() : parser.parseTest();
        }
        return new ArgNode(name, annotation, TokenUtils.spanFrom(parser, start));
    }

    /**
     * Parses an optional type parameter list {@code [T, U: bound, *Ts, **P = default]}.
     *
     * @return The type parameters, empty if the next token is not '['.
     */
    public static List<TypeParamNode> parseTypeParams(Parser parser) {
        List<TypeParamNode> typeParams = new ArrayList<>();
        if (!TokenUtils.consumeIf(parser, LexerTokenType.LSQB)) {
            return typeParams;
        }
        while (!TokenUtils.consumeIf(parser, LexerTokenType.RSQB)) {
            int start = TokenUtils.startIndex(parser);
            TypeParamNode.Kind kind = TypeParamNode.Kind.TYPE_VAR;
            if (TokenUtils.consumeIf(parser, LexerTokenType.STAR)) {
                kind = TypeParamNode.Kind.TYPE_VAR_TUPLE;
            } else if (TokenUtils.consumeIf(parser, LexerTokenType.DOUBLESTAR)) {
                kind = TypeParamNode.Kind.PARAM_SPEC;
            }
            String name = TokenUtils.consumeName(parser);
            ExpressionNode bound = null;
            if (kind == TypeParamNode.Kind.TYPE_VAR && TokenUtils.consumeIf(parser, LexerTokenType.COLON)) {
                bound = parser.parseTest();
            }
            ExpressionNode defaultValue = null;
            if (TokenUtils.consumeIf(parser, LexerTokenType.EQUAL)) {
                defaultValue = kind == TypeParamNode.Kind.TYPE_VAR_TUPLE ? parser.parseStarExpression() : parser.parseTest();
            }
            typeParams.add(new TypeParamNode(kind, name, bound, defaultValue, TokenUtils.spanFrom(parser, start)));
            if (peek(parser).type != LexerTokenType.RSQB) {
                consume(parser, LexerTokenType.COMMA);
            }
        }
        if (typeParams.isEmpty()) {
            throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, TokenUtils.previous(parser),
                    "Type parameter list cannot be empty");
        }
        return typeParams;
    }
}
