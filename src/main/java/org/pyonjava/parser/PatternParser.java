package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.AttributeNode;
import org.pyonjava.frontend.astnode.BinOpNode;
import org.pyonjava.frontend.astnode.BinaryOperator;
import org.pyonjava.frontend.astnode.ConstantNode;
import org.pyonjava.frontend.astnode.ExprContext;
import org.pyonjava.frontend.astnode.ExpressionNode;
import org.pyonjava.frontend.astnode.MatchAsNode;
import org.pyonjava.frontend.astnode.MatchClassNode;
import org.pyonjava.frontend.astnode.MatchMappingNode;
import org.pyonjava.frontend.astnode.MatchOrNode;
import org.pyonjava.frontend.astnode.MatchSequenceNode;
import org.pyonjava.frontend.astnode.MatchSingletonNode;
import org.pyonjava.frontend.astnode.MatchStarNode;
import org.pyonjava.frontend.astnode.MatchValueNode;
import org.pyonjava.frontend.astnode.NameNode;
import org.pyonjava.frontend.astnode.PatternNode;
import org.pyonjava.frontend.astnode.UnaryOpNode;
import org.pyonjava.frontend.astnode.UnaryOperator;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyonjava.parser.TokenUtils.consume;
import static org.pyonjava.parser.TokenUtils.peek;

/**
 * Parses the patterns of {@code case} clauses.
 *
 * <pre>
 * case 1 | -2 | 3 + 4j         value patterns joined by '|'
 * case None | True             singletons
 * case [first, *rest]          sequence with a star capture
 * case {"k": v, **others}      mapping with a double-star capture
 * case Point(x, y=0)           class pattern with keyword patterns
 * case Color.RED               dotted value pattern
 * case (a, b) as pair          'as' capture
 * case _                       wildcard
 * </pre>
 */
public class PatternParser {

    private static final String WILDCARD = "_";

    /**
     * Parses the pattern of a case clause. A top-level comma-separated list is a
     * sequence pattern: {@code case a, *rest:}.
     */
    public static PatternNode parseCasePattern(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        PatternNode first = parseMaybeStarPattern(parser);
        if (peek(parser).type != LexerTokenType.COMMA) {
            if (first instanceof MatchStarNode) {
                return new MatchSequenceNode(List.of(first), TokenUtils.spanFrom(parser, start));
            }
            return first;
        }
        List<PatternNode> patterns = new ArrayList<>();
        patterns.add(first);
        while (TokenUtils.consumeIf(parser, LexerTokenType.COMMA)) {
            if (peek(parser).type == LexerTokenType.COLON || peek(parser).type == LexerTokenType.IF) {
                break;
            }
            patterns.add(parseMaybeStarPattern(parser));
        }
        return new MatchSequenceNode(patterns, TokenUtils.spanFrom(parser, start));
    }

    private static PatternNode parseMaybeStarPattern(Parser parser) {
        if (peek(parser).type == LexerTokenType.STAR) {
            int start = TokenUtils.startIndex(parser);
            consume(parser);
            String name = TokenUtils.consumeName(parser);
            return new MatchStarNode(WILDCARD.equals(name) ? null : name, TokenUtils.spanFrom(parser, start));
        }
        return parseAsPattern(parser);
    }

    /**
     * Parses {@code or_pattern [as NAME]}.
     */
    static PatternNode parseAsPattern(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        PatternNode pattern = parseOrPattern(parser);
        if (TokenUtils.consumeIf(parser, LexerTokenType.AS)) {
            LexerToken nameToken = peek(parser);
            String name = TokenUtils.consumeName(parser);
            if (WILDCARD.equals(name)) {
                throw parser.error(ParseException.Kind.INVALID_TARGET, nameToken, "Cannot use '_' as a target");
            }
            return new MatchAsNode(pattern, name, TokenUtils.spanFrom(parser, start));
        }
        return pattern;
    }

    private static PatternNode parseOrPattern(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        PatternNode first = parseClosedPattern(parser);
        if (peek(parser).type != LexerTokenType.VBAR) {
            return first;
        }
        List<PatternNode> patterns = new ArrayList<>();
        patterns.add(first);
        while (TokenUtils.consumeIf(parser, LexerTokenType.VBAR)) {
            patterns.add(parseClosedPattern(parser));
        }
        return new MatchOrNode(patterns, TokenUtils.spanFrom(parser, start));
    }

    private static PatternNode parseClosedPattern(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        LexerToken token = peek(parser);

        switch (token.type) {
            case NUMBER:
            case MINUS:
            case STRING:
            case FSTRING:
                return new MatchValueNode(parseLiteralValue(parser), TokenUtils.spanFrom(parser, start));
            case NONE:
            case TRUE:
            case FALSE:
                ConstantNode singleton = (ConstantNode) ParsePrimary.parseAtom(parser);
                return new MatchSingletonNode(singleton, TokenUtils.spanFrom(parser, start));
            case LPAR:
                return parseGroupOrSequence(parser);
            case LSQB:
                consume(parser);
                List<PatternNode> elements = parseSequenceElements(parser, LexerTokenType.RSQB);
                return new MatchSequenceNode(elements, TokenUtils.spanFrom(parser, start));
            case LBRACE:
                return parseMappingPattern(parser);
            default:
                break;
        }

        if (!token.isName()) {
            throw parser.unexpected();
        }
        LexerTokenType next = TokenUtils.peek(parser, 1).type;
        if (next != LexerTokenType.DOT && next != LexerTokenType.LPAR) {
            consume(parser);
            String name = WILDCARD.equals(token.text) ? null : token.text;
            return new MatchAsNode(null, name, TokenUtils.spanFrom(parser, start));
        }
        ExpressionNode dotted = parseDottedName(parser);
        if (peek(parser).type == LexerTokenType.LPAR) {
            return parseClassPattern(parser, dotted, start);
        }
        return new MatchValueNode(dotted, TokenUtils.spanFrom(parser, start));
    }

    /**
     * Parses a literal usable as a value pattern or mapping key: a string, a signed
     * number, or a complex number {@code real + imag j}.
     */
    private static ExpressionNode parseLiteralValue(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        LexerToken token = peek(parser);
        if (token.type == LexerTokenType.STRING || token.type == LexerTokenType.FSTRING) {
            ExpressionNode value = StringParser.parseStrings(parser);
            if (!(value instanceof ConstantNode)) {
                throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token, "Patterns may only match literals and attribute lookups");
            }
            return value;
        }
        ExpressionNode value = parseSignedNumber(parser);
        LexerTokenType type = peek(parser).type;
        if (type == LexerTokenType.PLUS || type == LexerTokenType.MINUS) {
            consume(parser);
            LexerToken imaginaryToken = consume(parser, LexerTokenType.NUMBER);
            ConstantNode imaginary = NumberParser.parseNumber(parser, imaginaryToken);
            if (imaginary.kind != ConstantNode.Kind.COMPLEX) {
                throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, imaginaryToken, "Imaginary number required in complex literal");
            }
            BinaryOperator operator = type == LexerTokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB;
            value = new BinOpNode(value, operator, imaginary, TokenUtils.spanFrom(parser, start));
        }
        return value;
    }

    private static ExpressionNode parseSignedNumber(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        boolean negative = TokenUtils.consumeIf(parser, LexerTokenType.MINUS);
        LexerToken token = consume(parser, LexerTokenType.NUMBER);
        ExpressionNode number = NumberParser.parseNumber(parser, token);
        if (negative) {
            return new UnaryOpNode(UnaryOperator.USUB, number, TokenUtils.spanFrom(parser, start));
        }
        return number;
    }

    private static ExpressionNode parseDottedName(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        String first = TokenUtils.consumeName(parser);
        ExpressionNode expression = new NameNode(first, ExprContext.LOAD, TokenUtils.spanFrom(parser, start));
        while (TokenUtils.consumeIf(parser, LexerTokenType.DOT)) {
            String attribute = TokenUtils.consumeName(parser);
            expression = new AttributeNode(expression, attribute, ExprContext.LOAD, TokenUtils.spanFrom(parser, start));
        }
        return expression;
    }

    // (p) is a group, () and (p,) are sequences
    private static PatternNode parseGroupOrSequence(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.LPAR);
        if (TokenUtils.consumeIf(parser, LexerTokenType.RPAR)) {
            return new MatchSequenceNode(List.of(), TokenUtils.spanFrom(parser, start));
        }
        PatternNode first = parseMaybeStarPattern(parser);
        if (TokenUtils.consumeIf(parser, LexerTokenType.RPAR)) {
            if (first instanceof MatchStarNode) {
                return new MatchSequenceNode(List.of(first), TokenUtils.spanFrom(parser, start));
            }
            return first;
        }
        consume(parser, LexerTokenType.COMMA);
        List<PatternNode> patterns = new ArrayList<>();
        patterns.add(first);
        patterns.addAll(parseSequenceElements(parser, LexerTokenType.RPAR));
        return new MatchSequenceNode(patterns, TokenUtils.spanFrom(parser, start));
    }

    private static List<PatternNode> parseSequenceElements(Parser parser, LexerTokenType close) {
        List<PatternNode> patterns = new ArrayList<>();
        while (!TokenUtils.consumeIf(parser, close)) {
            patterns.add(parseMaybeStarPattern(parser));
            if (peek(parser).type != close) {
                consume(parser, LexerTokenType.COMMA);
            }
        }
        return patterns;
    }

    private static PatternNode parseMappingPattern(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.LBRACE);
        List<ExpressionNode> keys = new ArrayList<>();
        List<PatternNode> patterns = new ArrayList<>();
        String rest = null;

        while (!TokenUtils.consumeIf(parser, LexerTokenType.RBRACE)) {
            LexerToken token = peek(parser);
            if (rest != null) {
                throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token, "'**' pattern must be the last in a mapping");
            }
            if (TokenUtils.consumeIf(parser, LexerTokenType.DOUBLESTAR)) {
                rest = TokenUtils.consumeName(parser);
            } else {
                keys.add(parseMappingKey(parser));
                consume(parser, LexerTokenType.COLON);
                patterns.add(parseAsPattern(parser));
            }
            if (peek(parser).type != LexerTokenType.RBRACE) {
                consume(parser, LexerTokenType.COMMA);
            }
        }
        return new MatchMappingNode(keys, patterns, rest, TokenUtils.spanFrom(parser, start));
    }

    private static ExpressionNode parseMappingKey(Parser parser) {
        LexerToken token = peek(parser);
        switch (token.type) {
            case NONE:
            case TRUE:
            case FALSE:
                return ParsePrimary.parseAtom(parser);
            case NUMBER:
            case MINUS:
            case STRING:
            case FSTRING:
                return parseLiteralValue(parser);
            default:
                if (token.isName() && TokenUtils.peek(parser, 1).type == LexerTokenType.DOT) {
                    return parseDottedName(parser);
                }
                throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token,
                        "Mapping pattern keys may only match literals and attribute lookups");
        }
    }

    private static PatternNode parseClassPattern(Parser parser, ExpressionNode cls, int start) {
        consume(parser, LexerTokenType.LPAR);
        List<PatternNode> patterns = new ArrayList<>();
        List<String> kwdAttrs = new ArrayList<>();
        List<PatternNode> kwdPatterns = new ArrayList<>();

        while (!TokenUtils.consumeIf(parser, LexerTokenType.RPAR)) {
            LexerToken token = peek(parser);
            if (token.isName() && TokenUtils.peek(parser, 1).type == LexerTokenType.EQUAL) {
                consume(parser);
                consume(parser, LexerTokenType.EQUAL);
                kwdAttrs.add(token.text);
                kwdPatterns.add(parseAsPattern(parser));
            } else if (!kwdAttrs.isEmpty()) {
                throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token,
                        "Positional patterns follow keyword patterns");
            } else {
                patterns.add(parseAsPattern(parser));
            }
            if (peek(parser).type != LexerTokenType.RPAR) {
                consume(parser, LexerTokenType.COMMA);
            }
        }
        return new MatchClassNode(cls, patterns, kwdAttrs, kwdPatterns, TokenUtils.spanFrom(parser, start));
    }
}
