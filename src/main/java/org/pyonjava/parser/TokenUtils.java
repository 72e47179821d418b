package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.SourceSpan;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;
import org.pyonjava.runtime.ErrorMessageUtil;

/**
 * The TokenUtils class provides utility methods for handling lexer tokens during
 * parsing: peeking at upcoming tokens, consuming tokens of an expected type, and
 * computing the source span of the tokens consumed for a node.
 * <p>
 * COMMENT tokens are invisible to the parser: every method here skips them.
 */
public class TokenUtils {

    /**
     * Peeks at the next non-comment token without consuming it.
     * Comments are consumed. The ENDMARKER token is returned forever once reached.
     *
     * @param parser The parser containing the token list and current token index.
     * @return The next significant token.
     */
    public static LexerToken peek(Parser parser) {
        while (parser.tokenIndex < parser.tokens.size() - 1
                && parser.tokens.get(parser.tokenIndex).type == LexerTokenType.COMMENT) {
            parser.tokenIndex++;
        }
        return parser.tokens.get(Math.min(parser.tokenIndex, parser.tokens.size() - 1));
    }

    /**
     * Peeks at the significant token {@code offset} positions ahead; offset 0 is the
     * same as {@link #peek(Parser)}.
     */
    public static LexerToken peek(Parser parser, int offset) {
        int index = peekIndex(parser, offset);
        return parser.tokens.get(index);
    }

    private static int peekIndex(Parser parser, int offset) {
        peek(parser);
        int last = parser.tokens.size() - 1;
        int index = parser.tokenIndex;
        while (offset > 0 && index < last) {
            index++;
            if (parser.tokens.get(index).type != LexerTokenType.COMMENT) {
                offset--;
            }
        }
        return Math.min(index, last);
    }

    /**
     * Consumes and returns the next significant token.
     */
    public static LexerToken consume(Parser parser) {
        LexerToken token = peek(parser);
        if (token.type != LexerTokenType.ENDMARKER) {
            parser.tokenIndex++;
        }
        return token;
    }

    /**
     * Consumes the next token, which must be of the given type.
     *
     * @throws ParseException if the next token has a different type
     */
    public static LexerToken consume(Parser parser, LexerTokenType type) {
        LexerToken token = peek(parser);
        if (token.type != type) {
            throw parser.error(ParseException.Kind.EXPECTED_TOKEN, token,
                    "Expected " + describe(type) + " but got " + describe(token));
        }
        return consume(parser);
    }

    /**
     * Consumes the next token if it has the given type.
     *
     * @return true if a token was consumed
     */
    public static boolean consumeIf(Parser parser, LexerTokenType type) {
        if (peek(parser).type == type) {
            consume(parser);
            return true;
        }
        return false;
    }

    /**
     * Consumes an identifier. Soft keywords are accepted as identifiers.
     *
     * @return the identifier text
     */
    public static String consumeName(Parser parser) {
        LexerToken token = peek(parser);
        if (!token.isName()) {
            throw parser.error(ParseException.Kind.EXPECTED_TOKEN, token,
                    "Expected name but got " + describe(token));
        }
        consume(parser);
        return token.text;
    }

    /**
     * Returns the index of the next significant token, to be passed to
     * {@link #spanFrom(Parser, int)} once the node has been parsed.
     */
    public static int startIndex(Parser parser) {
        peek(parser);
        return parser.tokenIndex;
    }

    /**
     * Returns the span from the token at {@code startIndex} to the last significant
     * token consumed. Layout tokens at the end of a block are not part of the span.
     */
    public static SourceSpan spanFrom(Parser parser, int startIndex) {
        LexerToken first = parser.tokens.get(startIndex);
        int index = parser.tokenIndex - 1;
        while (index > startIndex && isLayout(parser.tokens.get(index).type)) {
            index--;
        }
        if (index < startIndex) {
            return new SourceSpan(first.line, first.column, first.line, first.column);
        }
        LexerToken last = parser.tokens.get(index);
        return new SourceSpan(first.line, first.column, last.endLine, last.endColumn);
    }

    private static boolean isLayout(LexerTokenType type) {
        return switch (type) {
            case COMMENT, NEWLINE, INDENT, DEDENT, ENDMARKER -> true;
            default -> false;
        };
    }

    /**
     * Returns the last significant token consumed, or the first token if none was.
     */
    public static LexerToken previous(Parser parser) {
        int index = parser.tokenIndex - 1;
        while (index > 0 && parser.tokens.get(index).type == LexerTokenType.COMMENT) {
            index--;
        }
        return parser.tokens.get(Math.max(index, 0));
    }

    /**
     * Describes a token for an error message.
     */
    public static String describe(LexerToken token) {
        return switch (token.type) {
            case NEWLINE -> "newline";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case ENDMARKER -> "end of input";
            default -> ErrorMessageUtil.describe(token.text);
        };
    }

    /**
     * Describes an expected token type for an error message.
     */
    public static String describe(LexerTokenType type) {
        if (type.getText() != null) {
            return "'" + type.getText() + "'";
        }
        return switch (type) {
            case NAME -> "name";
            case NEWLINE -> "newline";
            case INDENT -> "an indented block";
            case DEDENT -> "dedent";
            case ENDMARKER -> "end of input";
            default -> type.name().toLowerCase();
        };
    }
}
