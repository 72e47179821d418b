package org.pyonjava.parser;

import com.ibm.icu.lang.UCharacter;
import org.pyonjava.frontend.astnode.ConstantNode;
import org.pyonjava.frontend.astnode.ExpressionNode;
import org.pyonjava.frontend.astnode.JoinedStrNode;
import org.pyonjava.frontend.astnode.SourceSpan;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyonjava.parser.TokenUtils.peek;

/**
 * The StringParser class decodes string literal tokens.
 * <p>
 * Adjacent literals are concatenated into one constant: {@code "a" 'b'} is {@code "ab"}.
 * If any of them is an f-string the result is a single JoinedStr. Bytes literals
 * cannot be mixed with text literals.
 */
public class StringParser {

    /**
     * Parses one or more adjacent STRING and FSTRING tokens.
     *
     * @param parser The parser, positioned at the first literal.
     * @return A STRING or BYTES ConstantNode, or a JoinedStrNode.
     */
    public static ExpressionNode parseStrings(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        FStringBuilder builder = new FStringBuilder();
        Boolean bytes = null;
        boolean formatted = false;

        while (peek(parser).type == LexerTokenType.STRING || peek(parser).type == LexerTokenType.FSTRING) {
            LexerToken token = TokenUtils.consume(parser);
            ParsedString parsed = ParsedString.of(token);
            if (bytes != null && bytes != parsed.isBytes) {
                throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token,
                        "Cannot mix bytes and nonbytes literals");
            }
            bytes = parsed.isBytes;
            if (parsed.isFormatted) {
                formatted = true;
                new StringSegmentParser(parser, parsed, builder).parse();
            } else {
                builder.appendLiteral(decode(parser, token, parsed.body(), parsed.isRaw, parsed.isBytes));
            }
        }

        SourceSpan span = TokenUtils.spanFrom(parser, start);
        if (formatted) {
            return new JoinedStrNode(builder.finish(span), span);
        }
        String value = builder.literalText();
        return Boolean.TRUE.equals(bytes) ? ConstantNode.ofBytes(value, span) : ConstantNode.ofString(value, span);
    }

    /**
     * Processes the escape sequences of a literal body.
     * <p>
     * Line breaks in the body are normalized to {@code \n}. In raw literals backslashes
     * are kept. Unknown escapes such as {@code \d} are kept unchanged. In bytes
     * literals the named and unicode escapes are not recognized and every
     * character must be ASCII.
     *
     * @param parser The parser, used for error reporting.
     * @param token  The token the body comes from.
     * @param body   The text between the quotes.
     * @param raw    Whether the literal has an {@code r} prefix.
     * @param bytes  Whether the literal has a {@code b} prefix.
     * @return The decoded value; for bytes, one char per byte.
     */
    public static String decode(Parser parser, LexerToken token, String body, boolean raw, boolean bytes) {
        StringBuilder sb = new StringBuilder(body.length());
        int length = body.length();
        int i = 0;
        while (i < length) {
            char c = body.charAt(i);
            if (c == '\r') {
                // \r\n and \r are line breaks
                sb.append('\n');
                i += (i + 1 < length && body.charAt(i + 1) == '\n') ? 2 : 1;
                continue;
            }
            if (bytes && c > 127) {
                throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token,
                        "bytes can only contain ASCII literal characters");
            }
            if (raw || c != '\\' || i + 1 >= length) {
                sb.append(c);
                i++;
                continue;
            }
            char escaped = body.charAt(i + 1);
            i += 2;
            switch (escaped) {
                case '\n':
                    break;
                case '\r':
                    if (i < length && body.charAt(i) == '\n') {
                        i++;
                    }
                    break;
                case '\\':
                case '\'':
                case '"':
                    sb.append(escaped);
                    break;
                case 'a':
                    sb.append('\u0007');
                    break;
                case 'b':
                    sb.append('\b');
                    break;
                case 'f':
                    sb.append('\f');
                    break;
                case 'n':
                    sb.append('\n');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'v':
                    sb.append('\u000B');
                    break;
                case 'x':
                    sb.append((char) parseHex(parser, token, body, i, 2, "\\x"));
                    i += 2;
                    break;
                case 'u':
                case 'U':
                case 'N':
                    if (bytes) {
                        sb.append('\\').append(escaped);
                        break;
                    }
                    i = appendUnicodeEscape(parser, token, body, i, escaped, sb);
                    break;
                default:
                    if (escaped >= '0' && escaped <= '7') {
                        int value = escaped - '0';
                        for (int n = 0; n < 2 && i < length && body.charAt(i) >= '0' && body.charAt(i) <= '7'; n++) {
                            value = value * 8 + (body.charAt(i++) - '0');
                        }
                        if (bytes) {
                            value &= 0xFF;
                        }
                        sb.appendCodePoint(value);
                    } else {
                        sb.append('\\').append(escaped);
                    }
            }
        }
        return sb.toString();
    }

    // \\uXXXX, \\UXXXXXXXX or \\N{NAME}; returns the index after the escape
    private static int appendUnicodeEscape(Parser parser, LexerToken token, String body, int i, char kind,
                                           StringBuilder sb) {
        if (kind == 'u') {
            sb.appendCodePoint(parseHex(parser, token, body, i, 4, "\\u"));
            return i + 4;
        }
        if (kind == 'U') {
            int codePoint = parseHex(parser, token, body, i, 8, "\\U");
            if (codePoint > Character.MAX_CODE_POINT) {
                throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token, "Illegal Unicode character in \\U escape");
            }
            sb.appendCodePoint(codePoint);
            return i + 8;
        }
        int close = body.indexOf('}', i);
        if (i >= body.length() || body.charAt(i) != '{' || close < 0) {
            throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token, "Malformed \\N character escape");
        }
        String name = body.substring(i + 1, close);
        int codePoint = UCharacter.getCharFromName(name);
        if (codePoint < 0) {
            codePoint = UCharacter.getCharFromNameAlias(name);
        }
        if (codePoint < 0) {
            throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token, "Unknown Unicode character name '" + name + "'");
        }
        sb.appendCodePoint(codePoint);
        return close + 1;
    }

    private static int parseHex(Parser parser, LexerToken token, String body, int i, int digits, String escape) {
        if (i + digits > body.length()) {
            throw truncated(parser, token, escape);
        }
        try {
            return Integer.parseUnsignedInt(body.substring(i, i + digits), 16);
        } catch (NumberFormatException e) {
            throw truncated(parser, token, escape);
        }
    }

    private static ParseException truncated(Parser parser, LexerToken token, String escape) {
        return parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token, "Truncated " + escape + " escape");
    }

    /**
     * Splits the raw text of a string token into its prefix, quotes and body.
     */
    public static class ParsedString {
        public final LexerToken token;
        public final String prefix;
        public final char quote;
        public final boolean isTriple;
        public final int bodyStart;  // Index of the first body character in the token text
        public final int bodyEnd;    // Index of the closing quote
        public final boolean isRaw;
        public final boolean isBytes;
        public final boolean isFormatted;

        private ParsedString(LexerToken token, String prefix, char quote, boolean isTriple, int bodyStart, int bodyEnd) {
            this.token = token;
            this.prefix = prefix;
            this.quote = quote;
            this.isTriple = isTriple;
            this.bodyStart = bodyStart;
            this.bodyEnd = bodyEnd;
            String lower = prefix.toLowerCase();
            this.isRaw = lower.indexOf('r') >= 0;
            this.isBytes = lower.indexOf('b') >= 0;
            this.isFormatted = lower.indexOf('f') >= 0;
        }

        public static ParsedString of(LexerToken token) {
            String text = token.text;
            int quoteIndex = 0;
            while (text.charAt(quoteIndex) != '\'' && text.charAt(quoteIndex) != '"') {
                quoteIndex++;
            }
            char quote = text.charAt(quoteIndex);
            boolean triple = text.length() >= quoteIndex + 6
                    && text.charAt(quoteIndex + 1) == quote && text.charAt(quoteIndex + 2) == quote;
            int quoteLength = triple ? 3 : 1;
            return new ParsedString(token, text.substring(0, quoteIndex), quote, triple,
                    quoteIndex + quoteLength, text.length() - quoteLength);
        }

        public String body() {
            return token.text.substring(bodyStart, bodyEnd);
        }

        /**
         * Returns the source line and column of a character of the token text.
         */
        public int[] positionOf(int index) {
            String text = token.text;
            int line = token.line;
            int lineStart = -token.column;
            for (int i = 0; i < index; i++) {
                char c = text.charAt(i);
                if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                    line++;
                    lineStart = i + 1;
                }
            }
            return new int[]{line, index - lineStart};
        }

        @Override
        public String toString() {
            return "ParsedString{prefix='" + prefix + "', quote=" + quote + ", triple=" + isTriple + "}";
        }
    }

    /**
     * Collects the parts of a (possibly concatenated) f-string, merging adjacent
     * literal text into one constant.
     */
    static class FStringBuilder {
        private final StringBuilder literal = new StringBuilder();
        private final List<ExpressionNode> values = new ArrayList<>();

        void appendLiteral(String text) {
            literal.append(text);
        }

        void appendValue(ExpressionNode value) {
            flushLiteral();
            values.add(value);
        }

        String literalText() {
            return literal.toString();
        }

        List<ExpressionNode> finish(SourceSpan span) {
            if (literal.length() > 0) {
                values.add(ConstantNode.ofString(literal.toString(), span));
                literal.setLength(0);
            }
            return values;
        }

        private void flushLiteral() {
            if (literal.length() > 0) {
                values.add(ConstantNode.ofString(literal.toString(), SourceSpan.NONE));
                literal.setLength(0);
            }
        }
    }
}
