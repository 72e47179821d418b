package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.ExpressionNode;
import org.pyonjava.frontend.astnode.FormattedValueNode;
import org.pyonjava.frontend.astnode.JoinedStrNode;
import org.pyonjava.frontend.astnode.SourceSpan;
import org.pyonjava.lexer.Lexer;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;

import java.util.List;

/**
 * Splits the body of an f-string into literal segments and replacement fields.
 *
 * <p>The parser works on the raw token text and recognizes:
 * <ul>
 *   <li>{@code {{} and {@code }}}: literal braces</li>
 *   <li>{@code {expr}}: a replacement field, optionally followed by {@code =},
 *       a conversion {@code !r}, {@code !s} or {@code !a}, and a format spec
 *       {@code :spec} that may itself contain replacement fields</li>
 *   <li>{@code \N{name}}: an escape, not a field</li>
 * </ul>
 *
 * <p>The expression of each field is lexed and parsed again as {@code (expr)} with
 * positions relative to the enclosing source, so errors point into the f-string.
 *
 * @see StringParser
 */
public class StringSegmentParser {

    private static final int NO_CONVERSION = -1;

    private final Parser parser;
    private final StringParser.ParsedString parsed;
    private final String text;
    // Receives the literal text and the fields of the whole literal
    private final StringParser.FStringBuilder segments;
    // Raw literal text not yet decoded
    private final StringBuilder currentSegment = new StringBuilder();

    public StringSegmentParser(Parser parser, StringParser.ParsedString parsed, StringParser.FStringBuilder segments) {
        this.parser = parser;
        this.parsed = parsed;
        this.text = parsed.token.text;
        this.segments = segments;
    }

    /**
     * Parses the whole body into the segment builder.
     */
    public void parse() {
        int end = parseSegments(parsed.bodyStart, segments, false);
        if (end != parsed.bodyEnd) {
            throw error(end, "f-string: single '}' is not allowed");
        }
    }

    /**
     * Parses literal text and fields starting at {@code index}.
     *
     * @param index       position in the token text
     * @param target      receives the segments
     * @param inFormatSpec whether an unmatched '}' ends the segment list
     * @return the index of the terminating '}' or of the closing quote
     */
    private int parseSegments(int index, StringParser.FStringBuilder target, boolean inFormatSpec) {
        int end = parsed.bodyEnd;
        while (index < end) {
            char c = text.charAt(index);
            if (c == '\\' && index + 1 < end) {
                index = appendEscape(index);
                continue;
            }
            if (c == '{') {
                if (!inFormatSpec && index + 1 < end && text.charAt(index + 1) == '{') {
                    currentSegment.append('{');
                    index += 2;
                    continue;
                }
                flushCurrentSegment(target);
                index = parseField(index, target);
                continue;
            }
            if (c == '}') {
                if (inFormatSpec) {
                    break;
                }
                if (index + 1 < end && text.charAt(index + 1) == '}') {
                    currentSegment.append('}');
                    index += 2;
                    continue;
                }
                break;
            }
            currentSegment.append(c);
            index++;
        }
        flushCurrentSegment(target);
        return index;
    }

    // Copies an escape sequence so that it is decoded with the rest of the segment
    private int appendEscape(int index) {
        char next = text.charAt(index + 1);
        if (parsed.isRaw || next == '{' || next == '}') {
            currentSegment.append('\\');
            return index + 1;
        }
        if (next == 'N' && index + 2 < parsed.bodyEnd && text.charAt(index + 2) == '{') {
            int close = text.indexOf('}', index);
            if (close > 0 && close < parsed.bodyEnd) {
                currentSegment.append(text, index, close + 1);
                return close + 1;
            }
        }
        currentSegment.append('\\').append(next);
        return index + 2;
    }

    private void flushCurrentSegment(StringParser.FStringBuilder target) {
        if (currentSegment.length() > 0) {
            target.appendLiteral(StringParser.decode(parser, parsed.token, currentSegment.toString(), parsed.isRaw, false));
            currentSegment.setLength(0);
        }
    }

    /**
     * Parses a replacement field starting at the '{'.
     *
     * @return the index after the closing '}'
     */
    private int parseField(int open, StringParser.FStringBuilder target) {
        int exprStart = open + 1;
        int exprEnd = findExpressionEnd(exprStart);
        String expressionText = text.substring(exprStart, exprEnd);
        if (expressionText.isBlank()) {
            throw error(exprStart, "f-string: empty expression not allowed");
        }
        ExpressionNode value = parseExpression(expressionText, exprStart);

        int index = exprEnd;
        boolean selfDocumenting = false;
        if (text.charAt(index) == '=') {
            // {x = } renders as "x = " followed by the value
            selfDocumenting = true;
            index++;
            while (index < parsed.bodyEnd && Character.isWhitespace(text.charAt(index))) {
                index++;
            }
            target.appendLiteral(text.substring(exprStart, index));
        }

        int conversion = NO_CONVERSION;
        if (text.charAt(index) == '!') {
            char code = index + 1 < parsed.bodyEnd ? text.charAt(index + 1) : '\0';
            if (code != 'r' && code != 's' && code != 'a') {
                throw error(index + 1, "f-string: invalid conversion character: expected 's', 'r', or 'a'");
            }
            conversion = code;
            index += 2;
        }

        JoinedStrNode formatSpec = null;
        if (index < parsed.bodyEnd && text.charAt(index) == ':') {
            StringParser.FStringBuilder spec = new StringParser.FStringBuilder();
            int specEnd = parseSegments(index + 1, spec, true);
            int[] from = parsed.positionOf(index + 1);
            int[] to = parsed.positionOf(specEnd);
            SourceSpan specSpan = new SourceSpan(from[0], from[1], to[0], to[1]);
            formatSpec = new JoinedStrNode(spec.finish(specSpan), specSpan);
            index = specEnd;
        }

        if (index >= parsed.bodyEnd || text.charAt(index) != '}') {
            throw error(index, "f-string: expecting '}'");
        }
        if (selfDocumenting && conversion == NO_CONVERSION && formatSpec == null) {
            conversion = 'r';
        }

        int[] from = parsed.positionOf(open);
        int[] to = parsed.positionOf(index + 1);
        target.appendValue(new FormattedValueNode(value, conversion, formatSpec,
                new SourceSpan(from[0], from[1], to[0], to[1])));
        return index + 1;
    }

    /**
     * Finds the end of the expression of a field: the first '}', '!', ':' or '='
     * outside brackets and nested literals that is not part of an operator.
     */
    private int findExpressionEnd(int index) {
        int depth = 0;
        while (index < parsed.bodyEnd) {
            char c = text.charAt(index);
            switch (c) {
                case '(', '[', '{' -> depth++;
                case ')', ']' -> depth--;
                case '}' -> {
                    if (depth == 0) {
                        return index;
                    }
                    depth--;
                }
                case '\'', '"' -> {
                    index = skipNestedString(index);
                    continue;
                }
                case '!' -> {
                    if (depth == 0 && nextChar(index) != '=') {
                        return index;
                    }
                    if (nextChar(index) == '=') {
                        index++;
                    }
                }
                case ':' -> {
                    if (depth == 0) {
                        return index;
                    }
                }
                case '=' -> {
                    char previous = text.charAt(index - 1);
                    if (nextChar(index) == '=') {
                        index++;
                    } else if (depth == 0 && "=!<>".indexOf(previous) < 0) {
                        return index;
                    }
                }
                case '<', '>' -> {
                    if (nextChar(index) == '=') {
                        index++;
                    }
                }
                default -> {
                }
            }
            index++;
        }
        throw error(index, "f-string: expecting '}'");
    }

    private char nextChar(int index) {
        return index + 1 < parsed.bodyEnd ? text.charAt(index + 1) : '\0';
    }

    private int skipNestedString(int index) {
        char quote = text.charAt(index);
        int i = index + 1;
        while (i < parsed.bodyEnd) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else {
                i++;
            }
        }
        throw error(index, "f-string: unterminated string");
    }

    private ExpressionNode parseExpression(String expressionText, int exprStart) {
        int[] position = parsed.positionOf(exprStart);
        Lexer lexer = new Lexer("(" + expressionText + ")", parser.ctx.compilerOptions, parser.ctx.errorUtil,
                position[0], position[1] - 1);
        List<LexerToken> tokens = lexer.tokenize();
        Parser fieldParser = new Parser(parser.ctx, tokens);
        parser.ctx.logDebug("f-string field: " + expressionText);
        ExpressionNode value = fieldParser.parseTest();
        LexerToken next = TokenUtils.peek(fieldParser);
        if (next.type != LexerTokenType.ENDMARKER) {
            throw fieldParser.unexpected();
        }
        return value;
    }

    private ParseException error(int index, String message) {
        int[] position = parsed.positionOf(Math.min(index, text.length()));
        return parser.error(ParseException.Kind.UNEXPECTED_TOKEN, position[0], position[1], message);
    }
}
