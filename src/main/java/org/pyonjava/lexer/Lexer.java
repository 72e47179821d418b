package org.pyonjava.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import org.pyonjava.CompilerOptions;
import org.pyonjava.runtime.ErrorMessageUtil;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The Lexer class is responsible for converting a sequence of characters (input string)
 * into a sequence of tokens. This process is known as lexical analysis or tokenization.
 * <p>
 * Besides identifiers, keywords, literals and operators, the lexer of an
 * indentation-sensitive language has to produce the structural tokens that a
 * brace-delimited language gets for free:
 * - NEWLINE at the end of each logical line,
 * - INDENT when a line starts deeper than the enclosing block,
 * - DEDENT (one per closed level) when a line returns to an outer block,
 * - ENDMARKER after the last token.
 * <p>
 * Indentation is tracked with a stack of column widths starting at [0]. A space counts
 * as 1 and a tab as {@link CompilerOptions#tabSize}. Blank lines and comment-only lines
 * never change the indentation. While any bracket is open, newlines are swallowed
 * (implicit line joining) and leading white space is not indentation.
 * <p>
 * NOTE:
 * The lexer does not check that brackets are balanced; the Parser reports a missing
 * closing bracket when it reaches the NEWLINE or ENDMARKER instead.
 */
public class Lexer {
    // Array to mark characters that can start an operator or delimiter
    public static boolean[] isOperator;

    // Static block to initialize the isOperator array
    static {
        isOperator = new boolean[128];
        for (char c : "+-*/%@&|^~<>()[]{},:.;=!".toCharArray()) {
            isOperator[c] = true;
        }
    }

    // Marks an f-string field whose format spec has started
    private static final int IN_FORMAT_SPEC = -1;

    // Input characters to be tokenized
    public String input;
    // Current position in the input
    public int position;
    // Length of the input
    public int length;

    private final CompilerOptions options;
    private final ErrorMessageUtil errorUtil;

    // Current line (1-based) and the position where it starts
    private int line = 1;
    private int lineStart = 0;
    private boolean atLineStart = true;

    // Indentation stack, bottom element is always 0
    private final List<Integer> indentStack = new ArrayList<>();

    // Open bracket counters
    private int parenDepth = 0;
    private int bracketDepth = 0;
    private int braceDepth = 0;

    private List<LexerToken> tokens;

    // Constructor to initialize the Lexer with input string
    public Lexer(String input) {
        this(input, new CompilerOptions());
    }

    public Lexer(String input, CompilerOptions options) {
        this(input, options, new ErrorMessageUtil(options.fileName, input), 1, 0);
    }

    /**
     * Creates a lexer for a fragment of a larger source, such as the expression of an
     * f-string replacement field. Token positions are reported relative to the
     * enclosing source.
     *
     * @param input       the fragment
     * @param options     the compiler options
     * @param errorUtil   the error formatter of the enclosing source
     * @param firstLine   the line of the first character of the fragment
     * @param firstColumn the column of the first character of the fragment
     */
    public Lexer(String input, CompilerOptions options, ErrorMessageUtil errorUtil, int firstLine, int firstColumn) {
        this.input = input;
        this.length = input.length();
        this.position = 0;
        this.options = options;
        this.errorUtil = errorUtil;
        this.line = firstLine;
        this.lineStart = -firstColumn;
    }

    private static boolean isIdentifierStart(int codePoint) {
        if (codePoint < 0x80) {
            return codePoint == '_' || (codePoint >= 'a' && codePoint <= 'z') || (codePoint >= 'A' && codePoint <= 'Z');
        }
        // Any non-ASCII character except white space
        return !UCharacter.hasBinaryProperty(codePoint, UProperty.WHITE_SPACE);
    }

    private static boolean isIdentifierPart(int codePoint) {
        return isIdentifierStart(codePoint) || (codePoint >= '0' && codePoint <= '9');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isStringPrefix(String word) {
        switch (word.toLowerCase()) {
            case "r":
            case "u":
            case "b":
            case "f":
            case "br":
            case "rb":
            case "fr":
            case "rf":
                return true;
            default:
                return false;
        }
    }

    private int getCurrentCodePoint() {
        if (position >= length) {
            return -1;
        }
        return input.codePointAt(position);
    }

    private char peekChar(int offset) {
        int p = position + offset;
        return p < length ? input.charAt(p) : '\0';
    }

    private int column() {
        return position - lineStart;
    }

    private int bracketDepth() {
        return parenDepth + bracketDepth + braceDepth;
    }

    private void logDebug(String message) {
        if (options.debugEnabled) {
            System.out.println(message);
        }
    }

    /**
     * Tokenizes the whole input.
     *
     * @return the token list, always terminated by ENDMARKER
     * @throws LexerException on the first inconsistent dedent, unterminated literal or invalid character
     */
    public List<LexerToken> tokenize() {
        tokens = new ArrayList<>();
        indentStack.add(0);

        if (length > 0 && input.charAt(0) == '\uFEFF') {
            position = lineStart = 1;
        }

        while (position < length) {
            if (atLineStart) {
                atLineStart = false;
                if (bracketDepth() == 0 && handleIndentation()) {
                    continue;
                }
            }
            nextToken();
        }

        // Unwind the remaining indentation levels
        while (indentStack.size() > 1) {
            indentStack.remove(indentStack.size() - 1);
            addToken(LexerTokenType.DEDENT, "", line, column());
        }
        addToken(LexerTokenType.ENDMARKER, "", line, column());

        logDebug("tokenize: " + tokens.size() + " tokens");
        this.input = null;  // Throw away input to spare memory
        return tokens;
    }

    /**
     * Measures the indentation of a new logical line and emits INDENT or DEDENT tokens.
     *
     * @return true if the whole line was consumed (blank or comment-only line)
     */
    private boolean handleIndentation() {
        int width = 0;
        int p = position;
        while (p < length) {
            char c = input.charAt(p);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += options.tabSize;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            p++;
        }
        position = p;

        if (p >= length) {
            return true;
        }
        char c = input.charAt(p);
        if (c == '\n' || c == '\r') {
            consumeNewline();
            atLineStart = true;
            return true;
        }
        if (c == '#') {
            consumeComment();
            if (position < length) {
                consumeNewline();
                atLineStart = true;
            }
            return true;
        }

        int top = indentStack.get(indentStack.size() - 1);
        if (width > top) {
            indentStack.add(width);
            tokens.add(new LexerToken(LexerTokenType.INDENT, input.substring(lineStart, position),
                    line, 0, line, column()));
        } else if (width < top) {
            while (width < indentStack.get(indentStack.size() - 1)) {
                indentStack.remove(indentStack.size() - 1);
                addToken(LexerTokenType.DEDENT, "", line, column());
            }
            if (indentStack.get(indentStack.size() - 1) != width) {
                throw new LexerException(LexerException.Kind.INDENTATION, line, column(),
                        "unindent does not match any outer indentation level", errorUtil);
            }
        }
        return false;
    }

    /**
     * Scans one token, or skips white space, starting at the current position.
     */
    public void nextToken() {
        char c = input.charAt(position);
        switch (c) {
            case ' ':
            case '\t':
            case '\f':
                position++;
                return;
            case '\\':
                char next = peekChar(1);
                if (next == '\n' || next == '\r') {
                    position++;
                    consumeNewline();
                    return;
                }
                throw new LexerException(LexerException.Kind.INVALID_CHARACTER, line, column(),
                        "unexpected character after line continuation character", errorUtil);
            case '\n':
            case '\r':
                int startLine = line;
                int startColumn = column();
                String newline = consumeNewline();
                if (bracketDepth() == 0) {
                    tokens.add(new LexerToken(LexerTokenType.NEWLINE, newline,
                            startLine, startColumn, startLine, startColumn + newline.length()));
                    atLineStart = true;
                }
                return;
            case '#':
                consumeComment();
                return;
            case '"':
            case '\'':
                consumeString(position, "");
                return;
            default:
                break;
        }

        if (isDigit(c) || (c == '.' && isDigit(peekChar(1)))) {
            consumeNumber();
            return;
        }
        int codePoint = getCurrentCodePoint();
        if (isIdentifierStart(codePoint)) {
            consumeIdentifier();
            return;
        }
        if (c < 128 && isOperator[c]) {
            consumeOperator();
            return;
        }
        throw new LexerException(LexerException.Kind.INVALID_CHARACTER, line, column(),
                "invalid character '" + new String(Character.toChars(codePoint)) + "' (U+"
                        + String.format("%04X", codePoint) + ")", errorUtil);
    }

    private void addToken(LexerTokenType type, String text, int startLine, int startColumn) {
        tokens.add(new LexerToken(type, text, startLine, startColumn, line, column()));
    }

    // Consumes "\n", "\r\n" or "\r" and moves to the next line
    private String consumeNewline() {
        String newline;
        if (input.charAt(position) == '\r' && peekChar(1) == '\n') {
            newline = "\r\n";
        } else {
            newline = String.valueOf(input.charAt(position));
        }
        position += newline.length();
        line++;
        lineStart = position;
        return newline;
    }

    private void consumeComment() {
        int start = position;
        int startColumn = column();
        while (position < length && input.charAt(position) != '\n' && input.charAt(position) != '\r') {
            position++;
        }
        addToken(LexerTokenType.COMMENT, input.substring(start, position), line, startColumn);
    }

    private void consumeIdentifier() {
        int start = position;
        int startColumn = column();
        int codePoint;
        while ((codePoint = getCurrentCodePoint()) != -1 && isIdentifierPart(codePoint)) {
            position += Character.charCount(codePoint);
        }
        String word = input.substring(start, position);

        if (position < length && (input.charAt(position) == '"' || input.charAt(position) == '\'')
                && isStringPrefix(word)) {
            consumeString(start, word);
            return;
        }

        LexerTokenType keyword = LexerTokenType.keyword(word);
        addToken(keyword != null ? keyword : LexerTokenType.NAME, word, line, startColumn);
    }

    private void consumeNumber() {
        int start = position;
        int startColumn = column();
        char c = input.charAt(position);
        char prefix = Character.toLowerCase(peekChar(1));
        if (c == '0' && (prefix == 'x' || prefix == 'o' || prefix == 'b')) {
            position += 2;
            while (position < length && (isHexDigit(input.charAt(position)) || input.charAt(position) == '_')) {
                position++;
            }
        } else {
            consumeDigits();
            if (position < length && input.charAt(position) == '.') {
                position++;
                consumeDigits();
            }
            if (position < length && (input.charAt(position) == 'e' || input.charAt(position) == 'E')) {
                char sign = peekChar(1);
                if (isDigit(sign)) {
                    position++;
                    consumeDigits();
                } else if ((sign == '+' || sign == '-') && isDigit(peekChar(2))) {
                    position += 2;
                    consumeDigits();
                }
            }
        }
        if (position < length && (input.charAt(position) == 'j' || input.charAt(position) == 'J')) {
            position++;
        }
        addToken(LexerTokenType.NUMBER, input.substring(start, position), line, startColumn);
    }

    private void consumeDigits() {
        while (position < length && (isDigit(input.charAt(position)) || input.charAt(position) == '_')) {
            position++;
        }
    }

    private void consumeOperator() {
        int startColumn = column();
        for (int size = 3; size >= 1; size--) {
            if (position + size > length) {
                continue;
            }
            String text = input.substring(position, position + size);
            LexerTokenType type = LexerTokenType.operator(text);
            if (type == null) {
                continue;
            }
            position += size;
            switch (type) {
                case LPAR -> parenDepth++;
                case RPAR -> parenDepth = Math.max(0, parenDepth - 1);
                case LSQB -> bracketDepth++;
                case RSQB -> bracketDepth = Math.max(0, bracketDepth - 1);
                case LBRACE -> braceDepth++;
                case RBRACE -> braceDepth = Math.max(0, braceDepth - 1);
                default -> {
                }
            }
            addToken(type, text, line, startColumn);
            return;
        }
        throw new LexerException(LexerException.Kind.INVALID_CHARACTER, line, startColumn,
                "invalid character '" + input.charAt(position) + "'", errorUtil);
    }

    /**
     * Scans a string literal. The token text keeps the prefix, the quotes and every
     * escape sequence unchanged; decoding is done by the parser.
     * <p>
     * In an f-string, quotes inside the expression of a replacement field belong to
     * nested literals and do not terminate the string. After the top-level ':' of a
     * field, quotes are plain characters of the format spec, as in {@code f"{x:'>10}"},
     * until a nested field opens or the field closes.
     *
     * @param start  position of the first prefix character (or of the quote)
     * @param prefix the string prefix, possibly empty
     */
    private void consumeString(int start, String prefix) {
        int startLine = line;
        int startColumn = start - lineStart;
        char quote = input.charAt(position);
        boolean triple = peekChar(1) == quote && peekChar(2) == quote;
        boolean fstring = prefix.indexOf('f') >= 0 || prefix.indexOf('F') >= 0;
        position += triple ? 3 : 1;

        // one entry per open field: bracket depth in its expression, or IN_FORMAT_SPEC
        Deque<Integer> fields = new ArrayDeque<>();
        while (true) {
            if (position >= length) {
                throw unterminatedString(startLine, startColumn, triple);
            }
            char c = input.charAt(position);
            if (c == '\\') {
                position++;
                if (position < length) {
                    char escaped = input.charAt(position);
                    if (escaped == '\n' || escaped == '\r') {
                        consumeNewline();
                    } else {
                        position++;
                    }
                }
                continue;
            }
            if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw unterminatedString(startLine, startColumn, false);
                }
                consumeNewline();
                continue;
            }
            if (fstring && !fields.isEmpty()) {
                if ((c == '\'' || c == '"') && fields.peek() != IN_FORMAT_SPEC) {
                    skipNestedString(c, startLine, startColumn);
                    continue;
                }
                scanFieldCharacter(fields, c);
                position++;
                continue;
            }
            if (fstring && c == '{') {
                if (peekChar(1) == '{') {
                    position += 2;
                } else {
                    fields.push(0);
                    position++;
                }
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    position++;
                    break;
                }
                if (peekChar(1) == quote && peekChar(2) == quote) {
                    position += 3;
                    break;
                }
            }
            position++;
        }

        tokens.add(new LexerToken(fstring ? LexerTokenType.FSTRING : LexerTokenType.STRING,
                input.substring(start, position), startLine, startColumn, line, column()));
    }

    /**
     * Tracks the nesting of f-string replacement fields for one character of a field that
     * is neither an escape nor the start of a nested literal.
     */
    private static void scanFieldCharacter(Deque<Integer> fields, char c) {
        int depth = fields.pop();
        if (depth == IN_FORMAT_SPEC) {
            fields.push(depth);
            if (c == '{') {
                fields.push(0);
            } else if (c == '}') {
                fields.pop();
            }
            return;
        }
        switch (c) {
            case '(', '[', '{' -> fields.push(depth + 1);
            case ')', ']', '}' -> {
                if (depth > 0) {
                    fields.push(depth - 1);
                } else if (c != '}') {
                    // unbalanced; the parser reports it
                    fields.push(0);
                }
            }
            case ':' -> fields.push(depth == 0 ? IN_FORMAT_SPEC : depth);
            default -> fields.push(depth);
        }
    }

    // Skips a string literal nested in an f-string replacement field
    private void skipNestedString(char quote, int startLine, int startColumn) {
        position++;
        while (position < length) {
            char c = input.charAt(position);
            if (c == '\\') {
                position += 2;
            } else if (c == quote) {
                position++;
                return;
            } else if (c == '\n' || c == '\r') {
                break;
            } else {
                position++;
            }
        }
        throw unterminatedString(startLine, startColumn, false);
    }

    private LexerException unterminatedString(int startLine, int startColumn, boolean triple) {
        return new LexerException(LexerException.Kind.UNTERMINATED_LITERAL, startLine, startColumn,
                triple ? "unterminated triple-quoted string literal" : "unterminated string literal",
                errorUtil);
    }
}
