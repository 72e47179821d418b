package org.pyonjava.lexer;

/**
 * The LexerToken class represents a lexical token produced by the {@link Lexer}.
 * A token is a basic unit of meaningful data, such as a keyword, identifier, operator,
 * or literal.
 *
 * <p>This class encapsulates the type and text of a token together with its source
 * span. Lines are 1-based and columns are 0-based; the end position points just past
 * the last character of the token.</p>
 */
public class LexerToken {
    /**
     * The type of the token, represented by an instance of the LexerTokenType enum.
     */
    public final LexerTokenType type;

    /**
     * The text of the token exactly as it appears in the source.
     * Structural tokens (INDENT, DEDENT, ENDMARKER) have empty text.
     */
    public final String text;

    public final int line;
    public final int column;
    public final int endLine;
    public final int endColumn;

    /**
     * Constructs a new LexerToken with the specified type, text and span.
     *
     * @param type      the type of the token
     * @param text      the source text of the token
     * @param line      the line where the token starts (1-based)
     * @param column    the column where the token starts (0-based)
     * @param endLine   the line where the token ends
     * @param endColumn the column just after the last character of the token
     */
    public LexerToken(LexerTokenType type, String text, int line, int column, int endLine, int endColumn) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    /**
     * Returns true if this token can be used as an identifier: a NAME, or a soft
     * keyword outside the positions where it is reserved.
     */
    public boolean isName() {
        return type == LexerTokenType.NAME || type.isSoftKeyword();
    }

    /**
     * Returns a string representation of the token.
     * The string representation includes the type, text and start position of the token.
     *
     * @return a string representation of the token
     */
    @Override
    public String toString() {
        return "LexerToken{" + "type=" + type + ", text='" + text + '\'' + ", pos=" + line + ":" + column + '}';
    }
}
