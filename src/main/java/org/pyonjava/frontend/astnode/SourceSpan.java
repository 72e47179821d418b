package org.pyonjava.frontend.astnode;

/**
 * The region of source text a node was parsed from.
 * Lines are 1-based, columns are 0-based, and the end position is exclusive.
 *
 * @param lineno        the first line
 * @param colOffset     the column of the first character
 * @param endLineno     the last line
 * @param endColOffset  the column just after the last character
 */
public record SourceSpan(int lineno, int colOffset, int endLineno, int endColOffset) {

    /**
     * Span of nodes that were not parsed from source text.
     */
    public static final SourceSpan NONE = new SourceSpan(0, 0, 0, 0);

    public SourceSpan {
        if (endLineno < lineno || (endLineno == lineno && endColOffset < colOffset)) {
            throw new IllegalArgumentException("span ends before it starts: "
                    + lineno + ":" + colOffset + "-" + endLineno + ":" + endColOffset);
        }
    }

    /**
     * Returns the span from the start of {@code start} to the end of {@code end}.
     */
    public static SourceSpan between(SourceSpan start, SourceSpan end) {
        return new SourceSpan(start.lineno, start.colOffset, end.endLineno, end.endColOffset);
    }

    @Override
    public String toString() {
        return lineno + ":" + colOffset + "-" + endLineno + ":" + endColOffset;
    }
}
