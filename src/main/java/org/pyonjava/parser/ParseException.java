package org.pyonjava.parser;

import org.pyonjava.runtime.ErrorMessageUtil;
import org.pyonjava.runtime.PyCompilerException;

import java.io.Serial;

/**
 * Raised by the {@link Parser} at the first syntax error. No partial tree is returned.
 * <p>
 * Besides the position, the exception keeps the offending source line and, for
 * errors with a well-known single-token fix such as a missing {@code :} after a
 * compound statement header, the corrected line.
 */
public class ParseException extends PyCompilerException {
    @Serial
    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNEXPECTED_TOKEN,
        EXPECTED_TOKEN,
        INVALID_TARGET
    }

    private final Kind kind;
    private final String sourceLine;
    private final String suggestion;

    public ParseException(Kind kind, int line, int column, String message, ErrorMessageUtil errorUtil) {
        this(kind, line, column, message, errorUtil, null);
    }

    public ParseException(Kind kind, int line, int column, String message, ErrorMessageUtil errorUtil,
                          String suggestion) {
        super(line, column, message, errorUtil.errorMessage(line, column, message, suggestion));
        this.kind = kind;
        this.sourceLine = errorUtil.getSourceLine(line);
        this.suggestion = suggestion;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the line the error was found on, or null if the source text is unknown.
     */
    public String getSourceLine() {
        return sourceLine;
    }

    /**
     * Returns the offending line with the fix applied, or null when there is no suggestion.
     */
    public String getSuggestion() {
        return suggestion;
    }
}
