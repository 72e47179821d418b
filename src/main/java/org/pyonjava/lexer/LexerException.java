package org.pyonjava.lexer;

import org.pyonjava.runtime.ErrorMessageUtil;
import org.pyonjava.runtime.PyCompilerException;

import java.io.Serial;

/**
 * Raised by the {@link Lexer} when the source cannot be tokenized.
 * Lexing stops at the first error.
 */
public class LexerException extends PyCompilerException {
    @Serial
    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** A dedent does not return to any enclosing indentation level. */
        INDENTATION,
        /** A string literal is not closed before the end of its line or of the input. */
        UNTERMINATED_LITERAL,
        /** A character that cannot start any token. */
        INVALID_CHARACTER
    }

    private final Kind kind;

    public LexerException(Kind kind, int line, int column, String message, ErrorMessageUtil errorMessageUtil) {
        super(line, column, message, errorMessageUtil);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
