package org.pyonjava.runtime;

import java.io.Serial;

/**
 * PyCompilerException is the common base of the errors raised while lexing and parsing.
 * It extends RuntimeException and provides detailed error messages
 * that include the position of the error and, when the source is known,
 * the offending line with a caret under the error column.
 */
public class PyCompilerException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    // 1-based line of the error
    private final int line;
    // 0-based column of the error
    private final int column;
    // Detailed error message that includes additional context about the error
    private final String errorMessage;

    /**
     * Constructs a new PyCompilerException using the error message utility.
     *
     * @param line             the line where the error occurred (1-based)
     * @param column           the column where the error occurred (0-based)
     * @param message          the detail message describing the error
     * @param errorMessageUtil the utility for formatting error messages
     */
    public PyCompilerException(int line, int column, String message, ErrorMessageUtil errorMessageUtil) {
        this(line, column, message, errorMessageUtil.errorMessage(line, column, message));
    }

    protected PyCompilerException(int line, int column, String message, String errorMessage) {
        super(message);
        this.line = line;
        this.column = column;
        this.errorMessage = errorMessage;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Returns the message without position or source context.
     */
    public String getRawMessage() {
        return super.getMessage();
    }

    /**
     * Returns the detailed error message.
     *
     * @return the detailed error message
     */
    @Override
    public String getMessage() {
        return errorMessage;
    }
}
