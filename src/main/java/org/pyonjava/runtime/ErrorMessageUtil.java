package org.pyonjava.runtime;

import org.pyonjava.Configuration;

/**
 * Utility class for generating error messages with context from the source text.
 * <p>
 * A formatted message looks like:
 * <pre>
 * Expected ':' but got newline at line 1, column 9
 *
 *   if x > 3
 *           ^
 *
 * Did you mean:
 *   if x > 3:
 * </pre>
 */
public class ErrorMessageUtil {
    private final String fileName;
    private final String[] sourceLines;

    /**
     * Constructs an ErrorMessageUtil with the specified file name and source text.
     *
     * @param fileName the name of the file, or null for the default name
     * @param source   the source text, or null when only tokens are available
     */
    public ErrorMessageUtil(String fileName, String source) {
        this.fileName = fileName == null ? Configuration.defaultFileName : fileName;
        this.sourceLines = source == null ? new String[0] : source.split("\r\n|\r|\n", -1);
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Returns the source line with the given 1-based number, or null if unknown.
     */
    public String getSourceLine(int line) {
        if (line < 1 || line > sourceLines.length) {
            return null;
        }
        return sourceLines[line - 1];
    }

    /**
     * Quotes a token text for inclusion in an error message.
     * Structural tokens have no text and are described by name instead.
     *
     * @param text the token text
     * @return the quoted text
     */
    public static String describe(String text) {
        if (text == null || text.isEmpty()) {
            return "end of input";
        }
        if (text.equals("\n") || text.equals("\r\n") || text.equals("\r")) {
            return "newline";
        }
        StringBuilder escaped = new StringBuilder();
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                case '\\':
                    escaped.append("\\\\");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return "'" + escaped + "'";
    }

    /**
     * Generates an error message with the position and the offending source line.
     *
     * @param line    the 1-based line of the error
     * @param column  the 0-based column of the error
     * @param message the error message
     * @return the formatted error message with context
     */
    public String errorMessage(int line, int column, String message) {
        return errorMessage(line, column, message, null);
    }

    /**
     * Generates an error message with the position, the offending source line and a
     * suggested replacement line.
     *
     * @param line       the 1-based line of the error
     * @param column     the 0-based column of the error
     * @param message    the error message
     * @param suggestion the corrected source line, or null
     * @return the formatted error message with context
     */
    public String errorMessage(int line, int column, String message, String suggestion) {
        StringBuilder sb = new StringBuilder(message).append(" at ");
        if (!fileName.equals(Configuration.defaultFileName)) {
            sb.append(fileName).append(' ');
        }
        sb.append("line ").append(line).append(", column ").append(column + 1);

        String sourceLine = getSourceLine(line);
        if (sourceLine != null) {
            sb.append("\n\n  ").append(sourceLine).append('\n');
            sb.append("  ").append(" ".repeat(Math.max(0, Math.min(column, sourceLine.length())))).append('^');
            if (suggestion != null) {
                sb.append("\n\nDid you mean:\n  ").append(suggestion);
            }
        }
        return sb.toString();
    }

    /**
     * Inserts text into a source line at the given column, dropping trailing white space
     * before the insertion point.
     *
     * @param sourceLine the original line
     * @param column     the 0-based insertion column
     * @param text       the text to insert
     * @return the corrected line
     */
    public static String insertAt(String sourceLine, int column, String text) {
        int at = Math.max(0, Math.min(column, sourceLine.length()));
        String head = sourceLine.substring(0, at).stripTrailing();
        return head + text + sourceLine.substring(at);
    }
}
