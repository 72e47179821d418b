package org.pyonjava.codegen;

/**
 * Turns string, bytes and float values back into literal text that the lexer reads
 * as the same value.
 */
public class StringQuoting {

    // Prevent instantiation
    private StringQuoting() {
    }

    public static char otherQuote(char quote) {
        return quote == '"' ? '\'' : '"';
    }

    /**
     * Picks the quote character for a literal.
     * <p>
     * The preferred quote is kept unless the value contains it and does not contain
     * the other one. A forbidden quote is never returned.
     *
     * @param value     the text of the literal
     * @param preferred the quote to use when nothing speaks against it
     * @param forbidden a quote that must not be used, or 0
     */
    public static char chooseQuote(String value, char preferred, char forbidden) {
        char other = otherQuote(preferred);
        if (preferred == forbidden) {
            return other;
        }
        if (other != forbidden && value.indexOf(preferred) >= 0 && value.indexOf(other) < 0) {
            return other;
        }
        return preferred;
    }

    /**
     * Returns a str literal for the value, quoted with {@code quote}.
     */
    public static String quote(String value, char quote) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(quote);
        appendEscaped(sb, value, quote, false);
        return sb.append(quote).toString();
    }

    /**
     * Appends the escaped text of a str value, without quotes.
     *
     * @param doubleBraces whether '{' and '}' are written twice, as in f-string text
     */
    public static void appendEscaped(StringBuilder sb, String value, char quote, boolean doubleBraces) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\') {
                sb.append("\\\\");
            } else if (c == quote) {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (doubleBraces && (c == '{' || c == '}')) {
                sb.append(c).append(c);
            } else if (c < 0x20 || (c >= 0x7f && c < 0xa0)) {
                sb.append(String.format("\\x%02x", (int) c));
            } else if (Character.isHighSurrogate(c) && i + 1 < value.length()
                    && Character.isLowSurrogate(value.charAt(i + 1))) {
                sb.append(c).append(value.charAt(++i));
            } else if (Character.isSurrogate(c)) {
                // lone surrogate
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
        }
    }

    /**
     * Returns a bytes literal for the value, one char per byte.
     */
    public static String quoteBytes(String value, char quote) {
        StringBuilder sb = new StringBuilder(value.length() + 3);
        sb.append('b').append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote) {
                        sb.append('\\').append(c);
                    } else if (c >= 0x20 && c < 0x7f) {
                        sb.append(c);
                    } else {
                        sb.append(String.format("\\x%02x", c & 0xff));
                    }
                }
            }
        }
        return sb.append(quote).toString();
    }

    /**
     * Formats a finite or infinite float so that it lexes back as a float with the
     * same value: {@code 1.0}, {@code 0.5}, {@code 1e+20}, {@code 1.5e-07}, {@code 1e309}.
     * NaN has no literal form and is written as an expression.
     */
    public static String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return "(1e309 - 1e309)";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "1e309" : "-1e309";
        }
        String text = Double.toString(value);
        int e = text.indexOf('E');
        if (e < 0) {
            return text;
        }
        String mantissa = text.substring(0, e);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        String exponent = text.substring(e + 1);
        String sign = "+";
        if (exponent.startsWith("-")) {
            sign = "-";
            exponent = exponent.substring(1);
        }
        if (exponent.length() < 2) {
            exponent = "0" + exponent;
        }
        return mantissa + "e" + sign + exponent;
    }

    /**
     * Formats the imaginary part of a complex literal: {@code 3j}, {@code 1.5j}.
     */
    public static String formatImaginary(double value) {
        if (Double.isNaN(value)) {
            return "(1e309j - 1e309j)";
        }
        String text = formatFloat(value);
        if (text.endsWith(".0")) {
            text = text.substring(0, text.length() - 2);
        }
        return text + "j";
    }
}
