package org.pyonjava;

/**
 * Central configuration class for the PyOnJava frontend.
 * Contains constants that control lexer, parser and generator defaults.
 */
public final class Configuration {

    public static final String jarVersion = "1.0.0";

    // The language version whose grammar the parser follows
    public static final String grammarVersion = "3.12";

    // File name used in error messages when the source has no file
    public static final String defaultFileName = "<string>";

    // Indentation width of a tab character
    public static final int defaultTabSize = 8;

    // Indentation width used by the generator
    public static final int defaultIndentSize = 4;

    // Prevent instantiation
    private Configuration() {
    }
}
