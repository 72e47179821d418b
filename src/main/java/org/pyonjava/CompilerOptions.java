package org.pyonjava;

/**
 * CompilerOptions is a configuration class that holds the settings used by the
 * lexer, the parser and the generator. It also stores the source code and the
 * file name, if provided.
 * <p>
 * Fields:
 * - debugEnabled: Enables debug mode, providing detailed logging on standard output.
 * - tokenizeOnly: If true, the language provider stops after tokenization.
 * - parseOnly: If true, the language provider stops after parsing.
 * - code: The source code to be processed.
 * - fileName: The name of the file containing the source code, if any.
 * - tabSize: The indentation width of a tab character.
 * - indentSize: The number of spaces per indentation level in generated code.
 * - useSingleQuotes: If true, generated string literals prefer single quotes.
 */
public class CompilerOptions implements Cloneable {
    public boolean debugEnabled = false;
    public boolean tokenizeOnly = false;
    public boolean parseOnly = false;
    public String code = null;
    public String fileName = Configuration.defaultFileName;
    public int tabSize = Configuration.defaultTabSize;
    public int indentSize = Configuration.defaultIndentSize;
    public boolean useSingleQuotes = false;

    public CompilerOptions() {
    }

    public CompilerOptions(String code) {
        this.code = code;
    }

    @Override
    public CompilerOptions clone() {
        try {
            // Use super.clone() to create a shallow copy
            return (CompilerOptions) super.clone();
        } catch (CloneNotSupportedException e) {
            // This shouldn't happen, since we're implementing Cloneable
            throw new AssertionError();
        }
    }

    @Override
    public String toString() {
        return "CompilerOptions{\n" +
                "    debugEnabled=" + debugEnabled + ",\n" +
                "    tokenizeOnly=" + tokenizeOnly + ",\n" +
                "    parseOnly=" + parseOnly + ",\n" +
                "    fileName='" + fileName + "',\n" +
                "    tabSize=" + tabSize + ",\n" +
                "    indentSize=" + indentSize + ",\n" +
                "    useSingleQuotes=" + useSingleQuotes + "\n" +
                "}";
    }
}
