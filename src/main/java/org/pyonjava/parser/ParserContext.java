package org.pyonjava.parser;

import org.pyonjava.CompilerOptions;
import org.pyonjava.runtime.ErrorMessageUtil;

/**
 * Per-parse state shared by the parser and the nested parsers it starts for
 * f-string replacement fields: the options and the error formatter for the
 * source text being parsed.
 */
public class ParserContext {
    public final CompilerOptions compilerOptions;
    public final ErrorMessageUtil errorUtil;

    public ParserContext(CompilerOptions compilerOptions, ErrorMessageUtil errorUtil) {
        this.compilerOptions = compilerOptions;
        this.errorUtil = errorUtil;
    }

    public void logDebug(String message) {
        if (this.compilerOptions.debugEnabled) {
            System.out.println(message);
        }
    }

    @Override
    public String toString() {
        return "ParserContext{\n" +
                "    fileName=" + errorUtil.getFileName() + ",\n" +
                "    compilerOptions=" + compilerOptions + "\n" +
                "}";
    }
}
