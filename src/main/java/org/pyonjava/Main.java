package org.pyonjava;

import org.pyonjava.frontend.astnode.ModuleNode;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.runtime.PyCompilerException;
import org.pyonjava.scriptengine.PyLanguageProvider;

import java.io.PrintStream;

/**
 * Command-line entry point: prints the tokens, the syntax tree or the regenerated
 * source of one input.
 */
public class Main {

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the tool.
     *
     * @return the exit status: 0 on success, 1 for a syntax error, 2 for bad arguments
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (ArgumentParser.isHelpRequest(args)) {
            out.print(ArgumentParser.helpText());
            return 0;
        }
        CompilerOptions compilerOptions;
        try {
            compilerOptions = ArgumentParser.parseArguments(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }
        try {
            if (compilerOptions.tokenizeOnly) {
                for (LexerToken token : PyLanguageProvider.tokenize(compilerOptions)) {
                    out.println(token);
                }
                return 0;
            }
            ModuleNode module = PyLanguageProvider.parse(compilerOptions);
            if (compilerOptions.parseOnly) {
                out.print(PyLanguageProvider.dump(module));
                return 0;
            }
            out.print(PyLanguageProvider.generate(module, compilerOptions));
            return 0;
        } catch (PyCompilerException e) {
            err.println(e.getMessage());
            return 1;
        }
    }
}
