package org.pyonjava.codegen;

import org.pyonjava.CompilerOptions;
import org.pyonjava.frontend.astnode.Precedence;

import java.util.HashMap;
import java.util.Map;

/**
 * The EmitterContext class holds the state shared while a syntax tree is turned back
 * into source text.
 * <p>
 * Derived contexts created with {@link #with(int)} share the output buffer and the
 * indentation level, and differ only in the precedence demanded at the current
 * position.
 */
public class EmitterContext {

    /**
     * The options controlling indentation width and preferred quote.
     */
    public final CompilerOptions compilerOptions;

    /**
     * The output buffer, shared by all derived contexts.
     */
    public final StringBuilder output;

    /**
     * The lowest expression precedence that can appear here without parentheses.
     *
     * @see Precedence
     */
    public final int precedence;

    /**
     * A quote character that string literals must not use, or 0.
     * Set inside the replacement fields of an f-string.
     */
    public final char forbiddenQuote;

    private final Indentation indentation;
    private final Map<Integer, EmitterContext> contextCache = new HashMap<>();

    public EmitterContext(CompilerOptions compilerOptions) {
        this(compilerOptions, new StringBuilder(), new Indentation(), Precedence.TUPLE, (char) 0);
    }

    private EmitterContext(CompilerOptions compilerOptions, StringBuilder output, Indentation indentation,
                           int precedence, char forbiddenQuote) {
        this.compilerOptions = compilerOptions;
        this.output = output;
        this.indentation = indentation;
        this.precedence = precedence;
        this.forbiddenQuote = forbiddenQuote;
    }

    /**
     * Creates an EmitterContext that demands the given precedence.
     * The other properties are shared with the current context.
     *
     * @param precedence the lowest precedence allowed without parentheses
     * @return a context writing to the same output
     */
    public EmitterContext with(int precedence) {
        if (precedence == this.precedence) {
            return this;
        }
        return contextCache.computeIfAbsent(precedence,
                p -> new EmitterContext(compilerOptions, output, indentation, p, forbiddenQuote));
    }

    /**
     * Creates an EmitterContext for the replacement fields of an f-string quoted with
     * {@code quote}. Expressions there may not use that quote character.
     */
    public EmitterContext insideFormatField(char quote) {
        return new EmitterContext(compilerOptions, new StringBuilder(), indentation, Precedence.TEST + 1, quote);
    }

    /**
     * The quote character string literals should use when the value allows it.
     */
    public char preferredQuote() {
        char preferred = compilerOptions.useSingleQuotes ? '\'' : '"';
        if (preferred == forbiddenQuote) {
            return preferred == '"' ? '\'' : '"';
        }
        return preferred;
    }

    public EmitterContext append(String text) {
        output.append(text);
        return this;
    }

    public EmitterContext append(char c) {
        output.append(c);
        return this;
    }

    /**
     * Starts a new line at the current indentation.
     */
    public void startLine() {
        output.append(" ".repeat(indentation.level * compilerOptions.indentSize));
    }

    public void endLine() {
        output.append('\n');
    }

    public void indent() {
        indentation.level++;
    }

    public void dedent() {
        indentation.level--;
    }

    public void logDebug(String message) {
        if (this.compilerOptions.debugEnabled) {
            System.out.println(message);
        }
    }

    @Override
    public String toString() {
        return "EmitterContext{\n" +
                "    precedence=" + precedence + ",\n" +
                "    indentLevel=" + indentation.level + ",\n" +
                "    forbiddenQuote=" + (forbiddenQuote == 0 ? "none" : String.valueOf(forbiddenQuote)) + ",\n" +
                "    compilerOptions=" + compilerOptions + "\n" +
                "}";
    }

    private static class Indentation {
        int level;
    }
}
