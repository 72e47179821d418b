package org.pyonjava.scriptengine;

import org.pyonjava.CompilerOptions;
import org.pyonjava.codegen.EmitterContext;
import org.pyonjava.codegen.EmitterVisitor;
import org.pyonjava.frontend.analysis.AstComparator;
import org.pyonjava.frontend.analysis.PrintVisitor;
import org.pyonjava.frontend.astnode.ModuleNode;
import org.pyonjava.frontend.astnode.Node;
import org.pyonjava.lexer.Lexer;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.parser.Parser;
import org.pyonjava.parser.ParserContext;
import org.pyonjava.runtime.ErrorMessageUtil;

import java.util.List;

/**
 * The PyLanguageProvider class is the entry point to the frontend: it tokenizes and
 * parses source text, and turns syntax trees back into source text.
 * <p>
 * Every call builds its own lexer, parser and emitter, so the methods can be used
 * from several threads at once.
 * <p>
 * Errors are reported by throwing {@link org.pyonjava.lexer.LexerException} or
 * {@link org.pyonjava.parser.ParseException}; both extend
 * {@link org.pyonjava.runtime.PyCompilerException}. The first error ends the call.
 */
public class PyLanguageProvider {

    // Prevent instantiation
    private PyLanguageProvider() {
    }

    public static List<LexerToken> tokenize(String source) {
        return tokenize(new CompilerOptions(source));
    }

    /**
     * Tokenizes {@code compilerOptions.code}.
     *
     * @param compilerOptions Compiler flags, file name and source code
     * @return The tokens, ending with ENDMARKER.
     */
    public static List<LexerToken> tokenize(CompilerOptions compilerOptions) {
        Lexer lexer = new Lexer(compilerOptions.code, compilerOptions);
        List<LexerToken> tokens = lexer.tokenize();
        if (compilerOptions.debugEnabled) {
            System.out.println("tokenized " + compilerOptions.fileName + ": " + tokens.size() + " tokens");
        }
        return tokens;
    }

    public static ModuleNode parse(String source) {
        return parse(new CompilerOptions(source));
    }

    /**
     * Parses {@code compilerOptions.code} into a module.
     *
     * @param compilerOptions Compiler flags, file name and source code
     * @return The syntax tree.
     */
    public static ModuleNode parse(CompilerOptions compilerOptions) {
        ErrorMessageUtil errorUtil = new ErrorMessageUtil(compilerOptions.fileName, compilerOptions.code);
        ParserContext ctx = new ParserContext(compilerOptions, errorUtil);
        ctx.logDebug("parse code: " + compilerOptions.fileName);

        Lexer lexer = new Lexer(compilerOptions.code, compilerOptions, errorUtil, 1, 0);
        List<LexerToken> tokens = lexer.tokenize();
        Parser parser = new Parser(ctx, tokens);
        return parser.parse();
    }

    public static String generate(ModuleNode module) {
        return generate(module, new CompilerOptions());
    }

    /**
     * Writes a module as source text.
     *
     * @param module          The syntax tree, parsed or built by hand.
     * @param compilerOptions The indentation width and preferred quote.
     * @return The source text; every statement line ends with a newline.
     */
    public static String generate(ModuleNode module, CompilerOptions compilerOptions) {
        EmitterVisitor emitterVisitor = new EmitterVisitor(new EmitterContext(compilerOptions));
        module.accept(emitterVisitor);
        return emitterVisitor.getResult();
    }

    /**
     * Renders a tree as indented text, one node per line.
     */
    public static String dump(Node node) {
        PrintVisitor printVisitor = new PrintVisitor();
        node.accept(printVisitor);
        return printVisitor.getResult();
    }

    public static boolean roundTrips(String source) {
        return roundTrips(new CompilerOptions(source));
    }

    /**
     * Parses the source, generates text from the tree, parses that text again and
     * compares the two trees, ignoring positions.
     */
    public static boolean roundTrips(CompilerOptions compilerOptions) {
        ModuleNode original = parse(compilerOptions);
        CompilerOptions regenerated = compilerOptions.clone();
        regenerated.code = generate(original, compilerOptions);
        ModuleNode reparsed = parse(regenerated);
        return AstComparator.structurallyEqual(original, reparsed);
    }
}
