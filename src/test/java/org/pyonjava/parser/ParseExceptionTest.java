package org.pyonjava.parser;

import org.junit.jupiter.api.Test;
import org.pyonjava.CompilerOptions;
import org.pyonjava.lexer.LexerException;
import org.pyonjava.runtime.ErrorMessageUtil;
import org.pyonjava.runtime.PyCompilerException;
import org.pyonjava.scriptengine.PyLanguageProvider;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Formatting of syntax error messages.
 */
public class ParseExceptionTest {

    @Test
    public void testMissingColonMessage() {
        ParseException e = assertThrows(ParseException.class,
                () -> PyLanguageProvider.parse("if x > 3\n    print(x)"));
        String expected = "Expected ':' but got newline at line 1, column 9\n"
                + "\n"
                + "  if x > 3\n"
                + "          ^\n"
                + "\n"
                + "Did you mean:\n"
                + "  if x > 3:";
        assertEquals(expected, e.getMessage());
        assertEquals("Expected ':' but got newline", e.getRawMessage());
        assertEquals(8, e.getColumn());
    }

    @Test
    public void testMessageNamesTheFile() {
        CompilerOptions options = new CompilerOptions("x = = 1\n");
        options.fileName = "script.py";
        ParseException e = assertThrows(ParseException.class, () -> PyLanguageProvider.parse(options));
        assertNull(e.getSuggestion());
        assertTrue(e.getMessage().startsWith("Unexpected token '=' at script.py line 1, column 5"),
                e.getMessage());
        assertTrue(e.getMessage().endsWith("  x = = 1\n      ^"), e.getMessage());
    }

    @Test
    public void testMissingColonOnIndentedLine() {
        ParseException e = assertThrows(ParseException.class,
                () -> PyLanguageProvider.parse("def f():\n    while x  # loop\n        pass\n"));
        assertEquals(2, e.getLine());
        assertEquals("    while x:  # loop", e.getSuggestion());
    }

    @Test
    public void testMissingColonAfterClassAndElse() {
        ParseException classError = assertThrows(ParseException.class,
                () -> PyLanguageProvider.parse("class A(B)\n    pass\n"));
        assertEquals("class A(B):", classError.getSuggestion());

        ParseException elseError = assertThrows(ParseException.class,
                () -> PyLanguageProvider.parse("if a:\n    pass\nelse\n    pass\n"));
        assertEquals("else:", elseError.getSuggestion());
        assertEquals(3, elseError.getLine());
    }

    @Test
    public void testLexerAndParserErrorsShareTheBase() {
        PyCompilerException lexerError = assertThrows(PyCompilerException.class,
                () -> PyLanguageProvider.parse("s = 'open\n"));
        assertInstanceOf(LexerException.class, lexerError);
        assertTrue(lexerError.getMessage().contains("\n  s = 'open\n      ^"), lexerError.getMessage());

        PyCompilerException parserError = assertThrows(PyCompilerException.class,
                () -> PyLanguageProvider.parse("(1, 2"));
        assertInstanceOf(ParseException.class, parserError);
    }

    @Test
    public void testDescribe() {
        assertEquals("newline", ErrorMessageUtil.describe("\n"));
        assertEquals("end of input", ErrorMessageUtil.describe(""));
        assertEquals("'if'", ErrorMessageUtil.describe("if"));
        assertEquals("'a\\tb'", ErrorMessageUtil.describe("a\tb"));
    }

    @Test
    public void testInsertAt() {
        assertEquals("if x:", ErrorMessageUtil.insertAt("if x   ", 7, ":"));
        assertEquals("for a in b:  # c", ErrorMessageUtil.insertAt("for a in b  # c", 10, ":"));
    }
}
