package org.pyonjava;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pyonjava.frontend.astnode.ModuleNode;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;
import org.pyonjava.parser.ParseException;
import org.pyonjava.runtime.PyCompilerException;
import org.pyonjava.scriptengine.PyLanguageProvider;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PyLanguageProviderTest {

    private PrintStream originalOut;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    public void testTokenize() {
        List<LexerToken> tokens = PyLanguageProvider.tokenize("x = 1\n");
        assertEquals(LexerTokenType.NAME, tokens.get(0).type);
        assertEquals(LexerTokenType.ENDMARKER, tokens.get(tokens.size() - 1).type);
    }

    @Test
    public void testParseAndGenerate() {
        ModuleNode module = PyLanguageProvider.parse("def greet(name):\n    print('hi', name)\n");
        assertEquals(1, module.body.size());
        assertEquals("def greet(name):\n    print(\"hi\", name)\n", PyLanguageProvider.generate(module));
    }

    @Test
    public void testDump() {
        String dump = PyLanguageProvider.dump(PyLanguageProvider.parse("pass"));
        assertEquals("Module\n  Pass\n", dump);
    }

    @Test
    public void testRoundTrips() {
        String source = String.join("\n",
                "class Stack:",
                "    def __init__(self):",
                "        self.items = []",
                "",
                "    def push(self, item):",
                "        self.items.append(item)",
                "",
                "    def pop(self):",
                "        if not self.items:",
                "            raise IndexError('pop from empty stack')",
                "        return self.items.pop()",
                "");
        assertTrue(PyLanguageProvider.roundTrips(source));
        assertTrue(PyLanguageProvider.roundTrips("x = {**a, 'b': 1}\nprint(f'{x!r:>{width}}')\n"));
    }

    @Test
    public void testRoundTripWithOptions() {
        CompilerOptions options = new CompilerOptions("if a:\n    b = 'x'\n");
        options.indentSize = 2;
        options.useSingleQuotes = true;
        assertTrue(PyLanguageProvider.roundTrips(options));
    }

    @Test
    public void testErrorsAreThrown() {
        PyCompilerException e = assertThrows(PyCompilerException.class, () -> PyLanguageProvider.parse("if x\n"));
        assertInstanceOf(ParseException.class, e);
        assertEquals(1, e.getLine());
        assertThrows(PyCompilerException.class, () -> PyLanguageProvider.tokenize("a = $"));
        assertThrows(PyCompilerException.class, () -> PyLanguageProvider.roundTrips("def (:"));
    }

    @Test
    public void testDebugOutput() {
        CompilerOptions options = new CompilerOptions("x = 1\n");
        options.debugEnabled = true;
        PyLanguageProvider.tokenize(options);
        assertTrue(outputStream.toString().contains("tokenized <string>"), outputStream.toString());
    }
}
