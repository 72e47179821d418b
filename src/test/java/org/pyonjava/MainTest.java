package org.pyonjava;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testGenerateFromCommandLine() {
        assertEquals(0, run("-c", "x=(1)"));
        assertEquals("x = 1\n", stdout());
        assertEquals("", stderr());
    }

    @Test
    public void testGenerateFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("example.py");
        Files.writeString(file, "if a :\n\tb ='c'\n");
        assertEquals(0, run("--indent", "2", "--single-quotes", file.toString()));
        assertEquals("if a:\n  b = 'c'\n", stdout());
    }

    @Test
    public void testParseOnly() {
        assertEquals(0, run("--parse", "-c", "pass"));
        assertEquals("Module\n  Pass\n", stdout());
    }

    @Test
    public void testTokenizeOnly() {
        assertEquals(0, run("--tokenize", "-c", "x"));
        assertTrue(stdout().startsWith("LexerToken{type=NAME, text='x', pos=1:0}"), stdout());
        assertTrue(stdout().contains("ENDMARKER"), stdout());
    }

    @Test
    public void testHelp() {
        assertEquals(0, run("-h"));
        assertTrue(stdout().startsWith("Usage:"), stdout());
        assertTrue(stdout().contains("--tokenize"));
    }

    @Test
    public void testSyntaxError() {
        assertEquals(1, run("-c", "if x > 3\n    pass"));
        assertTrue(stderr().contains("Expected ':' but got newline at <command line> line 1, column 9"), stderr());
        assertEquals("", stdout());
    }

    @Test
    public void testBadArguments() {
        assertEquals(2, run("--frobnicate"));
        assertTrue(stderr().startsWith("Error: Unrecognized switch: --frobnicate"), stderr());
    }

    @Test
    public void testExclusiveOptions() {
        assertEquals(2, run("--tokenize", "--parse", "-c", "x"));
        assertTrue(stderr().contains("cannot be combined"), stderr());
    }

    @Test
    public void testMissingInput() {
        assertEquals(2, run());
        assertTrue(stderr().contains("No input"), stderr());
        assertEquals(2, run("--indent", "0", "-c", "x"));
        assertEquals(2, run("-c"));
    }

    @Test
    public void testUnreadableFile(@TempDir Path dir) {
        assertEquals(2, run(dir.resolve("missing.py").toString()));
        assertTrue(stderr().contains("Unable to read file"), stderr());
    }
}
