package org.pyonjava.lexer;

import org.junit.jupiter.api.Test;
import org.pyonjava.CompilerOptions;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<LexerToken> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    private static List<LexerTokenType> types(String source) {
        return tokenize(source).stream()
                .map(token -> token.type)
                .collect(Collectors.toList());
    }

    private static long count(List<LexerToken> tokens, LexerTokenType type) {
        return tokens.stream().filter(token -> token.type == type).count();
    }

    @Test
    public void testSimpleAssignment() {
        List<LexerToken> tokens = tokenize("x = 42");
        assertEquals(List.of(LexerTokenType.NAME, LexerTokenType.EQUAL, LexerTokenType.NUMBER, LexerTokenType.ENDMARKER),
                tokens.stream().map(token -> token.type).collect(Collectors.toList()));
        assertEquals("x", tokens.get(0).text);
        assertEquals("42", tokens.get(2).text);
        assertEquals(1, tokens.get(2).line);
        assertEquals(4, tokens.get(2).column);
        assertEquals(6, tokens.get(2).endColumn);
    }

    @Test
    public void testFunctionBlockHasOneIndentDedentPair() {
        assertEquals(List.of(
                        LexerTokenType.DEF, LexerTokenType.NAME, LexerTokenType.LPAR, LexerTokenType.RPAR,
                        LexerTokenType.COLON, LexerTokenType.NEWLINE,
                        LexerTokenType.INDENT, LexerTokenType.PASS, LexerTokenType.NEWLINE,
                        LexerTokenType.DEDENT, LexerTokenType.ENDMARKER),
                types("def f():\n    pass\n"));
    }

    @Test
    public void testNestedBlocksUnwindAtEndOfInput() {
        String source = "class A:\n    def f(self):\n        if x:\n            return 1";
        List<LexerToken> tokens = tokenize(source);
        assertEquals(3, count(tokens, LexerTokenType.INDENT));
        assertEquals(3, count(tokens, LexerTokenType.DEDENT));
        assertEquals(LexerTokenType.ENDMARKER, tokens.get(tokens.size() - 1).type);
    }

    @Test
    public void testDedentToOuterLevel() {
        String source = "if a:\n    if b:\n        c\nd\n";
        List<LexerTokenType> types = types(source);
        int firstDedent = types.indexOf(LexerTokenType.DEDENT);
        assertEquals(LexerTokenType.DEDENT, types.get(firstDedent + 1));
        assertEquals(LexerTokenType.NAME, types.get(firstDedent + 2));
    }

    @Test
    public void testInconsistentDedent() {
        LexerException e = assertThrows(LexerException.class,
                () -> tokenize("if x:\n        a\n    b\n"));
        assertEquals(LexerException.Kind.INDENTATION, e.getKind());
        assertEquals(3, e.getLine());
        assertTrue(e.getMessage().startsWith("unindent does not match any outer indentation level"));
    }

    @Test
    public void testTabWidth() {
        CompilerOptions options = new CompilerOptions();
        options.tabSize = 4;
        // a tab and four spaces are the same level
        List<LexerToken> tokens = new Lexer("if x:\n\ta\n    b\n", options).tokenize();
        assertEquals(1, count(tokens, LexerTokenType.INDENT));
        assertEquals(1, count(tokens, LexerTokenType.DEDENT));
    }

    @Test
    public void testNoNewlineInsideBrackets() {
        List<LexerToken> tokens = tokenize("x = (1,\n     2)\ny = [\n  3,\n]\nz = {\n}\n");
        assertEquals(3, count(tokens, LexerTokenType.NEWLINE));
        assertEquals(0, count(tokens, LexerTokenType.INDENT));
    }

    @Test
    public void testBlankAndCommentLinesDoNotIndent() {
        List<LexerToken> tokens = tokenize("def f():\n\n        # comment\n    pass\n");
        assertEquals(1, count(tokens, LexerTokenType.INDENT));
        assertEquals(1, count(tokens, LexerTokenType.COMMENT));
        // NEWLINE after the header and after 'pass' only
        assertEquals(2, count(tokens, LexerTokenType.NEWLINE));
    }

    @Test
    public void testTrailingComment() {
        List<LexerToken> tokens = tokenize("x = 1  # one\n");
        LexerToken comment = tokens.get(3);
        assertEquals(LexerTokenType.COMMENT, comment.type);
        assertEquals("# one", comment.text);
        assertEquals(LexerTokenType.NEWLINE, tokens.get(4).type);
    }

    @Test
    public void testLineContinuation() {
        assertEquals(List.of(LexerTokenType.NAME, LexerTokenType.EQUAL, LexerTokenType.NUMBER, LexerTokenType.PLUS,
                        LexerTokenType.NUMBER, LexerTokenType.NEWLINE, LexerTokenType.ENDMARKER),
                types("x = 1 + \\\n    2\n"));
    }

    @Test
    public void testWindowsNewlines() {
        List<LexerToken> tokens = tokenize("x = 1\r\ny = 2\r\n");
        assertEquals(2, count(tokens, LexerTokenType.NEWLINE));
        assertEquals("\r\n", tokens.get(3).text);
        assertEquals(2, tokens.get(4).line);
    }

    @Test
    public void testNumberForms() {
        List<LexerToken> tokens = tokenize("0x_ff 0o17 0b1010 1_000 1.5e-3 3j .5 1E10");
        List<String> texts = tokens.stream()
                .filter(token -> token.type == LexerTokenType.NUMBER)
                .map(token -> token.text)
                .collect(Collectors.toList());
        assertEquals(List.of("0x_ff", "0o17", "0b1010", "1_000", "1.5e-3", "3j", ".5", "1E10"), texts);
    }

    @Test
    public void testOperatorsLongestMatch() {
        assertEquals(List.of(LexerTokenType.NAME, LexerTokenType.DOUBLESTAREQUAL, LexerTokenType.NAME,
                        LexerTokenType.DOUBLESLASH, LexerTokenType.NAME, LexerTokenType.ENDMARKER),
                types("a **= b // c"));
        assertEquals(List.of(LexerTokenType.NAME, LexerTokenType.COLONEQUAL, LexerTokenType.NAME,
                        LexerTokenType.RARROW, LexerTokenType.ELLIPSIS, LexerTokenType.ENDMARKER),
                types("a := b -> ..."));
    }

    @Test
    public void testKeywordsAndSoftKeywords() {
        List<LexerToken> tokens = tokenize("match case type None lambda other");
        assertEquals(LexerTokenType.MATCH, tokens.get(0).type);
        assertEquals(LexerTokenType.CASE, tokens.get(1).type);
        assertEquals(LexerTokenType.TYPE, tokens.get(2).type);
        assertEquals(LexerTokenType.NONE, tokens.get(3).type);
        assertEquals(LexerTokenType.LAMBDA, tokens.get(4).type);
        assertEquals(LexerTokenType.NAME, tokens.get(5).type);
        assertTrue(tokens.get(0).isName());
        assertFalse(tokens.get(3).isName());
    }

    @Test
    public void testStringPrefixes() {
        List<LexerToken> tokens = tokenize("r'\\d' b\"x\" Rb'y' f'{a}' rf\"{b}\" u'z'");
        assertEquals(List.of(LexerTokenType.STRING, LexerTokenType.STRING, LexerTokenType.STRING,
                        LexerTokenType.FSTRING, LexerTokenType.FSTRING, LexerTokenType.STRING, LexerTokenType.ENDMARKER),
                tokens.stream().map(token -> token.type).collect(Collectors.toList()));
        assertEquals("r'\\d'", tokens.get(0).text);
        assertEquals("Rb'y'", tokens.get(2).text);
    }

    @Test
    public void testPrefixLikeNameIsNotAString() {
        assertEquals(List.of(LexerTokenType.NAME, LexerTokenType.ENDMARKER), types("rb"));
    }

    @Test
    public void testTripleQuotedStringSpansLines() {
        List<LexerToken> tokens = tokenize("s = \"\"\"one\n'two'\nthree\"\"\"\nx\n");
        LexerToken string = tokens.get(2);
        assertEquals(LexerTokenType.STRING, string.type);
        assertEquals(1, string.line);
        assertEquals(3, string.endLine);
        assertEquals(LexerTokenType.NEWLINE, tokens.get(3).type);
        assertEquals(3, tokens.get(3).line);
        assertEquals(4, tokens.get(4).line);
    }

    @Test
    public void testEscapedQuoteDoesNotEndString() {
        List<LexerToken> tokens = tokenize("'it\\'s'");
        assertEquals("'it\\'s'", tokens.get(0).text);
        assertEquals(2, tokens.size());
    }

    @Test
    public void testFStringWithNestedQuotes() {
        List<LexerToken> tokens = tokenize("f\"{d[\"k\"]} and {x!r:>{w}}\"");
        assertEquals(2, tokens.size());
        assertEquals(LexerTokenType.FSTRING, tokens.get(0).type);
        assertEquals("f\"{d[\"k\"]} and {x!r:>{w}}\"", tokens.get(0).text);
    }

    @Test
    public void testQuoteInFormatSpecIsAFillCharacter() {
        List<LexerToken> tokens = tokenize("x = f\"{x:'>10}\"");
        assertEquals(LexerTokenType.FSTRING, tokens.get(2).type);
        assertEquals("f\"{x:'>10}\"", tokens.get(2).text);

        tokens = tokenize("f'{x:\"<10}' f'{x:{\"*\"}^{w}}'");
        assertEquals("f'{x:\"<10}'", tokens.get(0).text);
        assertEquals("f'{x:{\"*\"}^{w}}'", tokens.get(1).text);

        // a ':' inside brackets of the expression does not start the spec
        tokens = tokenize("f\"{ {'a': 1}['a']:'>5}\"");
        assertEquals(2, tokens.size());
        assertEquals(LexerTokenType.FSTRING, tokens.get(0).type);
    }

    @Test
    public void testFStringDoubledBraces() {
        List<LexerToken> tokens = tokenize("f'{{literal}}'");
        assertEquals(2, tokens.size());
        assertEquals("f'{{literal}}'", tokens.get(0).text);
    }

    @Test
    public void testNewlineInSingleQuotedStringIsUnterminated() {
        LexerException e = assertThrows(LexerException.class, () -> tokenize("s = 'abc\ndef'\n"));
        assertEquals(LexerException.Kind.UNTERMINATED_LITERAL, e.getKind());
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
        assertTrue(e.getMessage().startsWith("unterminated string literal"));
    }

    @Test
    public void testUnterminatedTripleQuotedString() {
        LexerException e = assertThrows(LexerException.class, () -> tokenize("x = '''abc\n"));
        assertEquals(LexerException.Kind.UNTERMINATED_LITERAL, e.getKind());
        assertTrue(e.getMessage().startsWith("unterminated triple-quoted string literal"));
    }

    @Test
    public void testInvalidCharacter() {
        LexerException e = assertThrows(LexerException.class, () -> tokenize("x = $"));
        assertEquals(LexerException.Kind.INVALID_CHARACTER, e.getKind());
        assertEquals(4, e.getColumn());
        assertTrue(e.getMessage().contains("U+0024"));
    }

    @Test
    public void testNonAsciiIdentifier() {
        List<LexerToken> tokens = tokenize("gr\u00f6\u00dfe = 1");
        assertEquals(LexerTokenType.NAME, tokens.get(0).type);
        assertEquals("gr\u00f6\u00dfe", tokens.get(0).text);
    }

    @Test
    public void testNonAsciiWhiteSpaceIsRejected() {
        LexerException e = assertThrows(LexerException.class, () -> tokenize("x =\u00a01"));
        assertEquals(LexerException.Kind.INVALID_CHARACTER, e.getKind());
    }

    @Test
    public void testNoNewlineSynthesizedAtEndOfInput() {
        assertEquals(List.of(LexerTokenType.PASS, LexerTokenType.ENDMARKER), types("pass"));
        assertEquals(List.of(LexerTokenType.PASS, LexerTokenType.NEWLINE, LexerTokenType.ENDMARKER), types("pass\n"));
    }

    @Test
    public void testEmptyInput() {
        assertEquals(List.of(LexerTokenType.ENDMARKER), types(""));
        assertEquals(List.of(LexerTokenType.ENDMARKER), types("\n\n   \n"));
    }

    @Test
    public void testByteOrderMarkIsSkipped() {
        List<LexerToken> tokens = tokenize("\uFEFFx = 1");
        assertEquals(LexerTokenType.NAME, tokens.get(0).type);
        assertEquals(0, tokens.get(0).column);
    }
}
