package org.pyonjava.frontend.analysis;

import org.junit.jupiter.api.Test;
import org.pyonjava.frontend.astnode.ModuleNode;
import org.pyonjava.scriptengine.PyLanguageProvider;

import static org.junit.jupiter.api.Assertions.*;

public class PrintVisitorTest {

    private static String print(String source, boolean showSpans) {
        PrintVisitor printVisitor = new PrintVisitor(showSpans);
        PyLanguageProvider.parse(source).accept(printVisitor);
        return printVisitor.getResult();
    }

    @Test
    public void testAssignment() {
        String expected = String.join("\n",
                "Module",
                "  Assign",
                "    targets:",
                "      Name: x  ctx:Store",
                "    value:",
                "      Constant: 42",
                "");
        assertEquals(expected, print("x = 42", false));
    }

    @Test
    public void testOperatorsAndEmptyLists() {
        String result = print("def f():\n    return a + 1\n", false);
        assertTrue(result.contains("FunctionDef: f\n"), result);
        assertTrue(result.contains("type_params: []\n"), result);
        assertTrue(result.contains("decorator_list: []\n"), result);
        assertTrue(result.contains("returns: null\n"), result);
        assertTrue(result.contains("BinOp: Add\n"), result);
        assertTrue(result.contains("Name: a  ctx:Load\n"), result);
    }

    @Test
    public void testConstants() {
        String result = print("x = 'it\\'s\\n', b'\\x00', 1.5, 2j, None, ...", false);
        assertTrue(result.contains("Constant: 'it\\'s\\n'\n"), result);
        assertTrue(result.contains("Constant: b'\\x00'\n"), result);
        assertTrue(result.contains("Constant: 1.5 (float)\n"), result);
        assertTrue(result.contains("Constant: 2.0j\n"), result);
        assertTrue(result.contains("Constant: None\n"), result);
        assertTrue(result.contains("Constant: Ellipsis\n"), result);
    }

    @Test
    public void testSpansOnlyWhenRequested() {
        assertFalse(print("x = 42", false).contains("pos:"));
        String result = print("x = 42", true);
        assertTrue(result.contains("Assign  pos:1:0-1:6\n"), result);
        assertTrue(result.contains("Constant: 42  pos:1:4-1:6\n"), result);
    }

    @Test
    public void testComparatorIgnoresSpans() {
        ModuleNode compact = PyLanguageProvider.parse("x=[1,2]");
        ModuleNode spaced = PyLanguageProvider.parse("\n\nx = [ 1 ,\n      2 ]\n");
        assertTrue(AstComparator.structurallyEqual(compact, spaced));

        ModuleNode different = PyLanguageProvider.parse("x = [1, 3]");
        assertFalse(AstComparator.structurallyEqual(compact, different));
        assertTrue(AstComparator.structurallyEqual(null, null));
        assertFalse(AstComparator.structurallyEqual(compact, null));
    }

    @Test
    public void testPrintable() {
        assertEquals("'a\\tb\\x01'", PrintVisitor.printable("a\tb\u0001"));
    }
}
