package org.pyonjava.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.pyonjava.CompilerOptions;
import org.pyonjava.frontend.analysis.AstComparator;
import org.pyonjava.frontend.astnode.*;
import org.pyonjava.scriptengine.PyLanguageProvider;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EmitterVisitorTest {

    private static String regenerate(String source) {
        return PyLanguageProvider.generate(PyLanguageProvider.parse(source));
    }

    private static String emit(ModuleNode module) {
        EmitterVisitor emitterVisitor = new EmitterVisitor(new EmitterContext(new CompilerOptions()));
        module.accept(emitterVisitor);
        return emitterVisitor.getResult();
    }

    private static NameNode name(String id) {
        return new NameNode(id, ExprContext.LOAD, SourceSpan.NONE);
    }

    private static ExprStmtNode statement(ExpressionNode value) {
        return new ExprStmtNode(value, SourceSpan.NONE);
    }

    @Test
    public void testSimpleStatements() {
        assertEquals("x = 42\n", regenerate("x = 42"));
        assertEquals("def f():\n    pass\n", regenerate("def f():\n    pass\n"));
        assertEquals("a = b = 1\n", regenerate("a   =b= 1"));
        assertEquals("x += 1\n", regenerate("x+=1"));
        assertEquals("x: int = 5\n", regenerate("x:int=5"));
        assertEquals("(x): int\n", regenerate("(x): int"));
        assertEquals("a = 1\nb = 2\n", regenerate("a = 1; b = 2"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "(1 + 2) * 3        | (1 + 2) * 3",
            "1 + (2 * 3)        | 1 + 2 * 3",
            "a - (b - c)        | a - (b - c)",
            "(a - b) - c        | a - b - c",
            "(-2) ** 2          | (-2) ** 2",
            "-2 ** 2            | -2 ** 2",
            "2 ** (3 ** 2)      | 2 ** 3 ** 2",
            "(2 ** 3) ** 2      | (2 ** 3) ** 2",
            "2 ** -x            | 2 ** -x",
            "-(-x)              | --x",
            "not (a and b)      | not (a and b)",
            "(a or b) and c     | (a or b) and c",
            "a or (b or c)      | a or (b or c)",
            "(not a) == b       | (not a) == b",
            "(a < b) < c        | (a < b) < c",
            "a < b < c          | a < b < c",
            "(a | b) & c        | (a | b) & c",
            "a if (b if c else d) else e | a if (b if c else d) else e",
            "(a if b else c) if d else e | (a if b else c) if d else e",
            "(lambda: x)()      | (lambda: x)()",
            "x = lambda: (yield)| x = lambda: (yield)",
            "(await x) ** 2     | await x ** 2",
            "(-x).y             | (-x).y",
            "(1).real           | (1).real",
            "1.5.real           | 1.5.real",
            "(a, b)[0]          | (a, b)[0]",
            "x[a, b:c]          | x[a, b:c]",
            "x[(a, b)]          | x[a, b]",
            "x[()]              | x[()]",
            "f((a, b))          | f((a, b))",
            "x = 1,             | x = 1,",
            "x = ()             | x = ()",
            "for x, y in z: pass| for x, y in z:",
            "print(*a, *b)      | print(*a, *b)",
            "[*a, *b]           | [*a, *b]",
            "x = *a, *b         | x = *a, *b",
    })
    public void testParentheses(String source, String expectedFirstLine) {
        String generated = regenerate(source);
        assertEquals(expectedFirstLine, generated.split("\n")[0]);
        assertTrue(AstComparator.structurallyEqual(PyLanguageProvider.parse(source), PyLanguageProvider.parse(generated)),
                generated);
    }

    @Test
    public void testNamedExpressionIsAlwaysParenthesized() {
        assertEquals("if (n := len(a)) > 10:\n    pass\n", regenerate("if (n:=len(a)) > 10: pass"));
        assertEquals("print((x := 1))\n", regenerate("print(x := 1)"));
    }

    @Test
    public void testStrings() {
        assertEquals("s = \"hello\"\n", regenerate("s = 'hello'"));
        assertEquals("s = 'say \"hi\"'\n", regenerate("s = 'say \"hi\"'"));
        assertEquals("s = \"both ' and \\\"\"\n", regenerate("s = 'both \\' and \"'"));
        assertEquals("s = \"tab\\tnew\\nline\\\\\"\n", regenerate("s = 'tab\\tnew\\nline\\\\'"));
        assertEquals("s = \"\\x00\\x7f\"\n", regenerate("s = '\\0\\x7f'"));
        assertEquals("s = \"ab\"\n", regenerate("s = 'a' 'b'"));
        assertEquals("s = \"a\\nb\"\n", regenerate("s = '''a\nb'''"));
    }

    @Test
    public void testBytes() {
        assertEquals("b = b\"\\xff\\n'\"\n", regenerate("b = b'\\xff\\n\\''"));
    }

    @Test
    public void testSingleQuotePreference() {
        CompilerOptions options = new CompilerOptions();
        options.useSingleQuotes = true;
        ModuleNode module = PyLanguageProvider.parse("s = \"x\"\nt = \"it's\"\n");
        assertEquals("s = 'x'\nt = \"it's\"\n", PyLanguageProvider.generate(module, options));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "x = 1.0            | x = 1.0",
            "x = 1e20           | x = 1e+20",
            "x = 1.5e-7         | x = 1.5e-07",
            "x = 0.1            | x = 0.1",
            "x = 1e400          | x = 1e309",
            "x = 2j             | x = 2j",
            "x = 1.5J           | x = 1.5j",
            "x = 0xff           | x = 255",
            "x = 0o17           | x = 15",
            "x = 0b101          | x = 5",
            "x = 1_000_000      | x = 1000000",
            "x = 123456789012345678901234567890 | x = 123456789012345678901234567890",
    })
    public void testNumbers(String source, String expected) {
        assertEquals(expected + "\n", regenerate(source));
    }

    @Test
    public void testFormattedStrings() {
        assertEquals("s = f\"{x!r:>{width}}\"\n", regenerate("s = f'{x!r:>{width}}'"));
        assertEquals("s = f\"{d['k']} {{literal}}\"\n", regenerate("s = f\"{d['k']} {{literal}}\""));
        assertEquals("s = f\"{ {'a': 1}['a']}\"\n", regenerate("s = f\"{ {'a': 1}['a']}\""));
        assertEquals("s = f\"a{b}c\"\n", regenerate("s = 'a' f'{b}' 'c'"));
        assertEquals("s = f\"x={x!r}\"\n", regenerate("s = f'{x=}'"));
    }

    @Test
    public void testQuoteInFormatSpecPicksTheOtherOuterQuote() {
        assertEquals("s = f\"{x:'>10}\"\n", regenerate("s = f\"{x:'>10}\""));
        assertEquals("s = f'{x:\"<10}'\n", regenerate("s = f'{x:\"<10}'"));
        assertTrue(PyLanguageProvider.roundTrips("s = f'{x:\"<10}' + f\"{y:'^{w}}\"\n"));

        CompilerOptions options = new CompilerOptions("s = f\"{x:'>10}\"");
        options.useSingleQuotes = true;
        assertEquals("s = f\"{x:'>10}\"\n", PyLanguageProvider.generate(PyLanguageProvider.parse(options), options));
    }

    @Test
    public void testCollections() {
        assertEquals("merged = {**a, \"b\": 1, **c}\n", regenerate("merged = {**a, 'b': 1, **c}"));
        assertEquals("x = {}\n", regenerate("x = {}"));
        assertEquals("x = {1, 2}\n", regenerate("x = {1, 2}"));
        assertEquals("x = [i for i in range(3) if i if i > 1]\n", regenerate("x = [i for i in range(3) if i if i > 1]"));
        assertEquals("x = {k: v async for k, v in items}\n", regenerate("x = {k: v async for k, v in items}"));
        assertEquals("total = sum(x for x in y)\n", regenerate("total = sum((x for x in y))"));
        assertEquals("f((x for x in y), z)\n", regenerate("f((x for x in y), z)"));
        assertEquals("x = [i for i in (lambda: y)()]\n", regenerate("x = [i for i in (lambda: y)()]"));
    }

    @Test
    public void testEmptySetFromHandBuiltTree() {
        ModuleNode module = new ModuleNode(List.of(statement(new SetNode(List.of(), SourceSpan.NONE))), SourceSpan.NONE);
        assertEquals("{*()}\n", emit(module));
    }

    @Test
    public void testCallsAndSignatures() {
        assertEquals("f(a, *b, k=1, **d)\n", regenerate("f(a,*b,k=1,**d)"));
        assertEquals("def f(a, /, b=1, *args, c, d=2, **kwargs):\n    pass\n",
                regenerate("def f(a, /, b = 1, *args, c, d=2, **kwargs): pass"));
        assertEquals("def f(a: int = 1, *, b: str) -> None:\n    pass\n",
                regenerate("def f(a:int=1, *, b:str)->None: pass"));
        assertEquals("x = lambda a, *, b=1: a + b\n", regenerate("x = lambda a, *, b=1: a + b"));
        assertEquals("class A(B, metaclass=M):\n    pass\n", regenerate("class A(B, metaclass=M): pass"));
        assertEquals("class A:\n    pass\n", regenerate("class A(): pass"));
    }

    @Test
    public void testDecoratorsAndAsync() {
        String source = String.join("\n",
                "@app.route('/')",
                "@cache",
                "async def handler(request):",
                "    async with lock as held:",
                "        async for item in stream:",
                "            await item",
                "");
        String expected = String.join("\n",
                "@app.route(\"/\")",
                "@cache",
                "async def handler(request):",
                "    async with lock as held:",
                "        async for item in stream:",
                "            await item",
                "");
        assertEquals(expected, regenerate(source));
    }

    @Test
    public void testTypeParameters() {
        assertEquals("def f[T: int, *Ts, **P](x: T) -> T:\n    return x\n",
                regenerate("def f[T: int, *Ts, **P](x: T) -> T:\n    return x\n"));
        assertEquals("class Box[T = int]:\n    pass\n", regenerate("class Box[T = int]: pass"));
        assertEquals("type Pairs[T] = list[tuple[T, T]]\n", regenerate("type Pairs[T] = list[tuple[T, T]]"));
    }

    @Test
    public void testCompoundStatements() {
        String source = String.join("\n",
                "if a:",
                "    x",
                "elif b:",
                "    y",
                "else:",
                "    if c:",
                "        z",
                "while x:",
                "    break",
                "else:",
                "    continue",
                "try:",
                "    pass",
                "except (A, B) as e:",
                "    raise C() from e",
                "except D:",
                "    raise",
                "else:",
                "    pass",
                "finally:",
                "    pass",
                "");
        String expected = String.join("\n",
                "if a:",
                "    x",
                "elif b:",
                "    y",
                "elif c:",
                "    z",
                "while x:",
                "    break",
                "else:",
                "    continue",
                "try:",
                "    pass",
                "except (A, B) as e:",
                "    raise C() from e",
                "except D:",
                "    raise",
                "else:",
                "    pass",
                "finally:",
                "    pass",
                "");
        assertEquals(expected, regenerate(source));
    }

    @Test
    public void testTryStar() {
        assertEquals("try:\n    pass\nexcept* ValueError:\n    pass\n",
                regenerate("try:\n    pass\nexcept *ValueError:\n    pass\n"));
    }

    @Test
    public void testWithItems() {
        assertEquals("with a as b, c:\n    pass\n", regenerate("with (a as b, c):\n    pass\n"));
        assertEquals("with ((a, b)):\n    pass\n", regenerate("with ((a, b)):\n    pass\n"));
        assertEquals("with a, b:\n    pass\n", regenerate("with (a, b):\n    pass\n"));
        assertEquals("with (a, b), c:\n    pass\n", regenerate("with (a, b), c:\n    pass\n"));
    }

    @Test
    public void testImportsAndNames() {
        String source = String.join("\n",
                "import os.path as p, sys",
                "from ..pkg import (a, b as c)",
                "from . import x",
                "from m import *",
                "def f():",
                "    global g",
                "    nonlocal h, i",
                "    del a[0], b",
                "    assert x, 'msg'",
                "    return 1, 2",
                "");
        String expected = String.join("\n",
                "import os.path as p, sys",
                "from ..pkg import a, b as c",
                "from . import x",
                "from m import *",
                "def f():",
                "    global g",
                "    nonlocal h, i",
                "    del a[0], b",
                "    assert x, \"msg\"",
                "    return 1, 2",
                "");
        assertEquals(expected, regenerate(source));
    }

    @Test
    public void testYield() {
        String source = "def g():\n    x = yield\n    y = yield 1, 2\n    yield from z\n    f((yield))\n";
        assertEquals("def g():\n    x = yield\n    y = yield 1, 2\n    yield from z\n    f((yield))\n",
                regenerate(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "def f():\n    return (yield)\n",
            "def f():\n    return (yield x)\n",
            "def f():\n    return (yield from a)\n",
            "def f():\n    for x in (yield):\n        pass\n",
            "def f():\n    yield (yield)\n",
            "def f():\n    yield (yield from a), 1\n",
            "def f():\n    x += yield\n    y: int = yield from a\n    z = w = yield 1\n",
    })
    public void testYieldKeepsParenthesesOutsideStatementPositions(String source) {
        assertEquals(source, regenerate(source));
        assertTrue(PyLanguageProvider.roundTrips(source), source);
    }

    @Test
    public void testMatch() {
        String source = String.join("\n",
                "match command:",
                "    case [1, *rest]:",
                "        pass",
                "    case (x, y) if x > y:",
                "        pass",
                "    case {'k': v, **kw}:",
                "        pass",
                "    case Point(0, y=_) | None as p:",
                "        pass",
                "    case (1 | 2) as n:",
                "        pass",
                "    case -1 | 1 + 2j | 'a' | Color.RED:",
                "        pass",
                "    case _:",
                "        pass",
                "");
        String expected = String.join("\n",
                "match command:",
                "    case [1, *rest]:",
                "        pass",
                "    case [x, y] if x > y:",
                "        pass",
                "    case {\"k\": v, **kw}:",
                "        pass",
                "    case Point(0, y=_) | None as p:",
                "        pass",
                "    case 1 | 2 as n:",
                "        pass",
                "    case -1 | 1 + 2j | \"a\" | Color.RED:",
                "        pass",
                "    case _:",
                "        pass",
                "");
        assertEquals(expected, regenerate(source));
    }

    @Test
    public void testNestedAsPatternKeepsParentheses() {
        assertEquals("match x:\n    case (a as b) as c:\n        pass\n",
                regenerate("match x:\n    case (a as b) as c:\n        pass\n"));
        assertEquals("match x:\n    case (a as b) | c:\n        pass\n",
                regenerate("match x:\n    case (a as b) | c:\n        pass\n"));
    }

    @Test
    public void testBlankLinesAndEmptyBodies() {
        FunctionDefNode function = new FunctionDefNode("f",
                ArgumentsNode.empty(SourceSpan.NONE), List.of(), List.of(), null, List.of(), false, SourceSpan.NONE);
        AssignNode assign = new AssignNode(List.of(new NameNode("x", ExprContext.STORE, SourceSpan.NONE)),
                ConstantNode.ofInt(1, SourceSpan.NONE), SourceSpan.NONE);
        ModuleNode module = new ModuleNode(List.of(function, new BlankNode(2, SourceSpan.NONE), assign),
                SourceSpan.NONE);
        assertEquals("def f():\n    pass\n\n\nx = 1\n", emit(module));
    }

    @Test
    public void testHandBuiltNegativeConstant() {
        ExpressionNode power = new BinOpNode(ConstantNode.ofInt(-2, SourceSpan.NONE), BinaryOperator.POW,
                ConstantNode.ofFloat(-0.5, SourceSpan.NONE), SourceSpan.NONE);
        ExpressionNode attribute = new AttributeNode(ConstantNode.ofInt(-1, SourceSpan.NONE), "real",
                ExprContext.LOAD, SourceSpan.NONE);
        ModuleNode module = new ModuleNode(List.of(statement(power), statement(attribute)), SourceSpan.NONE);
        assertEquals("(-2) ** -0.5\n(-1).real\n", emit(module));
    }

    @Test
    public void testIndentSize() {
        CompilerOptions options = new CompilerOptions();
        options.indentSize = 2;
        ModuleNode module = PyLanguageProvider.parse("if a:\n    if b:\n        pass\n");
        assertEquals("if a:\n  if b:\n    pass\n", PyLanguageProvider.generate(module, options));
    }

    @Test
    public void testEmptyModule() {
        assertEquals("", regenerate(""));
        assertEquals("", regenerate("# comment only\n"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "x = a if b else c",
            "x = [a, (b, c), {d: e}]",
            "f(*args, **{'a': 1})",
            "x = not a == b",
            "x = a is not b",
            "x = a not in b",
            "x = ~a + -b * +c",
            "x = a @ b // c % d",
            "x = a << b >> c",
            "x = a[1:2:3]",
            "x = a[:, ::2]",
            "x = ...",
            "x = None, True, False",
            "del (a, b), [c]",
            "a, *b = c",
            "[a, b] = c",
            "x = (yield)",
            "for (a, b) in c: pass",
            "lambda *a, **k: (a, k)",
            "x = lambda x=(1, 2): x",
            "assert (a, b)",
            "raise E from None",
            "return_value = [x async for x in y]",
    })
    public void testRegeneratedTreeIsUnchanged(String source) {
        ModuleNode original = PyLanguageProvider.parse(source);
        String generated = PyLanguageProvider.generate(original);
        assertTrue(AstComparator.structurallyEqual(original, PyLanguageProvider.parse(generated)), generated);
    }
}
