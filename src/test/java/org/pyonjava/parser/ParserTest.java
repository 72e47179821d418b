package org.pyonjava.parser;

import org.junit.jupiter.api.Test;
import org.pyonjava.frontend.astnode.*;
import org.pyonjava.scriptengine.PyLanguageProvider;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static ModuleNode parse(String source) {
        return PyLanguageProvider.parse(source);
    }

    private static StatementNode first(String source) {
        ModuleNode module = parse(source);
        assertFalse(module.body.isEmpty(), "no statements parsed");
        return module.body.get(0);
    }

    private static ExpressionNode expression(String source) {
        StatementNode statement = first(source);
        assertInstanceOf(ExprStmtNode.class, statement);
        return ((ExprStmtNode) statement).value;
    }

    private static void assertName(String id, ExprContext ctx, Node node) {
        NameNode name = assertInstanceOf(NameNode.class, node);
        assertEquals(id, name.id);
        assertEquals(ctx, name.ctx);
    }

    private static void assertInt(long value, Node node) {
        ConstantNode constant = assertInstanceOf(ConstantNode.class, node);
        assertEquals(ConstantNode.Kind.INT, constant.kind);
        assertEquals(BigInteger.valueOf(value), constant.value);
    }

    @Test
    public void testSimpleAssignment() {
        ModuleNode module = parse("x = 42");
        assertEquals(1, module.body.size());
        AssignNode assign = assertInstanceOf(AssignNode.class, module.body.get(0));
        assertEquals(1, assign.targets.size());
        assertName("x", ExprContext.STORE, assign.targets.get(0));
        assertInt(42, assign.value);
    }

    @Test
    public void testFunctionDefinition() {
        ModuleNode module = parse("def f():\n    pass\n");
        assertEquals(1, module.body.size());
        FunctionDefNode function = assertInstanceOf(FunctionDefNode.class, module.body.get(0));
        assertEquals("f", function.name);
        assertFalse(function.isAsync);
        assertEquals(1, function.body.size());
        assertInstanceOf(PassNode.class, function.body.get(0));
        assertTrue(function.args.args.isEmpty());
        assertNull(function.returns);
    }

    @Test
    public void testMultiplicationBindsTighterThanAddition() {
        BinOpNode add = assertInstanceOf(BinOpNode.class, expression("1 + 2 * 3"));
        assertEquals(BinaryOperator.ADD, add.op);
        assertInt(1, add.left);
        BinOpNode mult = assertInstanceOf(BinOpNode.class, add.right);
        assertEquals(BinaryOperator.MULT, mult.op);
        assertInt(2, mult.left);
        assertInt(3, mult.right);
    }

    @Test
    public void testPowerBindsTighterThanUnaryMinus() {
        UnaryOpNode negate = assertInstanceOf(UnaryOpNode.class, expression("-2 ** 2"));
        assertEquals(UnaryOperator.USUB, negate.op);
        BinOpNode power = assertInstanceOf(BinOpNode.class, negate.operand);
        assertEquals(BinaryOperator.POW, power.op);
        assertInt(2, power.left);
        assertInt(2, power.right);
    }

    @Test
    public void testPowerIsRightAssociative() {
        BinOpNode outer = assertInstanceOf(BinOpNode.class, expression("2 ** 3 ** 2"));
        assertInt(2, outer.left);
        BinOpNode inner = assertInstanceOf(BinOpNode.class, outer.right);
        assertInt(3, inner.left);
    }

    @Test
    public void testPowerOperandMayBeNegated() {
        BinOpNode power = assertInstanceOf(BinOpNode.class, expression("2 ** -1"));
        assertEquals(UnaryOperator.USUB, assertInstanceOf(UnaryOpNode.class, power.right).op);
    }

    @Test
    public void testSubtractionIsLeftAssociative() {
        BinOpNode outer = assertInstanceOf(BinOpNode.class, expression("a - b - c"));
        assertName("c", ExprContext.LOAD, outer.right);
        BinOpNode inner = assertInstanceOf(BinOpNode.class, outer.left);
        assertName("a", ExprContext.LOAD, inner.left);
        assertName("b", ExprContext.LOAD, inner.right);
    }

    @Test
    public void testBitwiseLadder() {
        // | < ^ < & < << < +
        BinOpNode or = assertInstanceOf(BinOpNode.class, expression("a | b ^ c & d << e + f"));
        assertEquals(BinaryOperator.BITOR, or.op);
        BinOpNode xor = assertInstanceOf(BinOpNode.class, or.right);
        assertEquals(BinaryOperator.BITXOR, xor.op);
        BinOpNode and = assertInstanceOf(BinOpNode.class, xor.right);
        assertEquals(BinaryOperator.BITAND, and.op);
        BinOpNode shift = assertInstanceOf(BinOpNode.class, and.right);
        assertEquals(BinaryOperator.LSHIFT, shift.op);
        assertEquals(BinaryOperator.ADD, assertInstanceOf(BinOpNode.class, shift.right).op);
    }

    @Test
    public void testBooleanOperators() {
        BoolOpNode or = assertInstanceOf(BoolOpNode.class, expression("a or b and not c or d"));
        assertEquals(BooleanOperator.OR, or.op);
        assertEquals(3, or.values.size());
        BoolOpNode and = assertInstanceOf(BoolOpNode.class, or.values.get(1));
        assertEquals(BooleanOperator.AND, and.op);
        UnaryOpNode not = assertInstanceOf(UnaryOpNode.class, and.values.get(1));
        assertEquals(UnaryOperator.NOT, not.op);
    }

    @Test
    public void testComparisonChain() {
        CompareNode compare = assertInstanceOf(CompareNode.class, expression("a < b <= c is not d not in e"));
        assertName("a", ExprContext.LOAD, compare.left);
        assertEquals(List.of(CompareOperator.LT, CompareOperator.LT_E, CompareOperator.IS_NOT, CompareOperator.NOT_IN),
                compare.ops);
        assertEquals(4, compare.comparators.size());
    }

    @Test
    public void testChainedAssignment() {
        AssignNode assign = assertInstanceOf(AssignNode.class, first("a = b = 1"));
        assertEquals(2, assign.targets.size());
        assertName("a", ExprContext.STORE, assign.targets.get(0));
        assertName("b", ExprContext.STORE, assign.targets.get(1));
        assertInt(1, assign.value);
    }

    @Test
    public void testTupleTargets() {
        AssignNode assign = assertInstanceOf(AssignNode.class, first("a, *b = c, d"));
        TupleNode target = assertInstanceOf(TupleNode.class, assign.targets.get(0));
        assertEquals(ExprContext.STORE, target.ctx);
        StarredNode starred = assertInstanceOf(StarredNode.class, target.elts.get(1));
        assertEquals(ExprContext.STORE, starred.ctx);
        assertName("b", ExprContext.STORE, starred.value);
        TupleNode value = assertInstanceOf(TupleNode.class, assign.value);
        assertEquals(ExprContext.LOAD, value.ctx);
    }

    @Test
    public void testAugmentedAssignment() {
        AugAssignNode assign = assertInstanceOf(AugAssignNode.class, first("x.count //= 2"));
        assertEquals(BinaryOperator.FLOORDIV, assign.op);
        AttributeNode target = assertInstanceOf(AttributeNode.class, assign.target);
        assertEquals(ExprContext.STORE, target.ctx);
    }

    @Test
    public void testAnnotatedAssignment() {
        AnnAssignNode simple = assertInstanceOf(AnnAssignNode.class, first("x: int = 5"));
        assertTrue(simple.simple);
        assertName("int", ExprContext.LOAD, simple.annotation);
        assertInt(5, simple.value);

        AnnAssignNode parenthesized = assertInstanceOf(AnnAssignNode.class, first("(x): int"));
        assertFalse(parenthesized.simple);
        assertNull(parenthesized.value);
    }

    @Test
    public void testSemicolonSeparatedStatements() {
        ModuleNode module = parse("a = 1; b = 2;\n");
        assertEquals(2, module.body.size());
    }

    @Test
    public void testCallArguments() {
        CallNode call = assertInstanceOf(CallNode.class, expression("f(a, *b, k=1, **d, flag=a == b)"));
        assertEquals(2, call.args.size());
        assertInstanceOf(StarredNode.class, call.args.get(1));
        assertEquals(3, call.keywords.size());
        assertEquals("k", call.keywords.get(0).arg);
        assertNull(call.keywords.get(1).arg);
        assertInstanceOf(CompareNode.class, call.keywords.get(2).value);
    }

    @Test
    public void testSoleGeneratorArgument() {
        CallNode call = assertInstanceOf(CallNode.class, expression("sum(x * x for x in values)"));
        assertEquals(1, call.args.size());
        GeneratorExpNode generator = assertInstanceOf(GeneratorExpNode.class, call.args.get(0));
        assertEquals(1, generator.generators.size());
        assertName("x", ExprContext.STORE, generator.generators.get(0).target);
    }

    @Test
    public void testPostfixChain() {
        CallNode call = assertInstanceOf(CallNode.class, expression("a.b[0](c)"));
        SubscriptNode subscript = assertInstanceOf(SubscriptNode.class, call.func);
        AttributeNode attribute = assertInstanceOf(AttributeNode.class, subscript.value);
        assertEquals("b", attribute.attr);
    }

    @Test
    public void testSlices() {
        SubscriptNode subscript = assertInstanceOf(SubscriptNode.class, expression("a[1:2, ::3]"));
        TupleNode tuple = assertInstanceOf(TupleNode.class, subscript.slice);
        SliceNode firstSlice = assertInstanceOf(SliceNode.class, tuple.elts.get(0));
        assertInt(1, firstSlice.lower);
        assertInt(2, firstSlice.upper);
        assertNull(firstSlice.step);
        SliceNode secondSlice = assertInstanceOf(SliceNode.class, tuple.elts.get(1));
        assertNull(secondSlice.lower);
        assertNull(secondSlice.upper);
        assertInt(3, secondSlice.step);
    }

    @Test
    public void testDictUnpacking() {
        AssignNode assign = assertInstanceOf(AssignNode.class, first("merged = {**a, **b}"));
        DictNode dict = assertInstanceOf(DictNode.class, assign.value);
        assertEquals(2, dict.keys.size());
        assertNull(dict.keys.get(0));
        assertNull(dict.keys.get(1));
        assertName("a", ExprContext.LOAD, dict.values.get(0));
        assertName("b", ExprContext.LOAD, dict.values.get(1));
    }

    @Test
    public void testCollectionDisplays() {
        assertInstanceOf(DictNode.class, expression("{}"));
        SetNode set = assertInstanceOf(SetNode.class, expression("{1, *rest}"));
        assertEquals(2, set.elts.size());
        ListNode list = assertInstanceOf(ListNode.class, expression("[1, 2,]"));
        assertEquals(2, list.elts.size());
        TupleNode empty = assertInstanceOf(TupleNode.class, expression("()"));
        assertTrue(empty.elts.isEmpty());
        TupleNode single = assertInstanceOf(TupleNode.class, expression("(1,)"));
        assertEquals(1, single.elts.size());
        assertInt(1, expression("(1)"));
    }

    @Test
    public void testComprehensions() {
        ListCompNode list = assertInstanceOf(ListCompNode.class, expression("[x for x in y if x if not x for z in x]"));
        assertEquals(2, list.generators.size());
        assertEquals(2, list.generators.get(0).ifs.size());

        DictCompNode dict = assertInstanceOf(DictCompNode.class, expression("{k: v for k, v in items}"));
        assertInstanceOf(TupleNode.class, dict.generators.get(0).target);

        SetCompNode set = assertInstanceOf(SetCompNode.class, expression("{x async for x in aiter()}"));
        assertTrue(set.generators.get(0).isAsync);

        assertInstanceOf(GeneratorExpNode.class, expression("(x for x in y)"));
    }

    @Test
    public void testLambda() {
        LambdaNode lambda = assertInstanceOf(LambdaNode.class, expression("lambda x, /, y=1, *a, z, **k: x"));
        ArgumentsNode args = lambda.args;
        assertEquals(1, args.posonlyargs.size());
        assertEquals(1, args.args.size());
        assertEquals("a", args.vararg.arg);
        assertEquals(1, args.kwonlyargs.size());
        assertEquals(1, args.kwDefaults.size());
        assertNull(args.kwDefaults.get(0));
        assertEquals("k", args.kwarg.arg);
        assertEquals(1, args.defaults.size());
    }

    @Test
    public void testConditionalExpression() {
        IfExpNode ifExp = assertInstanceOf(IfExpNode.class, expression("a if b else c if d else e"));
        assertName("b", ExprContext.LOAD, ifExp.test);
        assertInstanceOf(IfExpNode.class, ifExp.orElse);
    }

    @Test
    public void testNamedExpression() {
        IfNode ifNode = assertInstanceOf(IfNode.class, first("if (n := len(a)) > 10:\n    pass\n"));
        CompareNode compare = assertInstanceOf(CompareNode.class, ifNode.test);
        NamedExprNode named = assertInstanceOf(NamedExprNode.class, compare.left);
        assertName("n", ExprContext.STORE, named.target);
    }

    @Test
    public void testIfElifElse() {
        IfNode ifNode = assertInstanceOf(IfNode.class,
                first("if a:\n    x\nelif b:\n    y\nelse:\n    z\n"));
        assertEquals(1, ifNode.orElse.size());
        IfNode elif = assertInstanceOf(IfNode.class, ifNode.orElse.get(0));
        assertName("b", ExprContext.LOAD, elif.test);
        assertEquals(1, elif.orElse.size());
        assertInstanceOf(ExprStmtNode.class, elif.orElse.get(0));
    }

    @Test
    public void testLoops() {
        ForNode forNode = assertInstanceOf(ForNode.class,
                first("for i, j in pairs:\n    continue\nelse:\n    break\n"));
        assertInstanceOf(TupleNode.class, forNode.target);
        assertEquals(1, forNode.orElse.size());

        WhileNode whileNode = assertInstanceOf(WhileNode.class, first("while True: pass\n"));
        assertInstanceOf(PassNode.class, whileNode.body.get(0));
    }

    @Test
    public void testTry() {
        TryNode tryNode = assertInstanceOf(TryNode.class, first(String.join("\n",
                "try:",
                "    a()",
                "except (KeyError, ValueError) as e:",
                "    raise RuntimeError() from e",
                "except:",
                "    pass",
                "else:",
                "    b()",
                "finally:",
                "    c()",
                "")));
        assertFalse(tryNode.isStar);
        assertEquals(2, tryNode.handlers.size());
        assertEquals("e", tryNode.handlers.get(0).name);
        assertInstanceOf(TupleNode.class, tryNode.handlers.get(0).type);
        assertNull(tryNode.handlers.get(1).type);
        assertEquals(1, tryNode.orElse.size());
        assertEquals(1, tryNode.finalBody.size());
        RaiseNode raise = assertInstanceOf(RaiseNode.class, tryNode.handlers.get(0).body.get(0));
        assertNotNull(raise.cause);
    }

    @Test
    public void testTryStar() {
        TryNode tryNode = assertInstanceOf(TryNode.class,
                first("try:\n    a()\nexcept* ValueError:\n    pass\n"));
        assertTrue(tryNode.isStar);
    }

    @Test
    public void testWithItems() {
        WithNode with = assertInstanceOf(WithNode.class,
                first("with (open(a) as f, lock):\n    pass\n"));
        assertEquals(2, with.items.size());
        assertName("f", ExprContext.STORE, with.items.get(0).optionalVars);
        assertNull(with.items.get(1).optionalVars);

        WithNode grouped = assertInstanceOf(WithNode.class, first("with (a, b):\n    pass\n"));
        assertEquals(2, grouped.items.size());

        WithNode tuple = assertInstanceOf(WithNode.class, first("with (a, b), c:\n    pass\n"));
        assertEquals(2, tuple.items.size());
        assertInstanceOf(TupleNode.class, tuple.items.get(0).contextExpr);
    }

    @Test
    public void testImports() {
        ImportNode importNode = assertInstanceOf(ImportNode.class, first("import os.path as p, sys"));
        assertEquals("os.path", importNode.names.get(0).name);
        assertEquals("p", importNode.names.get(0).asname);

        ImportFromNode from = assertInstanceOf(ImportFromNode.class, first("from ..pkg import (a, b as c,)"));
        assertEquals(2, from.level);
        assertEquals("pkg", from.module);
        assertEquals(2, from.names.size());
        assertEquals("c", from.names.get(1).asname);

        ImportFromNode relative = assertInstanceOf(ImportFromNode.class, first("from . import x"));
        assertEquals(1, relative.level);
        assertNull(relative.module);

        ImportFromNode star = assertInstanceOf(ImportFromNode.class, first("from m import *"));
        assertEquals("*", star.names.get(0).name);
    }

    @Test
    public void testDecoratedAsyncFunction() {
        FunctionDefNode function = assertInstanceOf(FunctionDefNode.class, first(String.join("\n",
                "@cache",
                "@route('/x', methods=['GET'])",
                "async def handler(request: Request, *, timeout: float = 1.0) -> Response:",
                "    data = await request.json()",
                "    return data",
                "")));
        assertTrue(function.isAsync);
        assertEquals(2, function.decoratorList.size());
        assertEquals(1, function.args.args.size());
        assertNotNull(function.args.args.get(0).annotation);
        assertEquals("timeout", function.args.kwonlyargs.get(0).arg);
        assertNotNull(function.args.kwDefaults.get(0));
        assertName("Response", ExprContext.LOAD, function.returns);
        AssignNode assign = assertInstanceOf(AssignNode.class, function.body.get(0));
        assertInstanceOf(AwaitNode.class, assign.value);
    }

    @Test
    public void testClassDefinition() {
        ClassDefNode classDef = assertInstanceOf(ClassDefNode.class,
                first("class A(Base, metaclass=Meta):\n    x = 1\n"));
        assertEquals("A", classDef.name);
        assertEquals(1, classDef.bases.size());
        assertEquals("metaclass", classDef.keywords.get(0).arg);
    }

    @Test
    public void testTypeParameters() {
        FunctionDefNode function = assertInstanceOf(FunctionDefNode.class,
                first("def f[T: int, *Ts, **P = int](x: T) -> T:\n    return x\n"));
        assertEquals(3, function.typeParams.size());
        assertEquals(TypeParamNode.Kind.TYPE_VAR, function.typeParams.get(0).kind);
        assertNotNull(function.typeParams.get(0).bound);
        assertEquals(TypeParamNode.Kind.TYPE_VAR_TUPLE, function.typeParams.get(1).kind);
        assertEquals(TypeParamNode.Kind.PARAM_SPEC, function.typeParams.get(2).kind);
        assertNotNull(function.typeParams.get(2).defaultValue);
    }

    @Test
    public void testTypeAlias() {
        TypeAliasNode alias = assertInstanceOf(TypeAliasNode.class, first("type Pairs[T] = list[tuple[T, T]]"));
        assertEquals("Pairs", alias.name.id);
        assertEquals(1, alias.typeParams.size());
        assertInstanceOf(SubscriptNode.class, alias.value);
    }

    @Test
    public void testSoftKeywordsAsNames() {
        ModuleNode module = parse(String.join("\n",
                "match = 1",
                "type = match + 1",
                "case.x = type",
                "match(x)",
                "print(match, type=case)",
                "def f(match, case=None): return type",
                ""));
        assertEquals(6, module.body.size());
        assertName("match", ExprContext.STORE, assertInstanceOf(AssignNode.class, module.body.get(0)).targets.get(0));
        assertName("type", ExprContext.STORE, assertInstanceOf(AssignNode.class, module.body.get(1)).targets.get(0));
        assertInstanceOf(AttributeNode.class, assertInstanceOf(AssignNode.class, module.body.get(2)).targets.get(0));
        assertInstanceOf(CallNode.class, assertInstanceOf(ExprStmtNode.class, module.body.get(3)).value);
        assertInstanceOf(FunctionDefNode.class, module.body.get(5));
    }

    @Test
    public void testNameStatements() {
        ModuleNode module = parse(String.join("\n",
                "def f():",
                "    global a, b",
                "    def g():",
                "        nonlocal c",
                "    del a[0], b.x",
                "    assert a, 'message'",
                "    x = yield",
                "    y = yield from g()",
                ""));
        FunctionDefNode function = assertInstanceOf(FunctionDefNode.class, module.body.get(0));
        assertEquals(List.of("a", "b"), assertInstanceOf(GlobalNode.class, function.body.get(0)).names);
        DeleteNode delete = assertInstanceOf(DeleteNode.class, function.body.get(2));
        assertEquals(ExprContext.DEL, assertInstanceOf(SubscriptNode.class, delete.targets.get(0)).ctx);
        assertEquals(ExprContext.DEL, assertInstanceOf(AttributeNode.class, delete.targets.get(1)).ctx);
        assertNotNull(assertInstanceOf(AssertNode.class, function.body.get(3)).msg);
        YieldNode yield = assertInstanceOf(YieldNode.class, assertInstanceOf(AssignNode.class, function.body.get(4)).value);
        assertNull(yield.value);
        assertInstanceOf(YieldFromNode.class, assertInstanceOf(AssignNode.class, function.body.get(5)).value);
    }

    @Test
    public void testEmptyModule() {
        assertTrue(parse("").body.isEmpty());
        assertTrue(parse("# only a comment\n\n").body.isEmpty());
    }

    @Test
    public void testSpans() {
        ModuleNode module = parse("x = 1\nif x:\n    y = 2\n");
        IfNode ifNode = (IfNode) module.body.get(1);
        SourceSpan span = ifNode.getSpan();
        assertEquals(2, span.lineno());
        assertEquals(0, span.colOffset());
        assertEquals(3, span.endLineno());
        SourceSpan inner = ifNode.body.get(0).getSpan();
        assertEquals(3, inner.lineno());
        assertEquals(4, inner.colOffset());
        assertEquals(9, inner.endColOffset());
    }

    @Test
    public void testMissingColon() {
        ParseException e = assertThrows(ParseException.class, () -> parse("if x > 3\n    print(x)"));
        assertEquals(ParseException.Kind.EXPECTED_TOKEN, e.getKind());
        assertEquals(1, e.getLine());
        assertTrue(e.getMessage().startsWith("Expected ':' but got newline at line 1, column 9"));
        assertEquals("if x > 3", e.getSourceLine());
        assertEquals("if x > 3:", e.getSuggestion());
    }

    @Test
    public void testMissingColonAfterDef() {
        ParseException e = assertThrows(ParseException.class, () -> parse("def f(a)\n    pass\n"));
        assertEquals("def f(a):", e.getSuggestion());
    }

    @Test
    public void testInvalidAssignmentTarget() {
        ParseException e = assertThrows(ParseException.class, () -> parse("f() = 1"));
        assertEquals(ParseException.Kind.INVALID_TARGET, e.getKind());
        assertTrue(e.getMessage().startsWith("Invalid assignment target"));

        ParseException augmented = assertThrows(ParseException.class, () -> parse("a, b += 1"));
        assertEquals(ParseException.Kind.INVALID_TARGET, augmented.getKind());
    }

    @Test
    public void testUnexpectedIndent() {
        ParseException e = assertThrows(ParseException.class, () -> parse("x = 1\n    y = 2\n"));
        assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, e.getKind());
        assertTrue(e.getMessage().startsWith("Unexpected indent"));
    }

    @Test
    public void testMissingBlock() {
        ParseException e = assertThrows(ParseException.class, () -> parse("if x:\n"));
        assertTrue(e.getMessage().startsWith("Expected an indented block but got end of input"));
    }

    @Test
    public void testUnclosedBracket() {
        assertThrows(ParseException.class, () -> parse("x = (1, 2\n"));
    }

    @Test
    public void testBareWalrusIsRejected() {
        ParseException e = assertThrows(ParseException.class, () -> parse("x := 1"));
        assertTrue(e.getMessage().startsWith("Assignment expression must be parenthesized here"));
    }
}
