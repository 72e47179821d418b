package org.pyonjava.codegen;

import org.pyonjava.frontend.analysis.Visitor;
import org.pyonjava.frontend.astnode.*;

import java.util.HashMap;
import java.util.Map;

/**
 * EmitterVisitor implements the Visitor pattern to traverse the AST and write source
 * text. It works in conjunction with EmitterContext, which carries the precedence
 * demanded at the current position.
 */
public class EmitterVisitor implements Visitor {
    /**
     * The emission context containing the current state and configuration
     */
    public final EmitterContext ctx;

    /**
     * Cache for EmitterVisitor instances with different precedences.
     */
    private final Map<Integer, EmitterVisitor> visitorCache = new HashMap<>();

    public EmitterVisitor(EmitterContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Returns an EmitterVisitor for a position that demands the given precedence.
     *
     * <p>Example usage:
     *
     * <pre>
     *   // the right operand of '-' must bind tighter than '-'
     *   node.right.accept(this.with(Precedence.ARITH + 1));
     * </pre>
     *
     * @param precedence The lowest precedence allowed without parentheses.
     * @return An EmitterVisitor writing to the same output.
     */
    public EmitterVisitor with(int precedence) {
        if (precedence == ctx.precedence) {
            return this;
        }
        return visitorCache.computeIfAbsent(precedence, p -> new EmitterVisitor(ctx.with(p)));
    }

    /**
     * Returns the generated text.
     */
    public String getResult() {
        return ctx.output.toString();
    }

    // Module and helpers

    @Override
    public void visit(ModuleNode node) {
        EmitStatement.emitModule(this, node);
    }

    @Override
    public void visit(ArgumentsNode node) {
        EmitFunction.emitArguments(this, node);
    }

    @Override
    public void visit(ArgNode node) {
        EmitFunction.emitArg(this, node);
    }

    @Override
    public void visit(KeywordNode node) {
        EmitExpression.emitKeyword(this, node);
    }

    @Override
    public void visit(AliasNode node) {
        EmitStatement.emitAlias(this, node);
    }

    @Override
    public void visit(WithItemNode node) {
        EmitStatement.emitWithItem(this, node);
    }

    @Override
    public void visit(ExceptHandlerNode node) {
        EmitStatement.emitExceptHandler(this, node, false);
    }

    @Override
    public void visit(ComprehensionNode node) {
        EmitExpression.emitComprehension(this, node);
    }

    @Override
    public void visit(MatchCaseNode node) {
        EmitStatement.emitMatchCase(this, node);
    }

    @Override
    public void visit(TypeParamNode node) {
        EmitFunction.emitTypeParam(this, node);
    }

    // Statements

    @Override
    public void visit(FunctionDefNode node) {
        EmitFunction.emitFunctionDef(this, node);
    }

    @Override
    public void visit(ClassDefNode node) {
        EmitFunction.emitClassDef(this, node);
    }

    @Override
    public void visit(ReturnNode node) {
        EmitStatement.emitReturn(this, node);
    }

    @Override
    public void visit(DeleteNode node) {
        EmitStatement.emitDelete(this, node);
    }

    @Override
    public void visit(AssignNode node) {
        EmitStatement.emitAssign(this, node);
    }

    @Override
    public void visit(AugAssignNode node) {
        EmitStatement.emitAugAssign(this, node);
    }

    @Override
    public void visit(AnnAssignNode node) {
        EmitStatement.emitAnnAssign(this, node);
    }

    @Override
    public void visit(ForNode node) {
        EmitStatement.emitFor(this, node);
    }

    @Override
    public void visit(WhileNode node) {
        EmitStatement.emitWhile(this, node);
    }

    @Override
    public void visit(IfNode node) {
        EmitStatement.emitIf(this, node, "if");
    }

    @Override
    public void visit(WithNode node) {
        EmitStatement.emitWith(this, node);
    }

    @Override
    public void visit(MatchNode node) {
        EmitStatement.emitMatch(this, node);
    }

    @Override
    public void visit(RaiseNode node) {
        EmitStatement.emitRaise(this, node);
    }

    @Override
    public void visit(TryNode node) {
        EmitStatement.emitTry(this, node);
    }

    @Override
    public void visit(AssertNode node) {
        EmitStatement.emitAssert(this, node);
    }

    @Override
    public void visit(ImportNode node) {
        EmitStatement.emitImport(this, node);
    }

    @Override
    public void visit(ImportFromNode node) {
        EmitStatement.emitImportFrom(this, node);
    }

    @Override
    public void visit(GlobalNode node) {
        EmitStatement.emitNameList(this, "global", node.names);
    }

    @Override
    public void visit(NonlocalNode node) {
        EmitStatement.emitNameList(this, "nonlocal", node.names);
    }

    @Override
    public void visit(ExprStmtNode node) {
        EmitStatement.emitExprStmt(this, node);
    }

    @Override
    public void visit(PassNode node) {
        EmitStatement.emitKeywordStatement(this, "pass");
    }

    @Override
    public void visit(BreakNode node) {
        EmitStatement.emitKeywordStatement(this, "break");
    }

    @Override
    public void visit(ContinueNode node) {
        EmitStatement.emitKeywordStatement(this, "continue");
    }

    @Override
    public void visit(BlankNode node) {
        EmitStatement.emitBlank(this, node);
    }

    @Override
    public void visit(TypeAliasNode node) {
        EmitStatement.emitTypeAlias(this, node);
    }

    // Expressions

    @Override
    public void visit(BoolOpNode node) {
        EmitOperator.emitBoolOp(this, node);
    }

    @Override
    public void visit(NamedExprNode node) {
        EmitOperator.emitNamedExpr(this, node);
    }

    @Override
    public void visit(BinOpNode node) {
        EmitOperator.emitBinOp(this, node);
    }

    @Override
    public void visit(UnaryOpNode node) {
        EmitOperator.emitUnaryOp(this, node);
    }

    @Override
    public void visit(LambdaNode node) {
        EmitOperator.emitLambda(this, node);
    }

    @Override
    public void visit(IfExpNode node) {
        EmitOperator.emitIfExp(this, node);
    }

    @Override
    public void visit(DictNode node) {
        EmitExpression.emitDict(this, node);
    }

    @Override
    public void visit(SetNode node) {
        EmitExpression.emitSet(this, node);
    }

    @Override
    public void visit(ListCompNode node) {
        EmitExpression.emitComprehensionDisplay(this, "[", node.elt, null, node.generators, "]");
    }

    @Override
    public void visit(SetCompNode node) {
        EmitExpression.emitComprehensionDisplay(this, "{", node.elt, null, node.generators, "}");
    }

    @Override
    public void visit(DictCompNode node) {
        EmitExpression.emitComprehensionDisplay(this, "{", node.key, node.value, node.generators, "}");
    }

    @Override
    public void visit(GeneratorExpNode node) {
        EmitExpression.emitComprehensionDisplay(this, "(", node.elt, null, node.generators, ")");
    }

    @Override
    public void visit(AwaitNode node) {
        EmitOperator.emitAwait(this, node);
    }

    @Override
    public void visit(YieldNode node) {
        EmitOperator.emitYield(this, node);
    }

    @Override
    public void visit(YieldFromNode node) {
        EmitOperator.emitYieldFrom(this, node);
    }

    @Override
    public void visit(CompareNode node) {
        EmitOperator.emitCompare(this, node);
    }

    @Override
    public void visit(CallNode node) {
        EmitExpression.emitCall(this, node);
    }

    @Override
    public void visit(FormattedValueNode node) {
        EmitLiteral.emitFormattedValue(this, node);
    }

    @Override
    public void visit(JoinedStrNode node) {
        EmitLiteral.emitJoinedStr(this, node);
    }

    @Override
    public void visit(ConstantNode node) {
        EmitLiteral.emitConstant(this, node);
    }

    @Override
    public void visit(AttributeNode node) {
        EmitExpression.emitAttribute(this, node);
    }

    @Override
    public void visit(SubscriptNode node) {
        EmitExpression.emitSubscript(this, node);
    }

    @Override
    public void visit(StarredNode node) {
        EmitOperator.emitStarred(this, node);
    }

    @Override
    public void visit(NameNode node) {
        ctx.append(node.id);
    }

    @Override
    public void visit(ListNode node) {
        EmitExpression.emitList(this, node);
    }

    @Override
    public void visit(TupleNode node) {
        EmitExpression.emitTuple(this, node);
    }

    @Override
    public void visit(SliceNode node) {
        EmitExpression.emitSlice(this, node);
    }

    // Patterns

    @Override
    public void visit(MatchValueNode node) {
        EmitPattern.emitMatchValue(this, node);
    }

    @Override
    public void visit(MatchSingletonNode node) {
        EmitPattern.emitMatchSingleton(this, node);
    }

    @Override
    public void visit(MatchSequenceNode node) {
        EmitPattern.emitMatchSequence(this, node);
    }

    @Override
    public void visit(MatchMappingNode node) {
        EmitPattern.emitMatchMapping(this, node);
    }

    @Override
    public void visit(MatchClassNode node) {
        EmitPattern.emitMatchClass(this, node);
    }

    @Override
    public void visit(MatchStarNode node) {
        EmitPattern.emitMatchStar(this, node);
    }

    @Override
    public void visit(MatchAsNode node) {
        EmitPattern.emitMatchAs(this, node);
    }

    @Override
    public void visit(MatchOrNode node) {
        EmitPattern.emitMatchOr(this, node);
    }
}
