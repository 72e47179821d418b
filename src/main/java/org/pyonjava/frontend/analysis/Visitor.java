package org.pyonjava.frontend.analysis;

import org.pyonjava.frontend.astnode.*;

/**
 * Visitor over the closed set of AST node classes.
 * <p>
 * There is one method per concrete node class, so adding a node kind breaks every
 * visitor until it handles the new kind.
 */
public interface Visitor {

    // Module and helpers
    void visit(ModuleNode node);
    void visit(ArgumentsNode node);
    void visit(ArgNode node);
    void visit(KeywordNode node);
    void visit(AliasNode node);
    void visit(WithItemNode node);
    void visit(ExceptHandlerNode node);
    void visit(ComprehensionNode node);
    void visit(MatchCaseNode node);
    void visit(TypeParamNode node);

    // Statements
    void visit(FunctionDefNode node);
    void visit(ClassDefNode node);
    void visit(ReturnNode node);
    void visit(DeleteNode node);
    void visit(AssignNode node);
    void visit(AugAssignNode node);
    void visit(AnnAssignNode node);
    void visit(ForNode node);
    void visit(WhileNode node);
    void visit(IfNode node);
    void visit(WithNode node);
    void visit(MatchNode node);
    void visit(RaiseNode node);
    void visit(TryNode node);
    void visit(AssertNode node);
    void visit(ImportNode node);
    void visit(ImportFromNode node);
    void visit(GlobalNode node);
    void visit(NonlocalNode node);
    void visit(ExprStmtNode node);
    void visit(PassNode node);
    void visit(BreakNode node);
    void visit(ContinueNode node);
    void visit(BlankNode node);
    void visit(TypeAliasNode node);

    // Expressions
    void visit(BoolOpNode node);
    void visit(NamedExprNode node);
    void visit(BinOpNode node);
    void visit(UnaryOpNode node);
    void visit(LambdaNode node);
    void visit(IfExpNode node);
    void visit(DictNode node);
    void visit(SetNode node);
    void visit(ListCompNode node);
    void visit(SetCompNode node);
    void visit(DictCompNode node);
    void visit(GeneratorExpNode node);
    void visit(AwaitNode node);
    void visit(YieldNode node);
    void visit(YieldFromNode node);
    void visit(CompareNode node);
    void visit(CallNode node);
    void visit(FormattedValueNode node);
    void visit(JoinedStrNode node);
    void visit(ConstantNode node);
    void visit(AttributeNode node);
    void visit(SubscriptNode node);
    void visit(StarredNode node);
    void visit(NameNode node);
    void visit(ListNode node);
    void visit(TupleNode node);
    void visit(SliceNode node);

    // Patterns
    void visit(MatchValueNode node);
    void visit(MatchSingletonNode node);
    void visit(MatchSequenceNode node);
    void visit(MatchMappingNode node);
    void visit(MatchClassNode node);
    void visit(MatchStarNode node);
    void visit(MatchAsNode node);
    void visit(MatchOrNode node);
}
