package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The AssignNode class represents an assignment statement.
 * <p>
 * A chained assignment {@code a = b = 1} is one node with several targets,
 * all of which receive the same value.
 */
public class AssignNode extends StatementNode {
    public final List<ExpressionNode> targets;
    public final ExpressionNode value;

    public AssignNode(List<ExpressionNode> targets, ExpressionNode value, SourceSpan span) {
        super(span);
        this.targets = List.copyOf(targets);
        this.value = value;
    }

    /**
     * Accepts a visitor that performs some operation on this node.
     * This method is part of the Visitor design pattern, which allows
     * for defining new operations on the AST nodes without changing
     * the node classes.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
