package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The IfNode class represents an {@code if} statement.
 * An {@code elif} chain is stored as a nested IfNode that is the only statement of orElse.
 */
public class IfNode extends StatementNode {
    /**
     * The condition of the if statement.
     */
    public final ExpressionNode test;
    /**
     * The statements run when the condition is true.
     */
    public final List<StatementNode> body;
    /**
     * The else branch, empty when absent.
     */
    public final List<StatementNode> orElse;

    public IfNode(ExpressionNode test, List<StatementNode> body, List<StatementNode> orElse, SourceSpan span) {
        super(span);
        this.test = test;
        this.body = List.copyOf(body);
        this.orElse = List.copyOf(orElse);
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
