package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * The NameNode class represents an identifier used as a variable.
 */
public class NameNode extends ExpressionNode {
    public final String id;
    public final ExprContext ctx;

    public NameNode(String id, ExprContext ctx, SourceSpan span) {
        super(span);
        this.id = id;
        this.ctx = ctx;
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
