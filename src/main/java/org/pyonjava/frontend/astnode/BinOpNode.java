package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * The BinOpNode class represents a binary arithmetic or bitwise operation.
 */
public class BinOpNode extends ExpressionNode {
    public final ExpressionNode left;
    public final BinaryOperator op;
    public final ExpressionNode right;

    public BinOpNode(ExpressionNode left, BinaryOperator op, ExpressionNode right, SourceSpan span) {
        super(span);
        this.left = left;
        this.op = op;
        this.right = right;
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
