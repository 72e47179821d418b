package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The CompareNode class represents a comparison chain.
 * <p>
 * {@code a < b <= c} is stored as left {@code a}, operators {@code [<, <=]} and
 * comparators {@code [b, c]}: there is always one comparator per operator.
 */
public class CompareNode extends ExpressionNode {
    public final ExpressionNode left;
    public final List<CompareOperator> ops;
    public final List<ExpressionNode> comparators;

    public CompareNode(ExpressionNode left, List<CompareOperator> ops, List<ExpressionNode> comparators, SourceSpan span) {
        super(span);
        this.left = left;
        this.ops = List.copyOf(ops);
        this.comparators = List.copyOf(comparators);
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
