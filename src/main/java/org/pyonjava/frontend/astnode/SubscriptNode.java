package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * {@code value[slice]}. A multi-dimensional subscript has a TupleNode slice.
 */
public class SubscriptNode extends ExpressionNode {
    public final ExpressionNode value;
    public final ExpressionNode slice;
    public final ExprContext ctx;

    public SubscriptNode(ExpressionNode value, ExpressionNode slice, ExprContext ctx, SourceSpan span) {
        super(span);
        this.value = value;
        this.slice = slice;
        this.ctx = ctx;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
