package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * {@code lower:upper:step}; every part may be null.
 */
public class SliceNode extends ExpressionNode {
    public final ExpressionNode lower;
    public final ExpressionNode upper;
    public final ExpressionNode step;

    public SliceNode(ExpressionNode lower, ExpressionNode upper, ExpressionNode step, SourceSpan span) {
        super(span);
        this.lower = lower;
        this.upper = upper;
        this.step = step;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
