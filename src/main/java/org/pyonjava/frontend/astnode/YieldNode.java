package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class YieldNode extends ExpressionNode {
    /** The yielded value, or null. */
    public final ExpressionNode value;

    public YieldNode(ExpressionNode value, SourceSpan span) {
        super(span);
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
