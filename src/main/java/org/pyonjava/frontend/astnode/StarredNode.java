package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class StarredNode extends ExpressionNode {
    public final ExpressionNode value;
    public final ExprContext ctx;

    public StarredNode(ExpressionNode value, ExprContext ctx, SourceSpan span) {
        super(span);
        this.value = value;
        this.ctx = ctx;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
