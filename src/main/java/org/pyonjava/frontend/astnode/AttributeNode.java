package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class AttributeNode extends ExpressionNode {
    public final ExpressionNode value;
    public final String attr;
    public final ExprContext ctx;

    public AttributeNode(ExpressionNode value, String attr, ExprContext ctx, SourceSpan span) {
        super(span);
        this.value = value;
        this.attr = attr;
        this.ctx = ctx;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
