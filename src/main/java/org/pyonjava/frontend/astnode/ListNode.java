package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

public class ListNode extends ExpressionNode {
    public final List<ExpressionNode> elts;
    public final ExprContext ctx;

    public ListNode(List<ExpressionNode> elts, ExprContext ctx, SourceSpan span) {
        super(span);
        this.elts = List.copyOf(elts);
        this.ctx = ctx;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
