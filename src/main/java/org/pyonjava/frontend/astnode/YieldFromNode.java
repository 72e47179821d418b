package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class YieldFromNode extends ExpressionNode {
    public final ExpressionNode value;

    public YieldFromNode(ExpressionNode value, SourceSpan span) {
        super(span);
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
