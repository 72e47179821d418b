package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class AwaitNode extends ExpressionNode {
    public final ExpressionNode value;

    public AwaitNode(ExpressionNode value, SourceSpan span) {
        super(span);
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
