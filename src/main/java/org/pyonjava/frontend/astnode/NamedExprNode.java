package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * Assignment expression {@code target := value}.
 */
public class NamedExprNode extends ExpressionNode {
    public final ExpressionNode target;
    public final ExpressionNode value;

    public NamedExprNode(ExpressionNode target, ExpressionNode value, SourceSpan span) {
        super(span);
        this.target = target;
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
