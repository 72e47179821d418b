package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * Conditional expression {@code body if test else orElse}.
 */
public class IfExpNode extends ExpressionNode {
    public final ExpressionNode test;
    public final ExpressionNode body;
    public final ExpressionNode orElse;

    public IfExpNode(ExpressionNode test, ExpressionNode body, ExpressionNode orElse, SourceSpan span) {
        super(span);
        this.test = test;
        this.body = body;
        this.orElse = orElse;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
