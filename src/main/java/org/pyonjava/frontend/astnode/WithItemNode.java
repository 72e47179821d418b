package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class WithItemNode extends AbstractNode {
    public final ExpressionNode contextExpr;
    /** The {@code as} target, or null. */
    public final ExpressionNode optionalVars;

    public WithItemNode(ExpressionNode contextExpr, ExpressionNode optionalVars, SourceSpan span) {
        super(span);
        this.contextExpr = contextExpr;
        this.optionalVars = optionalVars;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
