package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class RaiseNode extends StatementNode {
    /** The raised exception, or null for a bare re-raise. */
    public final ExpressionNode exc;
    /** The {@code from} clause, or null. */
    public final ExpressionNode cause;

    public RaiseNode(ExpressionNode exc, ExpressionNode cause, SourceSpan span) {
        super(span);
        this.exc = exc;
        this.cause = cause;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
