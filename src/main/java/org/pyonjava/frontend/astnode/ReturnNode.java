package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class ReturnNode extends StatementNode {
    /** The returned value, or null for a bare {@code return}. */
    public final ExpressionNode value;

    public ReturnNode(ExpressionNode value, SourceSpan span) {
        super(span);
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
