package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class AssertNode extends StatementNode {
    public final ExpressionNode test;
    /** The message, or null. */
    public final ExpressionNode msg;

    public AssertNode(ExpressionNode test, ExpressionNode msg, SourceSpan span) {
        super(span);
        this.test = test;
        this.msg = msg;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
