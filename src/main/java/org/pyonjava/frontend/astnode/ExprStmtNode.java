package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * An expression evaluated for its side effects, such as a call.
 */
public class ExprStmtNode extends StatementNode {
    public final ExpressionNode value;

    public ExprStmtNode(ExpressionNode value, SourceSpan span) {
        super(span);
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
