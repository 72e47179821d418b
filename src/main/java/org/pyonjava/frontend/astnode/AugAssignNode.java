package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * Augmented assignment such as {@code x += 1}.
 */
public class AugAssignNode extends StatementNode {
    public final ExpressionNode target;
    public final BinaryOperator op;
    public final ExpressionNode value;

    public AugAssignNode(ExpressionNode target, BinaryOperator op, ExpressionNode value, SourceSpan span) {
        super(span);
        this.target = target;
        this.op = op;
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
