package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class UnaryOpNode extends ExpressionNode {
    public final UnaryOperator op;
    public final ExpressionNode operand;

    public UnaryOpNode(UnaryOperator op, ExpressionNode operand, SourceSpan span) {
        super(span);
        this.op = op;
        this.operand = operand;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
