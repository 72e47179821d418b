package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The BoolOpNode class represents {@code and} / {@code or}.
 * Consecutive uses of the same operator are flattened: {@code a or b or c} has three values.
 */
public class BoolOpNode extends ExpressionNode {
    public final BooleanOperator op;
    public final List<ExpressionNode> values;

    public BoolOpNode(BooleanOperator op, List<ExpressionNode> values, SourceSpan span) {
        super(span);
        this.op = op;
        this.values = List.copyOf(values);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
