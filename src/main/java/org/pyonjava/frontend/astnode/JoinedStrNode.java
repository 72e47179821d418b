package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The JoinedStrNode class represents an f-string.
 * Its values are string constants and FormattedValueNode replacement fields, in order.
 */
public class JoinedStrNode extends ExpressionNode {
    public final List<ExpressionNode> values;

    public JoinedStrNode(List<ExpressionNode> values, SourceSpan span) {
        super(span);
        this.values = List.copyOf(values);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
