package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * A value pattern: a literal or a dotted name compared with {@code ==}.
 */
public class MatchValueNode extends PatternNode {
    public final ExpressionNode value;

    public MatchValueNode(ExpressionNode value, SourceSpan span) {
        super(span);
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
