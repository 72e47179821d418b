package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * A keyword argument of a call or class definition.
 * The arg is null for a {@code **mapping} unpacking.
 */
public class KeywordNode extends AbstractNode {
    public final String arg;
    public final ExpressionNode value;

    public KeywordNode(String arg, ExpressionNode value, SourceSpan span) {
        super(span);
        this.arg = arg;
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
