package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * Matches {@code None}, {@code True} or {@code False} by identity.
 */
public class MatchSingletonNode extends PatternNode {
    public final ConstantNode value;

    public MatchSingletonNode(ConstantNode value, SourceSpan span) {
        super(span);
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
