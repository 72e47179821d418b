package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * Alternatives {@code p1 | p2 | p3}.
 */
public class MatchOrNode extends PatternNode {
    public final List<PatternNode> patterns;

    public MatchOrNode(List<PatternNode> patterns, SourceSpan span) {
        super(span);
        this.patterns = List.copyOf(patterns);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
