package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The MatchSequenceNode class represents {@code [p1, p2, *rest]} or {@code (p1, p2)}.
 * At most one of the patterns is a MatchStarNode.
 */
public class MatchSequenceNode extends PatternNode {
    public final List<PatternNode> patterns;

    public MatchSequenceNode(List<PatternNode> patterns, SourceSpan span) {
        super(span);
        this.patterns = List.copyOf(patterns);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
