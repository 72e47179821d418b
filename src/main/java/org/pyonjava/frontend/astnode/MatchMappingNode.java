package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The MatchMappingNode class represents {@code {key: pattern, **rest}}.
 */
public class MatchMappingNode extends PatternNode {
    public final List<ExpressionNode> keys;
    public final List<PatternNode> patterns;
    /** The name bound to the remaining items, or null. */
    public final String rest;

    public MatchMappingNode(List<ExpressionNode> keys, List<PatternNode> patterns, String rest, SourceSpan span) {
        super(span);
        this.keys = List.copyOf(keys);
        this.patterns = List.copyOf(patterns);
        this.rest = rest;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
