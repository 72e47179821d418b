package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * The MatchAsNode class represents a capture pattern.
 * <p>
 * With a pattern and a name it is {@code pattern as name}; with only a name it is a bare
 * capture; with neither it is the wildcard {@code _}.
 */
public class MatchAsNode extends PatternNode {
    public final PatternNode pattern;
    public final String name;

    public MatchAsNode(PatternNode pattern, String name, SourceSpan span) {
        super(span);
        this.pattern = pattern;
        this.name = name;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
