package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * {@code *name} inside a sequence pattern; the name is null for {@code *_}.
 */
public class MatchStarNode extends PatternNode {
    public final String name;

    public MatchStarNode(String name, SourceSpan span) {
        super(span);
        this.name = name;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
