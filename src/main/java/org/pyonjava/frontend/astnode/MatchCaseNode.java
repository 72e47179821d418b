package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

public class MatchCaseNode extends AbstractNode {
    public final PatternNode pattern;
    /** The {@code if} guard, or null. */
    public final ExpressionNode guard;
    public final List<StatementNode> body;

    public MatchCaseNode(PatternNode pattern, ExpressionNode guard, List<StatementNode> body, SourceSpan span) {
        super(span);
        this.pattern = pattern;
        this.guard = guard;
        this.body = List.copyOf(body);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
