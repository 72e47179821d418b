package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * Structural pattern matching: a subject and its ordered case clauses.
 */
public class MatchNode extends StatementNode {
    public final ExpressionNode subject;
    public final List<MatchCaseNode> cases;

    public MatchNode(ExpressionNode subject, List<MatchCaseNode> cases, SourceSpan span) {
        super(span);
        this.subject = subject;
        this.cases = List.copyOf(cases);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
