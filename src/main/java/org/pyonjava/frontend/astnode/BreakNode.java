package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class BreakNode extends StatementNode {
    public BreakNode(SourceSpan span) {
        super(span);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
