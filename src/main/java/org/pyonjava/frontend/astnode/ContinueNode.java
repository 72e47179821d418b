package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class ContinueNode extends StatementNode {
    public ContinueNode(SourceSpan span) {
        super(span);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
