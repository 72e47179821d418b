package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class PassNode extends StatementNode {
    public PassNode(SourceSpan span) {
        super(span);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
