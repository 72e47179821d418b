package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class AliasNode extends AbstractNode {
    public final String name;
    public final String asname;

    public AliasNode(String name, String asname, SourceSpan span) {
        super(span);
        this.name = name;
        this.asname = asname;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
