package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

public class NonlocalNode extends StatementNode {
    public final List<String> names;

    public NonlocalNode(List<String> names, SourceSpan span) {
        super(span);
        this.names = List.copyOf(names);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
