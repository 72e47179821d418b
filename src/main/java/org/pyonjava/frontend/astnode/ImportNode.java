package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * {@code import a.b as c, d}
 */
public class ImportNode extends StatementNode {
    public final List<AliasNode> names;

    public ImportNode(List<AliasNode> names, SourceSpan span) {
        super(span);
        this.names = List.copyOf(names);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
