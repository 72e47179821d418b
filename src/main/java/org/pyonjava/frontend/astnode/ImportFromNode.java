package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * {@code from module import names}. The module is null for {@code from . import x}.
 */
public class ImportFromNode extends StatementNode {
    public final String module;
    public final List<AliasNode> names;
    /** Number of leading dots of a relative import. */
    public final int level;

    public ImportFromNode(String module, List<AliasNode> names, int level, SourceSpan span) {
        super(span);
        this.module = module;
        this.names = List.copyOf(names);
        this.level = level;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
