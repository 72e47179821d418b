package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * {@code with} or {@code async with} statement.
 */
public class WithNode extends StatementNode {
    public final List<WithItemNode> items;
    public final List<StatementNode> body;
    public final boolean isAsync;

    public WithNode(List<WithItemNode> items, List<StatementNode> body, boolean isAsync, SourceSpan span) {
        super(span);
        this.items = List.copyOf(items);
        this.body = List.copyOf(body);
        this.isAsync = isAsync;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
