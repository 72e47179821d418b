package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The TryNode class represents a {@code try} statement.
 * <p>
 * When isStar is set the handlers were written as {@code except*} and match
 * exception groups.
 */
public class TryNode extends StatementNode {
    public final List<StatementNode> body;
    public final List<ExceptHandlerNode> handlers;
    public final List<StatementNode> orElse;
    public final List<StatementNode> finalBody;
    public final boolean isStar;

    public TryNode(List<StatementNode> body, List<ExceptHandlerNode> handlers, List<StatementNode> orElse, List<StatementNode> finalBody, boolean isStar, SourceSpan span) {
        super(span);
        this.body = List.copyOf(body);
        this.handlers = List.copyOf(handlers);
        this.orElse = List.copyOf(orElse);
        this.finalBody = List.copyOf(finalBody);
        this.isStar = isStar;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
