package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The ForNode class represents a {@code for} or {@code async for} loop,
 * including the optional {@code else} clause that runs when the loop is not broken.
 */
public class ForNode extends StatementNode {
    public final ExpressionNode target;
    public final ExpressionNode iter;
    public final List<StatementNode> body;
    public final List<StatementNode> orElse;
    public final boolean isAsync;

    public ForNode(ExpressionNode target, ExpressionNode iter, List<StatementNode> body, List<StatementNode> orElse, boolean isAsync, SourceSpan span) {
        super(span);
        this.target = target;
        this.iter = iter;
        this.body = List.copyOf(body);
        this.orElse = List.copyOf(orElse);
        this.isAsync = isAsync;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
