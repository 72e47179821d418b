package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * {@code del} statement. Targets are in the {@code Del} context.
 */
public class DeleteNode extends StatementNode {
    public final List<ExpressionNode> targets;

    public DeleteNode(List<ExpressionNode> targets, SourceSpan span) {
        super(span);
        this.targets = List.copyOf(targets);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
