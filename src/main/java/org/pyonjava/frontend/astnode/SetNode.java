package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

public class SetNode extends ExpressionNode {
    public final List<ExpressionNode> elts;

    public SetNode(List<ExpressionNode> elts, SourceSpan span) {
        super(span);
        this.elts = List.copyOf(elts);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
