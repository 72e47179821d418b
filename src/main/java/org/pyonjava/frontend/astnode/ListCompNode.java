package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

public class ListCompNode extends ExpressionNode {
    public final ExpressionNode elt;
    public final List<ComprehensionNode> generators;

    public ListCompNode(ExpressionNode elt, List<ComprehensionNode> generators, SourceSpan span) {
        super(span);
        this.elt = elt;
        this.generators = List.copyOf(generators);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
