package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

public class DictCompNode extends ExpressionNode {
    public final ExpressionNode key;
    public final ExpressionNode value;
    public final List<ComprehensionNode> generators;

    public DictCompNode(ExpressionNode key, ExpressionNode value, List<ComprehensionNode> generators, SourceSpan span) {
        super(span);
        this.key = key;
        this.value = value;
        this.generators = List.copyOf(generators);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
