package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The ComprehensionNode class represents one {@code for ... in ... if ...} clause
 * of a comprehension or generator expression.
 */
public class ComprehensionNode extends AbstractNode {
    public final ExpressionNode target;
    public final ExpressionNode iter;
    public final List<ExpressionNode> ifs;
    public final boolean isAsync;

    public ComprehensionNode(ExpressionNode target, ExpressionNode iter, List<ExpressionNode> ifs, boolean isAsync, SourceSpan span) {
        super(span);
        this.target = target;
        this.iter = iter;
        this.ifs = List.copyOf(ifs);
        this.isAsync = isAsync;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
