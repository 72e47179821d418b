package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * Annotated assignment {@code target: annotation [= value]}.
 */
public class AnnAssignNode extends StatementNode {
    public final ExpressionNode target;
    public final ExpressionNode annotation;
    /** The assigned value, or null for a bare annotation. */
    public final ExpressionNode value;
    /** True when the target is a plain name that was not parenthesized. */
    public final boolean simple;

    public AnnAssignNode(ExpressionNode target, ExpressionNode annotation, ExpressionNode value, boolean simple, SourceSpan span) {
        super(span);
        this.target = target;
        this.annotation = annotation;
        this.value = value;
        this.simple = simple;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
