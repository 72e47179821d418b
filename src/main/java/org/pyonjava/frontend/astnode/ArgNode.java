package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * A single parameter with its optional annotation.
 */
public class ArgNode extends AbstractNode {
    public final String arg;
    public final ExpressionNode annotation;

    public ArgNode(String arg, ExpressionNode annotation, SourceSpan span) {
        super(span);
        this.arg = arg;
        this.annotation = annotation;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
