package org.pyonjava.frontend.astnode;

/**
 * Base class of the expression nodes.
 * The set of expressions is closed: subclasses can only be declared in this package.
 */
public abstract class ExpressionNode extends AbstractNode {
    ExpressionNode(SourceSpan span) {
        super(span);
    }
}
