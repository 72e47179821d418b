package org.pyonjava.frontend.astnode;

/**
 * Base class of the statement nodes.
 * The set of statements is closed: subclasses can only be declared in this package.
 */
public abstract class StatementNode extends AbstractNode {
    StatementNode(SourceSpan span) {
        super(span);
    }
}
