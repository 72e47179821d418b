package org.pyonjava.frontend.astnode;

/**
 * Base class of the patterns used by {@code case} clauses of a match statement.
 * The set of patterns is closed: subclasses can only be declared in this package.
 */
public abstract class PatternNode extends AbstractNode {
    PatternNode(SourceSpan span) {
        super(span);
    }
}
