package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * The Node interface represents a node in the abstract syntax tree (AST).
 * Each node can accept a {@link Visitor}, which is how every consumer of the tree
 * (tree printer, generator, comparator) walks it.
 */
public interface Node {
    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    void accept(Visitor visitor);

    /**
     * Returns the source span covered by this node.
     */
    SourceSpan getSpan();
}
