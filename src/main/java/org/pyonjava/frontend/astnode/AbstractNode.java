package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.PrintVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Abstract base class for AST nodes that includes the source span the node was
 * parsed from. The span is used for error messages and by editor integrations,
 * and it is ignored by structural comparison.
 * <p>
 * Nodes are immutable: all fields are final and child lists are unmodifiable copies.
 * <p>
 * It also provides deep toString() formatting using PrintVisitor
 */
public abstract class AbstractNode implements Node {
    public final SourceSpan span;

    AbstractNode(SourceSpan span) {
        this.span = span == null ? SourceSpan.NONE : span;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    /**
     * Copies a child list that may contain null entries, such as dictionary keys
     * for {@code **} unpacking.
     */
    static <T> List<T> copyOfNullable(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    /**
     * Returns a string representation of the syntax tree.
     *
     * @return a string representation of the syntax tree
     */
    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }
}
