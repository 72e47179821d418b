package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * The BlankNode class is a formatting marker that is not part of the grammar.
 * It asks the generator for a number of empty lines, for example between top-level
 * definitions. The parser never produces it.
 */
public class BlankNode extends StatementNode {
    /** The number of empty lines to emit. */
    public final int count;

    public BlankNode(int count, SourceSpan span) {
        super(span);
        this.count = count;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
