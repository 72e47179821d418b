package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The ModuleNode class is the root of the abstract syntax tree.
 * It owns the ordered list of top-level statements of one source text.
 */
public class ModuleNode extends AbstractNode {
    public final List<StatementNode> body;

    public ModuleNode(List<StatementNode> body, SourceSpan span) {
        super(span);
        this.body = List.copyOf(body);
    }

    /**
     * Accepts a visitor that performs some operation on this node.
     * This method is part of the Visitor design pattern, which allows
     * for defining new operations on the AST nodes without changing
     * the node classes.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
