package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * One {@code except} clause; type and name are null for a bare {@code except:}.
 */
public class ExceptHandlerNode extends AbstractNode {
    public final ExpressionNode type;
    public final String name;
    public final List<StatementNode> body;

    public ExceptHandlerNode(ExpressionNode type, String name, List<StatementNode> body, SourceSpan span) {
        super(span);
        this.type = type;
        this.name = name;
        this.body = List.copyOf(body);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
