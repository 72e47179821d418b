package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

public class WhileNode extends StatementNode {
    public final ExpressionNode test;
    public final List<StatementNode> body;
    public final List<StatementNode> orElse;

    public WhileNode(ExpressionNode test, List<StatementNode> body, List<StatementNode> orElse, SourceSpan span) {
        super(span);
        this.test = test;
        this.body = List.copyOf(body);
        this.orElse = List.copyOf(orElse);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
