package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

public class LambdaNode extends ExpressionNode {
    public final ArgumentsNode args;
    public final ExpressionNode body;

    public LambdaNode(ArgumentsNode args, ExpressionNode body, SourceSpan span) {
        super(span);
        this.args = args;
        this.body = body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
