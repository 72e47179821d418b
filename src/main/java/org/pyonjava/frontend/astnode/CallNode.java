package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The CallNode class represents a call with positional arguments
 * (which may be starred) and keyword arguments (which may be {@code **} unpackings).
 */
public class CallNode extends ExpressionNode {
    public final ExpressionNode func;
    public final List<ExpressionNode> args;
    public final List<KeywordNode> keywords;

    public CallNode(ExpressionNode func, List<ExpressionNode> args, List<KeywordNode> keywords, SourceSpan span) {
        super(span);
        this.func = func;
        this.args = List.copyOf(args);
        this.keywords = List.copyOf(keywords);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
