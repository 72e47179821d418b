package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The FunctionDefNode class represents a function definition, {@code def} or {@code async def}.
 */
public class FunctionDefNode extends StatementNode {
    public final String name;
    /** The parameter list. */
    public final ArgumentsNode args;
    public final List<StatementNode> body;
    /** Decorators, outermost first. */
    public final List<ExpressionNode> decoratorList;
    /** The return annotation, or null. */
    public final ExpressionNode returns;
    public final List<TypeParamNode> typeParams;
    /** True for {@code async def}. */
    public final boolean isAsync;

    public FunctionDefNode(String name, ArgumentsNode args, List<StatementNode> body, List<ExpressionNode> decoratorList, ExpressionNode returns, List<TypeParamNode> typeParams, boolean isAsync, SourceSpan span) {
        super(span);
        this.name = name;
        this.args = args;
        this.body = List.copyOf(body);
        this.decoratorList = List.copyOf(decoratorList);
        this.returns = returns;
        this.typeParams = List.copyOf(typeParams);
        this.isAsync = isAsync;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
