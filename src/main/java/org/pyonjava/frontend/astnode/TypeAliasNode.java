package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * {@code type Name[T] = value}
 */
public class TypeAliasNode extends StatementNode {
    public final NameNode name;
    public final List<TypeParamNode> typeParams;
    public final ExpressionNode value;

    public TypeAliasNode(NameNode name, List<TypeParamNode> typeParams, ExpressionNode value, SourceSpan span) {
        super(span);
        this.name = name;
        this.typeParams = List.copyOf(typeParams);
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
