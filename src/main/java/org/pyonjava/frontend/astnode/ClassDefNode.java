package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The ClassDefNode class represents a class definition with its bases and class keywords
 * (such as {@code metaclass=...}).
 */
public class ClassDefNode extends StatementNode {
    public final String name;
    public final List<ExpressionNode> bases;
    public final List<KeywordNode> keywords;
    public final List<StatementNode> body;
    public final List<ExpressionNode> decoratorList;
    public final List<TypeParamNode> typeParams;

    public ClassDefNode(String name, List<ExpressionNode> bases, List<KeywordNode> keywords, List<StatementNode> body, List<ExpressionNode> decoratorList, List<TypeParamNode> typeParams, SourceSpan span) {
        super(span);
        this.name = name;
        this.bases = List.copyOf(bases);
        this.keywords = List.copyOf(keywords);
        this.body = List.copyOf(body);
        this.decoratorList = List.copyOf(decoratorList);
        this.typeParams = List.copyOf(typeParams);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
