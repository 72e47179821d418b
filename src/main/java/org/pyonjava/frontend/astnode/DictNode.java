package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The DictNode class represents a dictionary display.
 * <p>
 * keys and values are parallel lists. A null key marks a {@code **mapping} unpacking
 * entry whose mapping is the corresponding value.
 */
public class DictNode extends ExpressionNode {
    public final List<ExpressionNode> keys;
    public final List<ExpressionNode> values;

    public DictNode(List<ExpressionNode> keys, List<ExpressionNode> values, SourceSpan span) {
        super(span);
        this.keys = copyOfNullable(keys);
        this.values = List.copyOf(values);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
