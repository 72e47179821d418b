package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * The FormattedValueNode class represents one replacement field of an f-string.
 */
public class FormattedValueNode extends ExpressionNode {
    public final ExpressionNode value;
    /** The conversion character ({@code 'r'}, {@code 's'} or {@code 'a'}), or -1 for none. */
    public final int conversion;
    /** The format specification, or null. */
    public final JoinedStrNode formatSpec;

    public FormattedValueNode(ExpressionNode value, int conversion, JoinedStrNode formatSpec, SourceSpan span) {
        super(span);
        this.value = value;
        this.conversion = conversion;
        this.formatSpec = formatSpec;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
