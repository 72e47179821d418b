package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

/**
 * A type parameter of a generic function, class or type alias:
 * {@code T}, {@code T: bound}, {@code *Ts} or {@code **P}, each with an optional default.
 */
public class TypeParamNode extends AbstractNode {

    public enum Kind {
        TYPE_VAR("TypeVar"),
        PARAM_SPEC("ParamSpec"),
        TYPE_VAR_TUPLE("TypeVarTuple");

        public final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }
    }

    public final Kind kind;
    public final String name;
    /** Upper bound or constraints; only for TYPE_VAR, otherwise null. */
    public final ExpressionNode bound;
    public final ExpressionNode defaultValue;

    public TypeParamNode(Kind kind, String name, ExpressionNode bound, ExpressionNode defaultValue, SourceSpan span) {
        super(span);
        this.kind = kind;
        this.name = name;
        this.bound = bound;
        this.defaultValue = defaultValue;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
