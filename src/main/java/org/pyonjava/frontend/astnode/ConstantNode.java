package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.math.BigInteger;

/**
 * The ConstantNode class represents a literal value.
 * <p>
 * The Java type of {@link #value} depends on the kind:
 * <pre>
 * NONE, ELLIPSIS  null
 * BOOL            Boolean
 * INT             BigInteger
 * FLOAT           Double
 * COMPLEX         Double, the imaginary part
 * STRING          String
 * BYTES           String, one char per byte (0 to 255)
 * </pre>
 */
public class ConstantNode extends ExpressionNode {

    public enum Kind {
        NONE, BOOL, INT, FLOAT, COMPLEX, STRING, BYTES, ELLIPSIS
    }

    public final Kind kind;
    public final Object value;

    private ConstantNode(Kind kind, Object value, SourceSpan span) {
        super(span);
        this.kind = kind;
        this.value = value;
    }

    public static ConstantNode none(SourceSpan span) {
        return new ConstantNode(Kind.NONE, null, span);
    }

    public static ConstantNode ellipsis(SourceSpan span) {
        return new ConstantNode(Kind.ELLIPSIS, null, span);
    }

    public static ConstantNode ofBoolean(boolean value, SourceSpan span) {
        return new ConstantNode(Kind.BOOL, value, span);
    }

    public static ConstantNode ofInt(BigInteger value, SourceSpan span) {
        return new ConstantNode(Kind.INT, value, span);
    }

    public static ConstantNode ofInt(long value, SourceSpan span) {
        return ofInt(BigInteger.valueOf(value), span);
    }

    public static ConstantNode ofFloat(double value, SourceSpan span) {
        return new ConstantNode(Kind.FLOAT, value, span);
    }

    public static ConstantNode ofComplex(double imaginary, SourceSpan span) {
        return new ConstantNode(Kind.COMPLEX, imaginary, span);
    }

    public static ConstantNode ofString(String value, SourceSpan span) {
        return new ConstantNode(Kind.STRING, value, span);
    }

    public static ConstantNode ofBytes(String value, SourceSpan span) {
        return new ConstantNode(Kind.BYTES, value, span);
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    /**
     * Returns the text of a STRING or BYTES constant.
     */
    public String stringValue() {
        if (kind != Kind.STRING && kind != Kind.BYTES) {
            throw new IllegalStateException("not a string constant: " + kind);
        }
        return (String) value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
