package org.pyonjava.codegen;

import org.pyonjava.frontend.astnode.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Writes constants and f-strings.
 *
 * <p>An f-string is written with one quote character throughout. The replacement
 * fields are rendered first, each with string literals that avoid the outer quote;
 * if a field still needs that quote (a string containing both kinds), the other
 * quote is tried for the outer one.</p>
 *
 * @see StringQuoting
 */
public class EmitLiteral {

    public static void emitConstant(EmitterVisitor emitterVisitor, ConstantNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        switch (node.kind) {
            case NONE -> ctx.append("None");
            case ELLIPSIS -> ctx.append("...");
            case BOOL -> ctx.append((Boolean) node.value ? "True" : "False");
            case INT, FLOAT, COMPLEX -> {
                boolean parens = EmitOperator.open(emitterVisitor,
                        isNegative(node) ? Precedence.FACTOR : Precedence.ATOM);
                ctx.append(formatNumber(node));
                EmitOperator.close(emitterVisitor, parens);
            }
            case STRING -> {
                String value = node.stringValue();
                char quote = StringQuoting.chooseQuote(value, ctx.preferredQuote(), ctx.forbiddenQuote);
                ctx.append(StringQuoting.quote(value, quote));
            }
            case BYTES -> {
                String value = node.stringValue();
                char quote = StringQuoting.chooseQuote(value, ctx.preferredQuote(), ctx.forbiddenQuote);
                ctx.append(StringQuoting.quoteBytes(value, quote));
            }
            default -> throw new IllegalStateException("Unexpected constant kind: " + node.kind);
        }
    }

    private static boolean isNegative(ConstantNode node) {
        if (node.value instanceof BigInteger integer) {
            return integer.signum() < 0;
        }
        if (node.value instanceof Double number) {
            // -0.0 too
            return Double.doubleToRawLongBits(number) < 0;
        }
        return false;
    }

    private static String formatNumber(ConstantNode node) {
        return switch (node.kind) {
            case INT -> node.value.toString();
            case FLOAT -> StringQuoting.formatFloat((Double) node.value);
            default -> StringQuoting.formatImaginary((Double) node.value);
        };
    }

    /**
     * A field outside an f-string is written as an f-string holding only that field.
     */
    public static void emitFormattedValue(EmitterVisitor emitterVisitor, FormattedValueNode node) {
        emitJoinedStr(emitterVisitor, new JoinedStrNode(List.of(node), node.getSpan()));
    }

    public static void emitJoinedStr(EmitterVisitor emitterVisitor, JoinedStrNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        char preferred = ctx.preferredQuote();
        String body = renderBody(emitterVisitor, node, preferred);
        char quote = preferred;
        if (body == null) {
            quote = StringQuoting.otherQuote(preferred);
            body = renderBody(emitterVisitor, node, quote);
            if (body == null) {
                // nested quotes of both kinds; the lexer accepts reused quotes in fields
                quote = preferred;
                body = renderBody(emitterVisitor, node, quote, true);
            }
        }
        ctx.append('f').append(quote).append(body).append(quote);
    }

    private static String renderBody(EmitterVisitor emitterVisitor, JoinedStrNode node, char quote) {
        return renderBody(emitterVisitor, node, quote, false);
    }

    /**
     * Renders the text between the quotes.
     *
     * @return the text, or null if a field needs the quote and {@code force} is not set
     */
    private static String renderBody(EmitterVisitor emitterVisitor, JoinedStrNode node, char quote, boolean force) {
        StringBuilder sb = new StringBuilder();
        for (ExpressionNode value : node.values) {
            if (value instanceof ConstantNode constant && constant.isString()) {
                StringQuoting.appendEscaped(sb, constant.stringValue(), quote, true);
            } else if (value instanceof FormattedValueNode field) {
                if (!appendField(emitterVisitor, sb, field, quote) && !force) {
                    return null;
                }
            } else {
                throw new IllegalStateException("Unexpected f-string part: " + value.getClass().getSimpleName());
            }
        }
        return sb.toString();
    }

    /**
     * Appends one replacement field.
     *
     * @return false if the field text or its format spec contains the quote
     */
    private static boolean appendField(EmitterVisitor emitterVisitor, StringBuilder sb, FormattedValueNode field,
                                       char quote) {
        EmitterContext fieldCtx = emitterVisitor.ctx.insideFormatField(quote);
        field.value.accept(new EmitterVisitor(fieldCtx));
        String expression = fieldCtx.output.toString();
        boolean clean = expression.indexOf(quote) < 0;

        sb.append('{');
        if (expression.startsWith("{")) {
            // {{ would be a literal brace
            sb.append(' ');
        }
        sb.append(expression);
        if (field.conversion >= 0) {
            sb.append('!').append((char) field.conversion);
        }
        if (field.formatSpec != null) {
            sb.append(':');
            for (ExpressionNode part : field.formatSpec.values) {
                if (part instanceof ConstantNode constant && constant.isString()) {
                    clean &= constant.stringValue().indexOf(quote) < 0;
                    StringQuoting.appendEscaped(sb, constant.stringValue(), quote, false);
                } else if (part instanceof FormattedValueNode nested) {
                    clean &= appendField(emitterVisitor, sb, nested, quote);
                } else {
                    throw new IllegalStateException("Unexpected format spec part: " + part.getClass().getSimpleName());
                }
            }
        }
        sb.append('}');
        return clean;
    }
}
