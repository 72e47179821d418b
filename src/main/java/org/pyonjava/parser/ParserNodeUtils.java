package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.AttributeNode;
import org.pyonjava.frontend.astnode.ExprContext;
import org.pyonjava.frontend.astnode.ExpressionNode;
import org.pyonjava.frontend.astnode.ListNode;
import org.pyonjava.frontend.astnode.NameNode;
import org.pyonjava.frontend.astnode.StarredNode;
import org.pyonjava.frontend.astnode.SubscriptNode;
import org.pyonjava.frontend.astnode.TupleNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds expressions parsed in Load context as assignment or deletion targets.
 * Nodes are immutable, so a target is a copy of the expression with the new context.
 */
public class ParserNodeUtils {

    /**
     * Converts an expression to a target with the given context.
     *
     * @param parser  The parser, used for error reporting.
     * @param node    The expression that was parsed on the left of '=' (or after del, for, as).
     * @param context STORE or DEL.
     * @return The same expression with the context applied recursively.
     * @throws ParseException with kind INVALID_TARGET if the expression cannot be assigned to.
     */
    public static ExpressionNode toTarget(Parser parser, ExpressionNode node, ExprContext context) {
        if (node instanceof NameNode name) {
            return new NameNode(name.id, context, name.span);
        }
        if (node instanceof AttributeNode attribute) {
            return new AttributeNode(attribute.value, attribute.attr, context, attribute.span);
        }
        if (node instanceof SubscriptNode subscript) {
            return new SubscriptNode(subscript.value, subscript.slice, context, subscript.span);
        }
        if (node instanceof TupleNode tuple) {
            return new TupleNode(toTargets(parser, tuple.elts, context), context, tuple.span);
        }
        if (node instanceof ListNode list) {
            return new ListNode(toTargets(parser, list.elts, context), context, list.span);
        }
        if (node instanceof StarredNode starred && context == ExprContext.STORE) {
            return new StarredNode(toTarget(parser, starred.value, context), context, starred.span);
        }
        String message = context == ExprContext.DEL ? "Invalid delete target" : "Invalid assignment target";
        throw parser.error(ParseException.Kind.INVALID_TARGET, node.getSpan().lineno(), node.getSpan().colOffset(),
                message);
    }

    private static List<ExpressionNode> toTargets(Parser parser, List<ExpressionNode> elements, ExprContext context) {
        List<ExpressionNode> targets = new ArrayList<>();
        for (ExpressionNode element : elements) {
            targets.add(toTarget(parser, element, context));
        }
        return targets;
    }

    /**
     * Converts the target of an annotated or augmented assignment, which must be a
     * single name, attribute or subscript.
     */
    public static ExpressionNode toSingleTarget(Parser parser, ExpressionNode node, String message) {
        if (node instanceof NameNode || node instanceof AttributeNode || node instanceof SubscriptNode) {
            return toTarget(parser, node, ExprContext.STORE);
        }
        throw parser.error(ParseException.Kind.INVALID_TARGET, node.getSpan().lineno(), node.getSpan().colOffset(),
                message);
    }
}
