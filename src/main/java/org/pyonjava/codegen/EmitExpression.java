package org.pyonjava.codegen;

import org.pyonjava.frontend.astnode.*;

import java.util.List;

/**
 * Writes displays, comprehensions, calls, attribute access and subscripts.
 */
public class EmitExpression {

    public static void emitList(EmitterVisitor emitterVisitor, ListNode node) {
        emitterVisitor.ctx.append('[');
        emitElements(emitterVisitor, node.elts);
        emitterVisitor.ctx.append(']');
    }

    /**
     * Writes a tuple. The parentheses are left out where a bare tuple is allowed;
     * a one-element tuple keeps its trailing comma.
     */
    public static void emitTuple(EmitterVisitor emitterVisitor, TupleNode node) {
        if (node.elts.isEmpty()) {
            emitterVisitor.ctx.append("()");
            return;
        }
        boolean parens = EmitOperator.open(emitterVisitor, Precedence.TUPLE);
        emitBareTuple(emitterVisitor, node);
        EmitOperator.close(emitterVisitor, parens);
    }

    private static void emitBareTuple(EmitterVisitor emitterVisitor, TupleNode node) {
        emitElements(emitterVisitor, node.elts);
        if (node.elts.size() == 1) {
            emitterVisitor.ctx.append(',');
        }
    }

    public static void emitSet(EmitterVisitor emitterVisitor, SetNode node) {
        if (node.elts.isEmpty()) {
            // there is no empty set display
            emitterVisitor.ctx.append("{*()}");
            return;
        }
        emitterVisitor.ctx.append('{');
        emitElements(emitterVisitor, node.elts);
        emitterVisitor.ctx.append('}');
    }

    /**
     * Writes a dict display; a null key stands for a {@code **mapping} entry.
     */
    public static void emitDict(EmitterVisitor emitterVisitor, DictNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.append('{');
        for (int i = 0; i < node.keys.size(); i++) {
            if (i > 0) {
                ctx.append(", ");
            }
            ExpressionNode key = node.keys.get(i);
            if (key == null) {
                ctx.append("**");
                node.values.get(i).accept(emitterVisitor.with(Precedence.BIT_OR));
            } else {
                key.accept(emitterVisitor.with(Precedence.TEST));
                ctx.append(": ");
                node.values.get(i).accept(emitterVisitor.with(Precedence.TEST));
            }
        }
        ctx.append('}');
    }

    private static void emitElements(EmitterVisitor emitterVisitor, List<ExpressionNode> elements) {
        EmitterVisitor element = emitterVisitor.with(Precedence.TEST);
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                emitterVisitor.ctx.append(", ");
            }
            elements.get(i).accept(element);
        }
    }

    /**
     * Writes a list, set, dict or generator comprehension.
     *
     * @param value the value of a dict comprehension, null for the other kinds
     */
    public static void emitComprehensionDisplay(EmitterVisitor emitterVisitor, String open, ExpressionNode elt,
                                                ExpressionNode value, List<ComprehensionNode> generators,
                                                String close) {
        emitterVisitor.ctx.append(open);
        emitComprehensionBody(emitterVisitor, elt, value, generators);
        emitterVisitor.ctx.append(close);
    }

    private static void emitComprehensionBody(EmitterVisitor emitterVisitor, ExpressionNode elt,
                                              ExpressionNode value, List<ComprehensionNode> generators) {
        elt.accept(emitterVisitor.with(Precedence.TEST));
        if (value != null) {
            emitterVisitor.ctx.append(": ");
            value.accept(emitterVisitor.with(Precedence.TEST));
        }
        for (ComprehensionNode generator : generators) {
            generator.accept(emitterVisitor);
        }
    }

    public static void emitComprehension(EmitterVisitor emitterVisitor, ComprehensionNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.append(node.isAsync ? " async for " : " for ");
        node.target.accept(emitterVisitor.with(Precedence.TUPLE));
        ctx.append(" in ");
        node.iter.accept(emitterVisitor.with(Precedence.OR));
        for (ExpressionNode condition : node.ifs) {
            ctx.append(" if ");
            condition.accept(emitterVisitor.with(Precedence.OR));
        }
    }

    /**
     * Writes a call. A generator expression that is the only argument is written
     * without its own parentheses: {@code f(x for x in y)}.
     */
    public static void emitCall(EmitterVisitor emitterVisitor, CallNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        node.func.accept(emitterVisitor.with(Precedence.ATOM));
        ctx.append('(');
        if (node.args.size() == 1 && node.keywords.isEmpty()
                && node.args.get(0) instanceof GeneratorExpNode generator) {
            emitComprehensionBody(emitterVisitor, generator.elt, null, generator.generators);
        } else {
            emitArgumentList(emitterVisitor, node.args, node.keywords);
        }
        ctx.append(')');
    }

    /**
     * Writes positional arguments followed by keyword arguments, comma separated.
     */
    public static void emitArgumentList(EmitterVisitor emitterVisitor, List<ExpressionNode> args,
                                        List<KeywordNode> keywords) {
        emitElements(emitterVisitor, args);
        for (int i = 0; i < keywords.size(); i++) {
            if (i > 0 || !args.isEmpty()) {
                emitterVisitor.ctx.append(", ");
            }
            keywords.get(i).accept(emitterVisitor);
        }
    }

    public static void emitKeyword(EmitterVisitor emitterVisitor, KeywordNode node) {
        if (node.arg == null) {
            emitterVisitor.ctx.append("**");
        } else {
            emitterVisitor.ctx.append(node.arg).append('=');
        }
        node.value.accept(emitterVisitor.with(Precedence.TEST));
    }

    public static void emitAttribute(EmitterVisitor emitterVisitor, AttributeNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        // 1.real would lex as a float
        if (node.value instanceof ConstantNode constant && constant.kind == ConstantNode.Kind.INT) {
            ctx.append('(');
            constant.accept(emitterVisitor.with(Precedence.TUPLE));
            ctx.append(')');
        } else {
            node.value.accept(emitterVisitor.with(Precedence.ATOM));
        }
        ctx.append('.').append(node.attr);
    }

    /**
     * Writes a subscript. A tuple index is written bare: {@code dict[str, int]}.
     */
    public static void emitSubscript(EmitterVisitor emitterVisitor, SubscriptNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        node.value.accept(emitterVisitor.with(Precedence.ATOM));
        ctx.append('[');
        if (node.slice instanceof TupleNode tuple && !tuple.elts.isEmpty()) {
            emitBareTuple(emitterVisitor, tuple);
        } else {
            node.slice.accept(emitterVisitor.with(Precedence.TEST));
        }
        ctx.append(']');
    }

    public static void emitSlice(EmitterVisitor emitterVisitor, SliceNode node) {
        EmitterVisitor part = emitterVisitor.with(Precedence.TEST);
        if (node.lower != null) {
            node.lower.accept(part);
        }
        emitterVisitor.ctx.append(':');
        if (node.upper != null) {
            node.upper.accept(part);
        }
        if (node.step != null) {
            emitterVisitor.ctx.append(':');
            node.step.accept(part);
        }
    }
}
