package org.pyonjava.codegen;

import org.pyonjava.frontend.astnode.*;

/**
 * Writes operator expressions with the fewest parentheses that keep their structure.
 *
 * <p>Each method compares the binding strength of its node with the precedence the
 * position demands ({@link EmitterContext#precedence}) and wraps the node in
 * parentheses when it binds too loosely. Operands are then written with the
 * precedence their side of the operator demands:</p>
 * <pre>
 *   a - (b - c)      right operand of a left-associative operator: one level higher
 *   a ** b ** c      right operand of '**': any unary or power expression
 *   (-a) ** b        left operand of '**': only await and atoms
 *   a &lt; (b &lt; c)      a comparison is never a bare operand of another
 * </pre>
 */
public class EmitOperator {

    /**
     * Opens a parenthesis when a node of the given precedence cannot appear bare.
     *
     * @return whether a parenthesis was opened
     */
    static boolean open(EmitterVisitor emitterVisitor, int nodePrecedence) {
        if (nodePrecedence < emitterVisitor.ctx.precedence) {
            emitterVisitor.ctx.append('(');
            return true;
        }
        return false;
    }

    static void close(EmitterVisitor emitterVisitor, boolean opened) {
        if (opened) {
            emitterVisitor.ctx.append(')');
        }
    }

    public static void emitBoolOp(EmitterVisitor emitterVisitor, BoolOpNode node) {
        boolean parens = open(emitterVisitor, node.op.precedence);
        // nested operations of the same kind stay nested
        EmitterVisitor operand = emitterVisitor.with(node.op.precedence + 1);
        for (int i = 0; i < node.values.size(); i++) {
            if (i > 0) {
                emitterVisitor.ctx.append(' ').append(node.op.symbol).append(' ');
            }
            node.values.get(i).accept(operand);
        }
        close(emitterVisitor, parens);
    }

    public static void emitNamedExpr(EmitterVisitor emitterVisitor, NamedExprNode node) {
        emitterVisitor.ctx.append('(');
        node.target.accept(emitterVisitor.with(Precedence.ATOM));
        emitterVisitor.ctx.append(" := ");
        node.value.accept(emitterVisitor.with(Precedence.TEST));
        emitterVisitor.ctx.append(')');
    }

    public static void emitBinOp(EmitterVisitor emitterVisitor, BinOpNode node) {
        int precedence = node.op.precedence;
        boolean parens = open(emitterVisitor, precedence);
        if (node.op.isRightAssociative()) {
            node.left.accept(emitterVisitor.with(Precedence.AWAIT));
            emitterVisitor.ctx.append(' ').append(node.op.symbol).append(' ');
            node.right.accept(emitterVisitor.with(Precedence.FACTOR));
        } else {
            node.left.accept(emitterVisitor.with(precedence));
            emitterVisitor.ctx.append(' ').append(node.op.symbol).append(' ');
            node.right.accept(emitterVisitor.with(precedence + 1));
        }
        close(emitterVisitor, parens);
    }

    public static void emitUnaryOp(EmitterVisitor emitterVisitor, UnaryOpNode node) {
        boolean parens = open(emitterVisitor, node.op.precedence);
        emitterVisitor.ctx.append(node.op.symbol);
        if (node.op == UnaryOperator.NOT) {
            emitterVisitor.ctx.append(' ');
        }
        node.operand.accept(emitterVisitor.with(node.op.precedence));
        close(emitterVisitor, parens);
    }

    public static void emitCompare(EmitterVisitor emitterVisitor, CompareNode node) {
        boolean parens = open(emitterVisitor, Precedence.COMPARISON);
        EmitterVisitor operand = emitterVisitor.with(Precedence.COMPARISON + 1);
        node.left.accept(operand);
        for (int i = 0; i < node.ops.size(); i++) {
            emitterVisitor.ctx.append(' ').append(node.ops.get(i).symbol).append(' ');
            node.comparators.get(i).accept(operand);
        }
        close(emitterVisitor, parens);
    }

    public static void emitIfExp(EmitterVisitor emitterVisitor, IfExpNode node) {
        boolean parens = open(emitterVisitor, Precedence.TEST);
        node.body.accept(emitterVisitor.with(Precedence.OR));
        emitterVisitor.ctx.append(" if ");
        node.test.accept(emitterVisitor.with(Precedence.OR));
        emitterVisitor.ctx.append(" else ");
        node.orElse.accept(emitterVisitor.with(Precedence.TEST));
        close(emitterVisitor, parens);
    }

    public static void emitLambda(EmitterVisitor emitterVisitor, LambdaNode node) {
        boolean parens = open(emitterVisitor, Precedence.TEST);
        emitterVisitor.ctx.append("lambda");
        if (EmitFunction.hasParameters(node.args)) {
            emitterVisitor.ctx.append(' ');
            node.args.accept(emitterVisitor);
        }
        emitterVisitor.ctx.append(": ");
        node.body.accept(emitterVisitor.with(Precedence.TEST));
        close(emitterVisitor, parens);
    }

    public static void emitAwait(EmitterVisitor emitterVisitor, AwaitNode node) {
        boolean parens = open(emitterVisitor, Precedence.AWAIT);
        emitterVisitor.ctx.append("await ");
        node.value.accept(emitterVisitor.with(Precedence.ATOM));
        close(emitterVisitor, parens);
    }

    /**
     * A yield is written bare only where a statement allows it, such as {@code x = yield};
     * {@code return (yield)} and {@code yield (yield)} keep their parentheses.
     */
    public static void emitYield(EmitterVisitor emitterVisitor, YieldNode node) {
        boolean parens = open(emitterVisitor, Precedence.YIELD);
        emitterVisitor.ctx.append("yield");
        if (node.value != null) {
            emitterVisitor.ctx.append(' ');
            node.value.accept(emitterVisitor.with(Precedence.TUPLE));
        }
        close(emitterVisitor, parens);
    }

    public static void emitYieldFrom(EmitterVisitor emitterVisitor, YieldFromNode node) {
        boolean parens = open(emitterVisitor, Precedence.YIELD);
        emitterVisitor.ctx.append("yield from ");
        node.value.accept(emitterVisitor.with(Precedence.TEST));
        close(emitterVisitor, parens);
    }

    public static void emitStarred(EmitterVisitor emitterVisitor, StarredNode node) {
        emitterVisitor.ctx.append('*');
        node.value.accept(emitterVisitor.with(Precedence.BIT_OR));
    }
}
