package org.pyonjava.codegen;

import org.pyonjava.frontend.astnode.*;

import java.util.List;

/**
 * Writes the patterns of {@code case} clauses.
 * <p>
 * Or-patterns and capture patterns with an {@code as} are the only patterns that
 * need parentheses, and only as an alternative of an or-pattern or as the subject
 * of another {@code as}.
 */
public class EmitPattern {

    public static void emitMatchValue(EmitterVisitor emitterVisitor, MatchValueNode node) {
        node.value.accept(emitterVisitor.with(Precedence.TEST));
    }

    public static void emitMatchSingleton(EmitterVisitor emitterVisitor, MatchSingletonNode node) {
        node.value.accept(emitterVisitor);
    }

    /**
     * Sequence patterns are always written with brackets, {@code case a, b:} included.
     */
    public static void emitMatchSequence(EmitterVisitor emitterVisitor, MatchSequenceNode node) {
        emitterVisitor.ctx.append('[');
        emitPatterns(emitterVisitor, node.patterns);
        emitterVisitor.ctx.append(']');
    }

    public static void emitMatchMapping(EmitterVisitor emitterVisitor, MatchMappingNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.append('{');
        for (int i = 0; i < node.keys.size(); i++) {
            if (i > 0) {
                ctx.append(", ");
            }
            node.keys.get(i).accept(emitterVisitor.with(Precedence.TEST));
            ctx.append(": ");
            node.patterns.get(i).accept(emitterVisitor);
        }
        if (node.rest != null) {
            if (!node.keys.isEmpty()) {
                ctx.append(", ");
            }
            ctx.append("**").append(node.rest);
        }
        ctx.append('}');
    }

    public static void emitMatchClass(EmitterVisitor emitterVisitor, MatchClassNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        node.cls.accept(emitterVisitor.with(Precedence.ATOM));
        ctx.append('(');
        emitPatterns(emitterVisitor, node.patterns);
        for (int i = 0; i < node.kwdAttrs.size(); i++) {
            if (i > 0 || !node.patterns.isEmpty()) {
                ctx.append(", ");
            }
            ctx.append(node.kwdAttrs.get(i)).append('=');
            node.kwdPatterns.get(i).accept(emitterVisitor);
        }
        ctx.append(')');
    }

    public static void emitMatchStar(EmitterVisitor emitterVisitor, MatchStarNode node) {
        emitterVisitor.ctx.append('*').append(node.name == null ? "_" : node.name);
    }

    public static void emitMatchAs(EmitterVisitor emitterVisitor, MatchAsNode node) {
        if (node.pattern == null) {
            emitterVisitor.ctx.append(node.name == null ? "_" : node.name);
            return;
        }
        emitClosed(emitterVisitor, node.pattern, node.pattern instanceof MatchAsNode);
        emitterVisitor.ctx.append(" as ").append(node.name);
    }

    public static void emitMatchOr(EmitterVisitor emitterVisitor, MatchOrNode node) {
        for (int i = 0; i < node.patterns.size(); i++) {
            if (i > 0) {
                emitterVisitor.ctx.append(" | ");
            }
            emitClosed(emitterVisitor, node.patterns.get(i), true);
        }
    }

    private static void emitPatterns(EmitterVisitor emitterVisitor, List<PatternNode> patterns) {
        for (int i = 0; i < patterns.size(); i++) {
            if (i > 0) {
                emitterVisitor.ctx.append(", ");
            }
            patterns.get(i).accept(emitterVisitor);
        }
    }

    private static void emitClosed(EmitterVisitor emitterVisitor, PatternNode pattern, boolean closeAs) {
        boolean parens = closeAs && (pattern instanceof MatchOrNode
                || pattern instanceof MatchAsNode capture && capture.pattern != null);
        if (parens) {
            emitterVisitor.ctx.append('(');
        }
        pattern.accept(emitterVisitor);
        if (parens) {
            emitterVisitor.ctx.append(')');
        }
    }
}
