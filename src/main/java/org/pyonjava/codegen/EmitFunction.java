package org.pyonjava.codegen;

import org.pyonjava.frontend.astnode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes function and class definitions, parameter lists and type parameter lists.
 */
public class EmitFunction {

    public static boolean hasParameters(ArgumentsNode args) {
        return !args.posonlyargs.isEmpty() || !args.args.isEmpty() || args.vararg != null
                || !args.kwonlyargs.isEmpty() || args.kwarg != null;
    }

    public static void emitFunctionDef(EmitterVisitor emitterVisitor, FunctionDefNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.logDebug("emit def " + node.name);
        emitDecorators(emitterVisitor, node.decoratorList);
        ctx.startLine();
        if (node.isAsync) {
            ctx.append("async ");
        }
        ctx.append("def ").append(node.name);
        emitTypeParams(emitterVisitor, node.typeParams);
        ctx.append('(');
        node.args.accept(emitterVisitor);
        ctx.append(')');
        if (node.returns != null) {
            ctx.append(" -> ");
            node.returns.accept(emitterVisitor.with(Precedence.TEST));
        }
        ctx.append(':');
        ctx.endLine();
        EmitStatement.emitBlock(emitterVisitor, node.body);
    }

    public static void emitClassDef(EmitterVisitor emitterVisitor, ClassDefNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.logDebug("emit class " + node.name);
        emitDecorators(emitterVisitor, node.decoratorList);
        ctx.startLine();
        ctx.append("class ").append(node.name);
        emitTypeParams(emitterVisitor, node.typeParams);
        if (!node.bases.isEmpty() || !node.keywords.isEmpty()) {
            ctx.append('(');
            EmitExpression.emitArgumentList(emitterVisitor, node.bases, node.keywords);
            ctx.append(')');
        }
        ctx.append(':');
        ctx.endLine();
        EmitStatement.emitBlock(emitterVisitor, node.body);
    }

    private static void emitDecorators(EmitterVisitor emitterVisitor, List<ExpressionNode> decorators) {
        for (ExpressionNode decorator : decorators) {
            emitterVisitor.ctx.startLine();
            emitterVisitor.ctx.append('@');
            decorator.accept(emitterVisitor.with(Precedence.TEST));
            emitterVisitor.ctx.endLine();
        }
    }

    /**
     * Writes the parameters without the surrounding parentheses.
     * <p>
     * Defaults belong to the last positional parameters, so they are matched from the
     * end of the combined positional-only and positional lists.
     */
    public static void emitArguments(EmitterVisitor emitterVisitor, ArgumentsNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        List<String> parts = new ArrayList<>();
        List<ArgNode> positional = new ArrayList<>(node.posonlyargs);
        positional.addAll(node.args);
        int firstDefault = positional.size() - node.defaults.size();

        for (int i = 0; i < positional.size(); i++) {
            ExpressionNode defaultValue = i >= firstDefault ? node.defaults.get(i - firstDefault) : null;
            parts.add(render(emitterVisitor, positional.get(i), defaultValue));
            if (i == node.posonlyargs.size() - 1) {
                parts.add("/");
            }
        }

        if (node.vararg != null) {
            parts.add("*" + render(emitterVisitor, node.vararg, null));
        } else if (!node.kwonlyargs.isEmpty()) {
            parts.add("*");
        }
        for (int i = 0; i < node.kwonlyargs.size(); i++) {
            parts.add(render(emitterVisitor, node.kwonlyargs.get(i), node.kwDefaults.get(i)));
        }
        if (node.kwarg != null) {
            parts.add("**" + render(emitterVisitor, node.kwarg, null));
        }
        ctx.append(String.join(", ", parts));
    }

    private static String render(EmitterVisitor emitterVisitor, ArgNode arg, ExpressionNode defaultValue) {
        StringBuilder output = emitterVisitor.ctx.output;
        int mark = output.length();
        arg.accept(emitterVisitor);
        if (defaultValue != null) {
            output.append(arg.annotation != null ? " = " : "=");
            defaultValue.accept(emitterVisitor.with(Precedence.TEST));
        }
        String text = output.substring(mark);
        output.setLength(mark);
        return text;
    }

    public static void emitArg(EmitterVisitor emitterVisitor, ArgNode node) {
        emitterVisitor.ctx.append(node.arg);
        if (node.annotation != null) {
            emitterVisitor.ctx.append(": ");
            node.annotation.accept(emitterVisitor.with(Precedence.TEST));
        }
    }

    public static void emitTypeParams(EmitterVisitor emitterVisitor, List<TypeParamNode> typeParams) {
        if (typeParams.isEmpty()) {
            return;
        }
        emitterVisitor.ctx.append('[');
        for (int i = 0; i < typeParams.size(); i++) {
            if (i > 0) {
                emitterVisitor.ctx.append(", ");
            }
            typeParams.get(i).accept(emitterVisitor);
        }
        emitterVisitor.ctx.append(']');
    }

    public static void emitTypeParam(EmitterVisitor emitterVisitor, TypeParamNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        if (node.kind == TypeParamNode.Kind.TYPE_VAR_TUPLE) {
            ctx.append('*');
        } else if (node.kind == TypeParamNode.Kind.PARAM_SPEC) {
            ctx.append("**");
        }
        ctx.append(node.name);
        if (node.bound != null) {
            ctx.append(": ");
            node.bound.accept(emitterVisitor.with(Precedence.TEST));
        }
        if (node.defaultValue != null) {
            ctx.append(" = ");
            node.defaultValue.accept(emitterVisitor.with(Precedence.TEST));
        }
    }
}
