package org.pyonjava.codegen;

import org.pyonjava.frontend.astnode.*;

import java.util.List;

/**
 * Writes statements, one logical line each, at the current indentation.
 *
 * <p>Compound statements write their header line and then their suites through
 * {@link #emitBlock}, which raises the indentation by one level. An empty suite,
 * possible only in a tree built by hand, is written as {@code pass}.</p>
 */
public class EmitStatement {

    public static void emitModule(EmitterVisitor emitterVisitor, ModuleNode node) {
        for (StatementNode statement : node.body) {
            statement.accept(emitterVisitor);
        }
        emitterVisitor.ctx.logDebug("emitted module: " + node.body.size() + " statements, "
                + emitterVisitor.ctx.output.length() + " chars");
    }

    public static void emitBlock(EmitterVisitor emitterVisitor, List<StatementNode> body) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.indent();
        if (body.isEmpty()) {
            emitKeywordStatement(emitterVisitor, "pass");
        }
        for (StatementNode statement : body) {
            statement.accept(emitterVisitor);
        }
        ctx.dedent();
    }

    private static void emitClause(EmitterVisitor emitterVisitor, String header, List<StatementNode> body) {
        emitterVisitor.ctx.startLine();
        emitterVisitor.ctx.append(header).append(':');
        emitterVisitor.ctx.endLine();
        emitBlock(emitterVisitor, body);
    }

    private static void emitElse(EmitterVisitor emitterVisitor, List<StatementNode> orElse) {
        if (!orElse.isEmpty()) {
            emitClause(emitterVisitor, "else", orElse);
        }
    }

    private static void endHeader(EmitterVisitor emitterVisitor, List<StatementNode> body) {
        emitterVisitor.ctx.append(':');
        emitterVisitor.ctx.endLine();
        emitBlock(emitterVisitor, body);
    }

    public static void emitKeywordStatement(EmitterVisitor emitterVisitor, String keyword) {
        emitterVisitor.ctx.startLine();
        emitterVisitor.ctx.append(keyword);
        emitterVisitor.ctx.endLine();
    }

    public static void emitBlank(EmitterVisitor emitterVisitor, BlankNode node) {
        for (int i = 0; i < node.count; i++) {
            emitterVisitor.ctx.endLine();
        }
    }

    public static void emitExprStmt(EmitterVisitor emitterVisitor, ExprStmtNode node) {
        emitterVisitor.ctx.startLine();
        node.value.accept(emitterVisitor.with(Precedence.YIELD));
        emitterVisitor.ctx.endLine();
    }

    public static void emitReturn(EmitterVisitor emitterVisitor, ReturnNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append("return");
        if (node.value != null) {
            ctx.append(' ');
            node.value.accept(emitterVisitor.with(Precedence.TUPLE));
        }
        ctx.endLine();
    }

    public static void emitDelete(EmitterVisitor emitterVisitor, DeleteNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append("del ");
        emitExpressionList(emitterVisitor, node.targets);
        ctx.endLine();
    }

    public static void emitAssign(EmitterVisitor emitterVisitor, AssignNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        EmitterVisitor targetVisitor = emitterVisitor.with(Precedence.TUPLE);
        ctx.startLine();
        for (ExpressionNode target : node.targets) {
            target.accept(targetVisitor);
            ctx.append(" = ");
        }
        node.value.accept(emitterVisitor.with(Precedence.YIELD));
        ctx.endLine();
    }

    public static void emitAugAssign(EmitterVisitor emitterVisitor, AugAssignNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        node.target.accept(emitterVisitor.with(Precedence.TUPLE));
        ctx.append(' ').append(node.op.symbol).append("= ");
        node.value.accept(emitterVisitor.with(Precedence.YIELD));
        ctx.endLine();
    }

    /**
     * A name target that was parenthesized in the source, {@code (x): int}, is not
     * simple and keeps its parentheses.
     */
    public static void emitAnnAssign(EmitterVisitor emitterVisitor, AnnAssignNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        if (!node.simple && node.target instanceof NameNode) {
            ctx.append('(');
            node.target.accept(emitterVisitor);
            ctx.append(')');
        } else {
            node.target.accept(emitterVisitor.with(Precedence.TEST));
        }
        ctx.append(": ");
        node.annotation.accept(emitterVisitor.with(Precedence.TEST));
        if (node.value != null) {
            ctx.append(" = ");
            node.value.accept(emitterVisitor.with(Precedence.YIELD));
        }
        ctx.endLine();
    }

    public static void emitFor(EmitterVisitor emitterVisitor, ForNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append(node.isAsync ? "async for " : "for ");
        node.target.accept(emitterVisitor.with(Precedence.TUPLE));
        ctx.append(" in ");
        node.iter.accept(emitterVisitor.with(Precedence.TUPLE));
        endHeader(emitterVisitor, node.body);
        emitElse(emitterVisitor, node.orElse);
    }

    public static void emitWhile(EmitterVisitor emitterVisitor, WhileNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append("while ");
        node.test.accept(emitterVisitor.with(Precedence.TEST));
        endHeader(emitterVisitor, node.body);
        emitElse(emitterVisitor, node.orElse);
    }

    /**
     * Writes an if statement; an else suite holding only another if statement is
     * written as an elif clause.
     */
    public static void emitIf(EmitterVisitor emitterVisitor, IfNode node, String keyword) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append(keyword).append(' ');
        node.test.accept(emitterVisitor.with(Precedence.TEST));
        endHeader(emitterVisitor, node.body);
        if (node.orElse.size() == 1 && node.orElse.get(0) instanceof IfNode elif) {
            emitIf(emitterVisitor, elif, "elif");
        } else {
            emitElse(emitterVisitor, node.orElse);
        }
    }

    public static void emitWith(EmitterVisitor emitterVisitor, WithNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append(node.isAsync ? "async with " : "with ");
        boolean wrap = node.items.size() == 1 && needsOuterParentheses(node.items.get(0));
        if (wrap) {
            ctx.append('(');
        }
        for (int i = 0; i < node.items.size(); i++) {
            if (i > 0) {
                ctx.append(", ");
            }
            node.items.get(i).accept(emitterVisitor);
        }
        if (wrap) {
            ctx.append(')');
        }
        endHeader(emitterVisitor, node.body);
    }

    // "with (a, b):" reads as two items, so a single parenthesized item gets a second pair
    private static boolean needsOuterParentheses(WithItemNode item) {
        if (item.optionalVars != null) {
            return false;
        }
        ExpressionNode expr = item.contextExpr;
        return expr instanceof TupleNode
                || expr instanceof GeneratorExpNode
                || expr instanceof NamedExprNode
                || expr instanceof YieldNode
                || expr instanceof YieldFromNode;
    }

    public static void emitWithItem(EmitterVisitor emitterVisitor, WithItemNode node) {
        node.contextExpr.accept(emitterVisitor.with(Precedence.TEST));
        if (node.optionalVars != null) {
            emitterVisitor.ctx.append(" as ");
            node.optionalVars.accept(emitterVisitor.with(Precedence.TEST));
        }
    }

    public static void emitMatch(EmitterVisitor emitterVisitor, MatchNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append("match ");
        node.subject.accept(emitterVisitor.with(Precedence.TUPLE));
        ctx.append(':');
        ctx.endLine();
        ctx.indent();
        for (MatchCaseNode matchCase : node.cases) {
            matchCase.accept(emitterVisitor);
        }
        ctx.dedent();
    }

    public static void emitMatchCase(EmitterVisitor emitterVisitor, MatchCaseNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append("case ");
        node.pattern.accept(emitterVisitor);
        if (node.guard != null) {
            ctx.append(" if ");
            node.guard.accept(emitterVisitor.with(Precedence.TEST));
        }
        endHeader(emitterVisitor, node.body);
    }

    public static void emitRaise(EmitterVisitor emitterVisitor, RaiseNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append("raise");
        if (node.exc != null) {
            ctx.append(' ');
            node.exc.accept(emitterVisitor.with(Precedence.TEST));
        }
        if (node.cause != null) {
            ctx.append(" from ");
            node.cause.accept(emitterVisitor.with(Precedence.TEST));
        }
        ctx.endLine();
    }

    public static void emitTry(EmitterVisitor emitterVisitor, TryNode node) {
        emitClause(emitterVisitor, "try", node.body);
        for (ExceptHandlerNode handler : node.handlers) {
            emitExceptHandler(emitterVisitor, handler, node.isStar);
        }
        emitElse(emitterVisitor, node.orElse);
        if (!node.finalBody.isEmpty()) {
            emitClause(emitterVisitor, "finally", node.finalBody);
        }
    }

    public static void emitExceptHandler(EmitterVisitor emitterVisitor, ExceptHandlerNode node, boolean isStar) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append(isStar ? "except*" : "except");
        if (node.type != null) {
            ctx.append(' ');
            node.type.accept(emitterVisitor.with(Precedence.TEST));
            if (node.name != null) {
                ctx.append(" as ").append(node.name);
            }
        }
        endHeader(emitterVisitor, node.body);
    }

    public static void emitAssert(EmitterVisitor emitterVisitor, AssertNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append("assert ");
        node.test.accept(emitterVisitor.with(Precedence.TEST));
        if (node.msg != null) {
            ctx.append(", ");
            node.msg.accept(emitterVisitor.with(Precedence.TEST));
        }
        ctx.endLine();
    }

    public static void emitImport(EmitterVisitor emitterVisitor, ImportNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append("import ");
        emitAliases(emitterVisitor, node.names);
        ctx.endLine();
    }

    public static void emitImportFrom(EmitterVisitor emitterVisitor, ImportFromNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append("from ").append(".".repeat(node.level));
        if (node.module != null) {
            ctx.append(node.module);
        }
        ctx.append(" import ");
        emitAliases(emitterVisitor, node.names);
        ctx.endLine();
    }

    private static void emitAliases(EmitterVisitor emitterVisitor, List<AliasNode> names) {
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                emitterVisitor.ctx.append(", ");
            }
            names.get(i).accept(emitterVisitor);
        }
    }

    public static void emitAlias(EmitterVisitor emitterVisitor, AliasNode node) {
        emitterVisitor.ctx.append(node.name);
        if (node.asname != null) {
            emitterVisitor.ctx.append(" as ").append(node.asname);
        }
    }

    public static void emitNameList(EmitterVisitor emitterVisitor, String keyword, List<String> names) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append(keyword).append(' ').append(String.join(", ", names));
        ctx.endLine();
    }

    public static void emitTypeAlias(EmitterVisitor emitterVisitor, TypeAliasNode node) {
        EmitterContext ctx = emitterVisitor.ctx;
        ctx.startLine();
        ctx.append("type ").append(node.name.id);
        EmitFunction.emitTypeParams(emitterVisitor, node.typeParams);
        ctx.append(" = ");
        node.value.accept(emitterVisitor.with(Precedence.TEST));
        ctx.endLine();
    }

    private static void emitExpressionList(EmitterVisitor emitterVisitor, List<ExpressionNode> expressions) {
        EmitterVisitor element = emitterVisitor.with(Precedence.TEST);
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) {
                emitterVisitor.ctx.append(", ");
            }
            expressions.get(i).accept(element);
        }
    }
}
