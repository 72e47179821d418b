package org.pyonjava.frontend.analysis;

import org.pyonjava.frontend.astnode.*;

import java.util.List;

/*
 * Renders a syntax tree as indented text, one node per line.
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 *
 * Every field of every node is printed, so two trees with the same rendering are
 * structurally equal. Source spans are only printed when requested.
 */
public class PrintVisitor implements Visitor {

    private final StringBuilder sb = new StringBuilder();
    private final boolean showSpans;
    private int indentLevel = 0;

    public PrintVisitor() {
        this(false);
    }

    public PrintVisitor(boolean showSpans) {
        this.showSpans = showSpans;
    }

    /**
     * Quotes a string, escaping backslashes, quotes and control characters.
     */
    public static String printable(String value) {
        StringBuilder escaped = new StringBuilder("'");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> escaped.append("\\\\");
                case '\'' -> escaped.append("\\'");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        escaped.append(String.format("\\x%02x", (int) c));
                    } else {
                        escaped.append(c);
                    }
                }
            }
        }
        return escaped.append('\'').toString();
    }

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    private void header(String text, Node node) {
        appendIndent();
        sb.append(text);
        if (showSpans) {
            sb.append("  pos:").append(node.getSpan());
        }
        sb.append("\n");
    }

    private void line(String text) {
        appendIndent();
        sb.append(text).append("\n");
    }

    private void field(String label, Node child) {
        if (child == null) {
            line(label + ": null");
            return;
        }
        line(label + ":");
        indentLevel++;
        child.accept(this);
        indentLevel--;
    }

    private void list(String label, List<? extends Node> children) {
        if (children.isEmpty()) {
            line(label + ": []");
            return;
        }
        line(label + ":");
        indentLevel++;
        for (Node child : children) {
            if (child == null) {
                line("null");
            } else {
                child.accept(this);
            }
        }
        indentLevel--;
    }

    private static String nameOrNull(String name) {
        return name == null ? "null" : name;
    }

    @Override
    public void visit(ModuleNode node) {
        header("Module", node);
        indentLevel++;
        for (StatementNode statement : node.body) {
            statement.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(ArgumentsNode node) {
        header("Arguments", node);
        indentLevel++;
        list("posonlyargs", node.posonlyargs);
        list("args", node.args);
        field("vararg", node.vararg);
        list("kwonlyargs", node.kwonlyargs);
        list("kw_defaults", node.kwDefaults);
        field("kwarg", node.kwarg);
        list("defaults", node.defaults);
        indentLevel--;
    }

    @Override
    public void visit(ArgNode node) {
        header("Arg: " + node.arg, node);
        if (node.annotation != null) {
            indentLevel++;
            field("annotation", node.annotation);
            indentLevel--;
        }
    }

    @Override
    public void visit(KeywordNode node) {
        header("Keyword: " + (node.arg == null ? "**" : node.arg), node);
        indentLevel++;
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(AliasNode node) {
        header("Alias: " + node.name + (node.asname == null ? "" : " as " + node.asname), node);
    }

    @Override
    public void visit(WithItemNode node) {
        header("WithItem", node);
        indentLevel++;
        field("context_expr", node.contextExpr);
        field("optional_vars", node.optionalVars);
        indentLevel--;
    }

    @Override
    public void visit(ExceptHandlerNode node) {
        header("ExceptHandler: " + nameOrNull(node.name), node);
        indentLevel++;
        field("type", node.type);
        list("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(ComprehensionNode node) {
        header(node.isAsync ? "Comprehension: async" : "Comprehension", node);
        indentLevel++;
        field("target", node.target);
        field("iter", node.iter);
        list("ifs", node.ifs);
        indentLevel--;
    }

    @Override
    public void visit(MatchCaseNode node) {
        header("MatchCase", node);
        indentLevel++;
        field("pattern", node.pattern);
        field("guard", node.guard);
        list("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(TypeParamNode node) {
        header(node.kind.displayName + ": " + node.name, node);
        indentLevel++;
        if (node.bound != null) {
            field("bound", node.bound);
        }
        if (node.defaultValue != null) {
            field("default", node.defaultValue);
        }
        indentLevel--;
    }

    @Override
    public void visit(FunctionDefNode node) {
        header((node.isAsync ? "AsyncFunctionDef: " : "FunctionDef: ") + node.name, node);
        indentLevel++;
        list("type_params", node.typeParams);
        field("args", node.args);
        list("body", node.body);
        list("decorator_list", node.decoratorList);
        field("returns", node.returns);
        indentLevel--;
    }

    @Override
    public void visit(ClassDefNode node) {
        header("ClassDef: " + node.name, node);
        indentLevel++;
        list("type_params", node.typeParams);
        list("bases", node.bases);
        list("keywords", node.keywords);
        list("body", node.body);
        list("decorator_list", node.decoratorList);
        indentLevel--;
    }

    @Override
    public void visit(ReturnNode node) {
        header("Return", node);
        if (node.value != null) {
            indentLevel++;
            node.value.accept(this);
            indentLevel--;
        }
    }

    @Override
    public void visit(DeleteNode node) {
        header("Delete", node);
        indentLevel++;
        list("targets", node.targets);
        indentLevel--;
    }

    @Override
    public void visit(AssignNode node) {
        header("Assign", node);
        indentLevel++;
        list("targets", node.targets);
        field("value", node.value);
        indentLevel--;
    }

    @Override
    public void visit(AugAssignNode node) {
        header("AugAssign: " + node.op.displayName, node);
        indentLevel++;
        field("target", node.target);
        field("value", node.value);
        indentLevel--;
    }

    @Override
    public void visit(AnnAssignNode node) {
        header("AnnAssign" + (node.simple ? ": simple" : ""), node);
        indentLevel++;
        field("target", node.target);
        field("annotation", node.annotation);
        field("value", node.value);
        indentLevel--;
    }

    @Override
    public void visit(ForNode node) {
        header(node.isAsync ? "AsyncFor" : "For", node);
        indentLevel++;
        field("target", node.target);
        field("iter", node.iter);
        list("body", node.body);
        list("orelse", node.orElse);
        indentLevel--;
    }

    @Override
    public void visit(WhileNode node) {
        header("While", node);
        indentLevel++;
        field("test", node.test);
        list("body", node.body);
        list("orelse", node.orElse);
        indentLevel--;
    }

    @Override
    public void visit(IfNode node) {
        header("If", node);
        indentLevel++;
        field("test", node.test);
        list("body", node.body);
        list("orelse", node.orElse);
        indentLevel--;
    }

    @Override
    public void visit(WithNode node) {
        header(node.isAsync ? "AsyncWith" : "With", node);
        indentLevel++;
        list("items", node.items);
        list("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(MatchNode node) {
        header("Match", node);
        indentLevel++;
        field("subject", node.subject);
        list("cases", node.cases);
        indentLevel--;
    }

    @Override
    public void visit(RaiseNode node) {
        header("Raise", node);
        indentLevel++;
        field("exc", node.exc);
        field("cause", node.cause);
        indentLevel--;
    }

    @Override
    public void visit(TryNode node) {
        header(node.isStar ? "TryStar" : "Try", node);
        indentLevel++;
        list("body", node.body);
        list("handlers", node.handlers);
        list("orelse", node.orElse);
        list("finalbody", node.finalBody);
        indentLevel--;
    }

    @Override
    public void visit(AssertNode node) {
        header("Assert", node);
        indentLevel++;
        field("test", node.test);
        field("msg", node.msg);
        indentLevel--;
    }

    @Override
    public void visit(ImportNode node) {
        header("Import", node);
        indentLevel++;
        for (AliasNode alias : node.names) {
            alias.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(ImportFromNode node) {
        header("ImportFrom: " + ".".repeat(node.level) + nameOrNull(node.module), node);
        indentLevel++;
        for (AliasNode alias : node.names) {
            alias.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(GlobalNode node) {
        header("Global: " + String.join(", ", node.names), node);
    }

    @Override
    public void visit(NonlocalNode node) {
        header("Nonlocal: " + String.join(", ", node.names), node);
    }

    @Override
    public void visit(ExprStmtNode node) {
        header("Expr", node);
        indentLevel++;
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(PassNode node) {
        header("Pass", node);
    }

    @Override
    public void visit(BreakNode node) {
        header("Break", node);
    }

    @Override
    public void visit(ContinueNode node) {
        header("Continue", node);
    }

    @Override
    public void visit(BlankNode node) {
        header("Blank: " + node.count, node);
    }

    @Override
    public void visit(TypeAliasNode node) {
        header("TypeAlias", node);
        indentLevel++;
        field("name", node.name);
        list("type_params", node.typeParams);
        field("value", node.value);
        indentLevel--;
    }

    @Override
    public void visit(BoolOpNode node) {
        header("BoolOp: " + node.op.displayName, node);
        indentLevel++;
        for (ExpressionNode value : node.values) {
            value.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(NamedExprNode node) {
        header("NamedExpr", node);
        indentLevel++;
        node.target.accept(this);
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(BinOpNode node) {
        header("BinOp: " + node.op.displayName, node);
        indentLevel++;
        node.left.accept(this);
        node.right.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(UnaryOpNode node) {
        header("UnaryOp: " + node.op.displayName, node);
        indentLevel++;
        node.operand.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(LambdaNode node) {
        header("Lambda", node);
        indentLevel++;
        field("args", node.args);
        field("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(IfExpNode node) {
        header("IfExp", node);
        indentLevel++;
        field("test", node.test);
        field("body", node.body);
        field("orelse", node.orElse);
        indentLevel--;
    }

    @Override
    public void visit(DictNode node) {
        header("Dict", node);
        indentLevel++;
        list("keys", node.keys);
        list("values", node.values);
        indentLevel--;
    }

    @Override
    public void visit(SetNode node) {
        header("Set", node);
        indentLevel++;
        for (ExpressionNode elt : node.elts) {
            elt.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(ListCompNode node) {
        header("ListComp", node);
        indentLevel++;
        field("elt", node.elt);
        list("generators", node.generators);
        indentLevel--;
    }

    @Override
    public void visit(SetCompNode node) {
        header("SetComp", node);
        indentLevel++;
        field("elt", node.elt);
        list("generators", node.generators);
        indentLevel--;
    }

    @Override
    public void visit(DictCompNode node) {
        header("DictComp", node);
        indentLevel++;
        field("key", node.key);
        field("value", node.value);
        list("generators", node.generators);
        indentLevel--;
    }

    @Override
    public void visit(GeneratorExpNode node) {
        header("GeneratorExp", node);
        indentLevel++;
        field("elt", node.elt);
        list("generators", node.generators);
        indentLevel--;
    }

    @Override
    public void visit(AwaitNode node) {
        header("Await", node);
        indentLevel++;
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(YieldNode node) {
        header("Yield", node);
        if (node.value != null) {
            indentLevel++;
            node.value.accept(this);
            indentLevel--;
        }
    }

    @Override
    public void visit(YieldFromNode node) {
        header("YieldFrom", node);
        indentLevel++;
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(CompareNode node) {
        StringBuilder ops = new StringBuilder();
        for (CompareOperator op : node.ops) {
            ops.append(' ').append(op.displayName);
        }
        header("Compare:" + ops, node);
        indentLevel++;
        node.left.accept(this);
        for (ExpressionNode comparator : node.comparators) {
            comparator.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(CallNode node) {
        header("Call", node);
        indentLevel++;
        field("func", node.func);
        list("args", node.args);
        list("keywords", node.keywords);
        indentLevel--;
    }

    @Override
    public void visit(FormattedValueNode node) {
        header("FormattedValue" + (node.conversion == -1 ? "" : ": !" + (char) node.conversion), node);
        indentLevel++;
        field("value", node.value);
        field("format_spec", node.formatSpec);
        indentLevel--;
    }

    @Override
    public void visit(JoinedStrNode node) {
        header("JoinedStr", node);
        indentLevel++;
        for (ExpressionNode value : node.values) {
            value.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(ConstantNode node) {
        String text = switch (node.kind) {
            case NONE -> "None";
            case ELLIPSIS -> "Ellipsis";
            case BOOL -> ((Boolean) node.value) ? "True" : "False";
            case INT -> node.value.toString();
            case FLOAT -> node.value + " (float)";
            case COMPLEX -> node.value + "j";
            case STRING -> printable((String) node.value);
            case BYTES -> "b" + printable((String) node.value);
        };
        header("Constant: " + text, node);
    }

    @Override
    public void visit(AttributeNode node) {
        header("Attribute: " + node.attr + "  ctx:" + node.ctx.displayName, node);
        indentLevel++;
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(SubscriptNode node) {
        header("Subscript  ctx:" + node.ctx.displayName, node);
        indentLevel++;
        field("value", node.value);
        field("slice", node.slice);
        indentLevel--;
    }

    @Override
    public void visit(StarredNode node) {
        header("Starred  ctx:" + node.ctx.displayName, node);
        indentLevel++;
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(NameNode node) {
        header("Name: " + node.id + "  ctx:" + node.ctx.displayName, node);
    }

    @Override
    public void visit(ListNode node) {
        header("List  ctx:" + node.ctx.displayName, node);
        indentLevel++;
        for (ExpressionNode elt : node.elts) {
            elt.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(TupleNode node) {
        header("Tuple  ctx:" + node.ctx.displayName, node);
        indentLevel++;
        for (ExpressionNode elt : node.elts) {
            elt.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(SliceNode node) {
        header("Slice", node);
        indentLevel++;
        field("lower", node.lower);
        field("upper", node.upper);
        field("step", node.step);
        indentLevel--;
    }

    @Override
    public void visit(MatchValueNode node) {
        header("MatchValue", node);
        indentLevel++;
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(MatchSingletonNode node) {
        header("MatchSingleton", node);
        indentLevel++;
        node.value.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(MatchSequenceNode node) {
        header("MatchSequence", node);
        indentLevel++;
        for (PatternNode pattern : node.patterns) {
            pattern.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(MatchMappingNode node) {
        header("MatchMapping" + (node.rest == null ? "" : ": **" + node.rest), node);
        indentLevel++;
        list("keys", node.keys);
        list("patterns", node.patterns);
        indentLevel--;
    }

    @Override
    public void visit(MatchClassNode node) {
        header("MatchClass", node);
        indentLevel++;
        field("cls", node.cls);
        list("patterns", node.patterns);
        line("kwd_attrs: " + node.kwdAttrs);
        list("kwd_patterns", node.kwdPatterns);
        indentLevel--;
    }

    @Override
    public void visit(MatchStarNode node) {
        header("MatchStar: " + nameOrNull(node.name), node);
    }

    @Override
    public void visit(MatchAsNode node) {
        header("MatchAs: " + nameOrNull(node.name), node);
        if (node.pattern != null) {
            indentLevel++;
            node.pattern.accept(this);
            indentLevel--;
        }
    }

    @Override
    public void visit(MatchOrNode node) {
        header("MatchOr", node);
        indentLevel++;
        for (PatternNode pattern : node.patterns) {
            pattern.accept(this);
        }
        indentLevel--;
    }
}
