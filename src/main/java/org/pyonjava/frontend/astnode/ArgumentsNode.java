package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The ArgumentsNode class represents the parameter list of a function or lambda:
 * <pre>
 * def f(posonly, /, args, *vararg, kwonly, **kwarg)
 * </pre>
 * <p>
 * defaults holds the default values of the last positional parameters (positional-only
 * and normal counted together), so it may be shorter than {@code posonlyargs + args}.
 * kwDefaults is parallel to kwonlyargs; a null entry means that keyword-only
 * parameter has no default.
 */
public class ArgumentsNode extends AbstractNode {
    public final List<ArgNode> posonlyargs;
    public final List<ArgNode> args;
    public final ArgNode vararg;
    public final List<ArgNode> kwonlyargs;
    public final List<ExpressionNode> kwDefaults;
    public final ArgNode kwarg;
    public final List<ExpressionNode> defaults;

    public ArgumentsNode(List<ArgNode> posonlyargs, List<ArgNode> args, ArgNode vararg, List<ArgNode> kwonlyargs,
                         List<ExpressionNode> kwDefaults, ArgNode kwarg, List<ExpressionNode> defaults,
                         SourceSpan span) {
        super(span);
        this.posonlyargs = List.copyOf(posonlyargs);
        this.args = List.copyOf(args);
        this.vararg = vararg;
        this.kwonlyargs = List.copyOf(kwonlyargs);
        this.kwDefaults = copyOfNullable(kwDefaults);
        this.kwarg = kwarg;
        this.defaults = List.copyOf(defaults);
    }

    /**
     * Returns an empty parameter list, as in {@code def f():} or {@code lambda: 0}.
     */
    public static ArgumentsNode empty(SourceSpan span) {
        return new ArgumentsNode(List.of(), List.of(), null, List.of(), List.of(), null, List.of(), span);
    }

    public boolean isEmpty() {
        return posonlyargs.isEmpty() && args.isEmpty() && vararg == null && kwonlyargs.isEmpty() && kwarg == null;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
