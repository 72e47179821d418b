package org.pyonjava.frontend.astnode;

import org.pyonjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * The MatchClassNode class represents {@code Cls(p1, attr=p2)}.
 * kwdAttrs and kwdPatterns are parallel lists.
 */
public class MatchClassNode extends PatternNode {
    public final ExpressionNode cls;
    public final List<PatternNode> patterns;
    public final List<String> kwdAttrs;
    public final List<PatternNode> kwdPatterns;

    public MatchClassNode(ExpressionNode cls, List<PatternNode> patterns, List<String> kwdAttrs, List<PatternNode> kwdPatterns, SourceSpan span) {
        super(span);
        this.cls = cls;
        this.patterns = List.copyOf(patterns);
        this.kwdAttrs = List.copyOf(kwdAttrs);
        this.kwdPatterns = List.copyOf(kwdPatterns);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
