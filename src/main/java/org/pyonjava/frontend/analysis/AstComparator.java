package org.pyonjava.frontend.analysis;

import org.pyonjava.frontend.astnode.Node;

/**
 * Structural comparison of syntax trees.
 * <p>
 * Two trees are structurally equal when they have the same node kinds, operators,
 * names, constants and child structure. Source spans are ignored, so a tree
 * regenerated from source text compares equal to the tree it was generated from.
 */
public final class AstComparator {

    private AstComparator() {
    }

    public static boolean structurallyEqual(Node left, Node right) {
        if (left == null || right == null) {
            return left == right;
        }
        return render(left).equals(render(right));
    }

    /**
     * Returns the span-free rendering used for comparison.
     */
    public static String render(Node node) {
        PrintVisitor printVisitor = new PrintVisitor(false);
        node.accept(printVisitor);
        return printVisitor.getResult();
    }
}
