package org.pyonjava.frontend.astnode;

/**
 * How an expression is used: read, assigned to, or deleted.
 */
public enum ExprContext {
    LOAD("Load"),
    STORE("Store"),
    DEL("Del");

    public final String displayName;

    ExprContext(String displayName) {
        this.displayName = displayName;
    }
}
