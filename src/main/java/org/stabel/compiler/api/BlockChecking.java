package org.stabel.compiler.api;

/**
 * How the code generator treats conditional blocks opened by {@code = then}
 * and closed by {@code !} / {@code end}.
 */
public enum BlockChecking {
    /** Unbalanced blocks abort the transpilation. */
    STRICT,
    /** Braces are emitted as written; an imbalance only produces a warning. */
    LENIENT
}
