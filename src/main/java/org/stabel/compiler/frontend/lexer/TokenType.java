package org.stabel.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A decimal integer literal, such as {@code 42}. */
    INTEGER,
    /** A word made of letters and underscores: a keyword or a variable name. */
    IDENTIFIER,
    /** A single-character operator from {@link Operator}. */
    OPERATOR
}
