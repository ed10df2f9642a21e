package org.stabel.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (integer, identifier or operator).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: an {@link Integer} for integers,
 *              the name for identifiers and an {@link Operator} for operators.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name of the source the token comes from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
}
