package org.stabel.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during transpilation.
 * This decouples the test logic from the diagnostic messages.
 */
public enum TranspilerErrorCode {
    // region Lexer Errors
    /** A character outside the lexical grammar was found. */
    UNRECOGNIZED_CHARACTER,
    /** An integer literal does not fit the 32-bit integer type of the emitted program. */
    INTEGER_LITERAL_OUT_OF_RANGE,
    // endregion

    // region Code Generation Errors
    /** The word {@code then} was not immediately preceded by {@code =} or {@code !}. */
    MISSING_EQUALITY_BEFORE_THEN,
    /** The word {@code def} was not immediately preceded by an identifier. */
    MISSING_IDENTIFIER_BEFORE_DEF,
    /** An identifier is neither a keyword, a declared variable nor a declaration target. */
    UNRECOGNIZED_IDENTIFIER,
    /** An operator token carries a symbol outside the operator set. */
    UNRECOGNIZED_TOKEN,
    // endregion

    // region Block Balance Errors
    /** An {@code end} was found while no conditional block was open. */
    UNMATCHED_BLOCK_CLOSE,
    /** A {@code !} was found while no conditional block was open. */
    ELSE_WITHOUT_IF,
    /** A second {@code !} was found inside the same conditional block. */
    DUPLICATE_ELSE,
    /** The program ended while a conditional block was still open. */
    UNCLOSED_BLOCK
    // endregion
}
