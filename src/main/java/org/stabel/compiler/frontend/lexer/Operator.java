package org.stabel.compiler.frontend.lexer;

import java.util.Optional;

/**
 * The fixed set of single-character operators of the language.
 */
public enum Operator {
    ADD('+'),
    SUBTRACT('-'),
    MULTIPLY('*'),
    DIVIDE('/'),
    /** Swaps the two topmost stack elements. */
    SWAP('@'),
    /** Duplicates the topmost stack element. */
    DUPLICATE(':'),
    /** Compares the two topmost elements; opens a block when followed by {@code then}. */
    EQUALS('='),
    /** Closes the current conditional block and opens its else branch. */
    ELSE('!');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the source character of this operator.
     * @return The operator character.
     */
    public char symbol() {
        return symbol;
    }

    /**
     * Looks up the operator written with the given character.
     * @param c The source character.
     * @return The operator, or empty if {@code c} is not an operator character.
     */
    public static Optional<Operator> fromSymbol(char c) {
        for (Operator op : values()) {
            if (op.symbol == c) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
