package org.stabel.compiler.frontend.lexer;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * The immutable, index-addressable result of lexing a program.
 * <p>
 * Besides plain indexed access it offers a one-token window around any position:
 * {@link #previous(int)} and {@link #next(int)} answer "absent" instead of failing
 * when the neighbor lies outside the sequence.
 */
public final class TokenSequence implements Iterable<Token> {

    private final List<Token> tokens;

    /**
     * Creates a sequence over a copy of the given tokens.
     * @param tokens The tokens in source order.
     */
    public TokenSequence(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Returns the token at the given index.
     * @param index A zero-based index.
     * @return The token, or empty if the index is outside the sequence.
     */
    public Optional<Token> at(int index) {
        if (index < 0 || index >= tokens.size()) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(index));
    }

    /**
     * Returns the token immediately before the given index.
     * @param index A zero-based index.
     * @return The preceding token, or empty at the start of the sequence.
     */
    public Optional<Token> previous(int index) {
        return at(index - 1);
    }

    /**
     * Returns the token immediately after the given index.
     * @param index A zero-based index.
     * @return The following token, or empty at the end of the sequence.
     */
    public Optional<Token> next(int index) {
        return at(index + 1);
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * Returns the tokens as an unmodifiable list.
     * @return The tokens in source order.
     */
    public List<Token> asList() {
        return tokens;
    }

    @Override
    public Iterator<Token> iterator() {
        return tokens.iterator();
    }
}
