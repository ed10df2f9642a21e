package org.stabel.compiler.frontend.classifier;

import java.util.Optional;

/**
 * Reserved words. A keyword always wins over a variable of the same name.
 */
public enum Keyword {
    /** Pops and prints the topmost value. */
    ECHO("echo"),
    /** Prints the topmost value without removing it. */
    PEEK("peek"),
    /** Closes the current conditional block. */
    END("end"),
    /** Marks the preceding {@code =} as a block-opening comparison. */
    THEN("then"),
    /** Declares or assigns the variable named by the preceding identifier. */
    DEF("def");

    private final String word;

    Keyword(String word) {
        this.word = word;
    }

    /**
     * Returns the keyword as written in source code.
     * @return The source word.
     */
    public String word() {
        return word;
    }

    /**
     * Looks up the keyword with the given spelling. Matching is case-sensitive.
     * @param name An identifier.
     * @return The keyword, or empty if {@code name} is not reserved.
     */
    public static Optional<Keyword> of(String name) {
        for (Keyword k : values()) {
            if (k.word.equals(name)) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}
