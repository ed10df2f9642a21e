package org.stabel.compiler.frontend.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The set of variable names declared so far in one transpilation pass.
 * <p>
 * Names are kept in declaration order and are never removed. There is a single flat scope:
 * a name declared inside a conditional block stays declared after the block.
 */
public class VariableRegistry {

    private final Set<String> names = new LinkedHashSet<>();

    /**
     * Checks whether a variable of this name was declared before.
     * @param name The variable name.
     * @return {@code true} if the name is registered.
     */
    public boolean isDeclared(String name) {
        return names.contains(name);
    }

    /**
     * Registers a name.
     * @param name The variable name.
     * @return {@code true} if this was the first declaration, {@code false} if the name was already known.
     */
    public boolean declare(String name) {
        return names.add(name);
    }

    public int size() {
        return names.size();
    }

    /**
     * Returns the declared names in declaration order.
     * @return An unmodifiable snapshot of the names.
     */
    public List<String> getNames() {
        return Collections.unmodifiableList(new ArrayList<>(names));
    }
}
