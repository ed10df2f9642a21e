package org.stabel.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.Locale;

/**
 * Settings that shape the generated program.
 *
 * @param stackCapacity The bound of the emitted runtime stack ({@code MAX_SIZE}).
 * @param traceComments Whether each token's statements are preceded by a comment naming the token.
 * @param blockChecking How unbalanced conditional blocks are handled.
 */
public record TranspilerOptions(
        int stackCapacity,
        boolean traceComments,
        BlockChecking blockChecking
) {
    /** Stack bound used when nothing else is configured. */
    public static final int DEFAULT_STACK_CAPACITY = 255;

    private static final String STACK_CAPACITY = "stack-capacity";
    private static final String TRACE_COMMENTS = "trace-comments";
    private static final String BLOCK_CHECKING = "block-checking";

    public TranspilerOptions {
        if (stackCapacity < 1) {
            throw new IllegalArgumentException("Stack capacity must be at least 1, got " + stackCapacity);
        }
        if (blockChecking == null) {
            throw new IllegalArgumentException("Block checking mode must not be null");
        }
    }

    /**
     * Returns the options used when no configuration is supplied.
     * @return The default options.
     */
    public static TranspilerOptions defaults() {
        return new TranspilerOptions(DEFAULT_STACK_CAPACITY, true, BlockChecking.STRICT);
    }

    /**
     * Reads the options from a {@code stabel.transpiler} configuration block.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param transpilerConfig The configuration block, e.g. {@code config.getConfig("stabel.transpiler")}.
     * @return The parsed options.
     * @throws ConfigException.BadValue if a value is out of range or not a known mode.
     */
    public static TranspilerOptions fromConfig(Config transpilerConfig) {
        TranspilerOptions defaults = defaults();

        int capacity = transpilerConfig.hasPath(STACK_CAPACITY)
                ? transpilerConfig.getInt(STACK_CAPACITY)
                : defaults.stackCapacity();
        if (capacity < 1) {
            throw new ConfigException.BadValue(transpilerConfig.origin(), STACK_CAPACITY,
                    "must be at least 1, got " + capacity);
        }

        boolean trace = transpilerConfig.hasPath(TRACE_COMMENTS)
                ? transpilerConfig.getBoolean(TRACE_COMMENTS)
                : defaults.traceComments();

        BlockChecking mode = defaults.blockChecking();
        if (transpilerConfig.hasPath(BLOCK_CHECKING)) {
            String raw = transpilerConfig.getString(BLOCK_CHECKING);
            try {
                mode = BlockChecking.valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(transpilerConfig.origin(), BLOCK_CHECKING,
                        "expected STRICT or LENIENT, got '" + raw + "'", e);
            }
        }

        return new TranspilerOptions(capacity, trace, mode);
    }
}
