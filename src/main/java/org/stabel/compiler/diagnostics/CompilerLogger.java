package org.stabel.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Progress logging of the transpiler phases, gated by the integer verbosity of the
 * {@code -v} option (0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE).
 * <p>
 * User-facing findings are not logged here; they travel as {@link Diagnostic}s.
 */
public final class CompilerLogger {

    public static final int ERROR = 0;
    public static final int DEBUG = 3;
    public static final int TRACE = 4;

    private static volatile int level = 2;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);

    private CompilerLogger() {}

    /**
     * Sets the verbosity. Values outside 0..4 are clamped.
     * @param newLevel The new verbosity.
     */
    public static void setLevel(int newLevel) {
        level = Math.max(ERROR, Math.min(TRACE, newLevel));
    }

    public static void debug(String msg) {
        if (level >= DEBUG) logger.debug(msg);
    }

    /**
     * Logs a per-token message. The message is only built when tracing is enabled.
     * @param msg Supplies the message.
     */
    public static void trace(Supplier<String> msg) {
        if (level >= TRACE && logger.isTraceEnabled()) logger.trace(msg.get());
    }
}
