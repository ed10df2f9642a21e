package org.stabel.compiler.diagnostics;

import org.stabel.compiler.api.TranspilerErrorCode;

/**
 * One finding of a transpilation run, anchored at the first character of the offending token.
 *
 * @param severity Whether the finding stops the run.
 * @param code The kind of finding.
 * @param message The message shown to the user.
 * @param fileName The logical name of the program.
 * @param line The 1-based line.
 * @param column The 1-based column.
 */
public record Diagnostic(
        Severity severity,
        TranspilerErrorCode code,
        String message,
        String fileName,
        int line,
        int column
) {
    public enum Severity {
        /** The run is aborted and no program is produced. */
        ERROR,
        /** The program is produced anyway, e.g. an unbalanced block in lenient mode. */
        WARNING
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Formats the finding as {@code [ERROR] prog.stabel:1:5: Unrecognized character: '$'}.
     */
    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", severity, fileName, line, column, message);
    }
}
