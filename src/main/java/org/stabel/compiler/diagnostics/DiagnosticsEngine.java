package org.stabel.compiler.diagnostics;

import org.stabel.compiler.api.TranspilationException;
import org.stabel.compiler.api.TranspilerErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the findings of one transpilation run.
 * <p>
 * The lexer and the code generator stop at the first error, so a run holds at most one
 * {@link Diagnostic.Severity#ERROR}; warnings only arise from lenient block checking.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records an error and builds the exception that aborts the run.
     *
     * @param code The kind of error.
     * @param message The message shown to the user.
     * @param fileName The logical name of the program.
     * @param line The line of the offending token.
     * @param column The column of the offending token.
     * @return The exception to throw; its message is the {@link #summary()}.
     */
    public TranspilationException error(TranspilerErrorCode code, String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, code, message, fileName, line, column));
        return new TranspilationException(code, summary());
    }

    /**
     * Records a finding that does not stop the run.
     */
    public void warning(TranspilerErrorCode code, String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, code, message, fileName, line, column));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * Returns the warnings in the order they were reported.
     * @return An unmodifiable snapshot.
     */
    public List<Diagnostic> getWarnings() {
        return diagnostics.stream()
                .filter(d -> !d.isError())
                .collect(Collectors.toUnmodifiableList());
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns one formatted line per finding.
     * @return The findings joined by line breaks.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
