package org.stabel.compiler.api;

import org.stabel.compiler.diagnostics.Diagnostic;
import org.stabel.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The result of a successful transpilation.
 *
 * @param programName The name of the source program.
 * @param sourceCode The complete generated C source text.
 * @param tokens The tokens the program was lexed into.
 * @param declaredVariables The variables the program declares, in declaration order.
 * @param warnings Non-fatal diagnostics, e.g. unbalanced blocks in lenient mode.
 */
public record TranspiledProgram(
        String programName,
        String sourceCode,
        List<Token> tokens,
        List<String> declaredVariables,
        List<Diagnostic> warnings
) {
    public TranspiledProgram {
        tokens = List.copyOf(tokens);
        declaredVariables = List.copyOf(declaredVariables);
        warnings = List.copyOf(warnings);
    }
}
