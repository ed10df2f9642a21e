package org.stabel.compiler;

import org.stabel.compiler.api.ITranspiler;
import org.stabel.compiler.api.TranspilationException;
import org.stabel.compiler.api.TranspiledProgram;
import org.stabel.compiler.api.TranspilerOptions;
import org.stabel.compiler.backend.codegen.CodeGenerator;
import org.stabel.compiler.backend.emit.CodeBuffer;
import org.stabel.compiler.backend.emit.Emitter;
import org.stabel.compiler.diagnostics.CompilerLogger;
import org.stabel.compiler.diagnostics.DiagnosticsEngine;
import org.stabel.compiler.frontend.lexer.Lexer;
import org.stabel.compiler.frontend.lexer.Token;
import org.stabel.compiler.frontend.lexer.TokenSequence;
import org.stabel.compiler.frontend.semantics.VariableRegistry;

import java.util.List;

/**
 * The main transpiler implementation. This class orchestrates the pipeline from
 * source text to C program text:
 * <ol>
 *     <li>Lexical analysis into a {@link TokenSequence}.</li>
 *     <li>Code generation, one statement group per token, against a fresh {@link VariableRegistry}.</li>
 *     <li>Emission of the boilerplate around the generated statements.</li>
 * </ol>
 * All per-run state is created inside {@link #transpile(String, String)}, so the same input
 * always produces the same output.
 */
public class Transpiler implements ITranspiler {

    private final TranspilerOptions options;
    private int verbosity = -1;

    /**
     * Creates a transpiler with {@link TranspilerOptions#defaults()}.
     */
    public Transpiler() {
        this(TranspilerOptions.defaults());
    }

    /**
     * Creates a transpiler with the given options.
     * @param options The code generation options.
     */
    public Transpiler(TranspilerOptions options) {
        this.options = options;
    }

    @Override
    public TranspiledProgram transpile(String source, String programName) throws TranspilationException {
        applyVerbosity();
        CompilerLogger.debug("Transpiler: " + programName);

        // Phase 1: Lexical Analysis
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        TokenSequence tokens = new Lexer(source, diagnostics, programName).scanTokens();

        // Phase 2: Code Generation
        VariableRegistry variables = new VariableRegistry();
        CodeBuffer body = new CodeBuffer();
        CodeGenerator generator = new CodeGenerator(tokens, variables, diagnostics, options, body);
        generator.generate();

        // Phase 3: Emission
        String code = new Emitter(options).emit(body, generator.getFileScopeSymbols());

        CompilerLogger.debug("Transpiler: " + tokens.size() + " tokens, " + variables.size() + " variables");
        return new TranspiledProgram(programName, code, tokens.asList(), variables.getNames(), diagnostics.getWarnings());
    }

    @Override
    public List<Token> tokenize(String source, String programName) throws TranspilationException {
        applyVerbosity();
        return new Lexer(source, new DiagnosticsEngine(), programName).scanTokens().asList();
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    private void applyVerbosity() {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
    }
}
