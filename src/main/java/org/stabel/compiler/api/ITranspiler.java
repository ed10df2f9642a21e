package org.stabel.compiler.api;

import org.stabel.compiler.frontend.lexer.Token;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the Stabel transpiler.
 */
public interface ITranspiler {

    /**
     * Transpiles the given source code into a C program.
     *
     * @param source The complete program text.
     * @param programName A name for the program, used in diagnostics.
     * @return The generated program together with its tokens and declared variables.
     * @throws TranspilationException on the first lexical or code generation error.
     */
    TranspiledProgram transpile(String source, String programName) throws TranspilationException;

    /**
     * Runs only the lexer over the given source code.
     *
     * @param source The complete program text.
     * @param programName A name for the program, used in diagnostics.
     * @return The tokens in source order.
     * @throws TranspilationException on the first lexical error.
     */
    List<Token> tokenize(String source, String programName) throws TranspilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only ... 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Transpiles the source code from a file.
     * @param programPath The path to the source file.
     * @return The generated program.
     * @throws TranspilationException if errors occur during transpilation.
     * @throws IOException if the file cannot be read.
     */
    default TranspiledProgram transpile(Path programPath) throws TranspilationException, IOException {
        return transpile(Files.readString(programPath, StandardCharsets.UTF_8), programPath.toString());
    }
}
