package org.stabel.cli.toolchain;

import org.stabel.compiler.Transpiler;
import org.stabel.compiler.api.TranspilationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Hands generated programs to a real {@code gcc} and runs the executables.
 * Skipped when no {@code gcc} is on the PATH.
 */
public class GeneratedProgramCompilationTest {

    @TempDir
    Path tempDir;

    private static boolean gccAvailable() throws InterruptedException {
        try {
            Process process = new ProcessBuilder("gcc", "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor() == 0;
        } catch (IOException e) {
            return false;
        }
    }

    private List<String> compileAndRun(String source) throws IOException, InterruptedException, TranspilationException {
        Path cFile = tempDir.resolve("p.c");
        Path executable = tempDir.resolve("p.out");
        Files.writeString(cFile, new Transpiler().transpile(source, "p.stabel").sourceCode(), StandardCharsets.UTF_8);

        int exitCode = new NativeCompiler("gcc", List.of()).compile(cFile, executable);
        assertThat(exitCode).as("gcc exit code").isZero();

        Process process = new ProcessBuilder(executable.toString()).redirectErrorStream(true).start();
        String output;
        try (InputStream stream = process.getInputStream()) {
            output = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
        assertThat(process.waitFor()).isZero();
        return output.lines().toList();
    }

    /**
     * A name first defined inside a branch is assigned in the sibling branch and read after
     * {@code end}; the C compiler must accept every one of those uses.
     */
    @Test
    @Tag("integration")
    void testVariableDefinedInsideBranchCompiles() throws Exception {
        assumeTrue(gccAvailable(), "gcc not available");

        // Act
        List<String> output = compileAndRun("1 2 = then 3 x def ! 4 x def end x echo");

        // Assert
        assertThat(output).containsExactly("4");
    }

    @Test
    @Tag("integration")
    void testArithmeticAndStackWordsCompile() throws Exception {
        assumeTrue(gccAvailable(), "gcc not available");

        List<String> output = compileAndRun("5 3 - echo 1 2 @ echo echo 9 peek : = echo 2 y def y y * echo");

        assertThat(output).containsExactly("2", "1", "2", "9", "1", "4");
    }
}
