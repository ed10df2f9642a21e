package org.stabel.cli.toolchain;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Hands a generated C file to an external C compiler, e.g. {@code gcc prog.c -o prog.out}.
 */
public class NativeCompiler {

    private static final Logger log = LoggerFactory.getLogger(NativeCompiler.class);

    private final String compiler;
    private final List<String> flags;

    /**
     * Creates a launcher for the given compiler executable.
     * @param compiler The compiler executable, looked up on the PATH if not absolute.
     * @param flags Extra arguments placed before the input file.
     */
    public NativeCompiler(String compiler, List<String> flags) {
        if (compiler == null || compiler.isBlank()) {
            throw new IllegalArgumentException("Compiler executable must not be blank");
        }
        this.compiler = compiler;
        this.flags = List.copyOf(flags);
    }

    /**
     * Reads the launcher settings from a {@code stabel.toolchain} configuration block.
     * @param toolchainConfig The configuration block.
     * @return The configured launcher.
     */
    public static NativeCompiler fromConfig(Config toolchainConfig) {
        List<String> flags = toolchainConfig.hasPath("flags")
                ? toolchainConfig.getStringList("flags")
                : List.of();
        return new NativeCompiler(toolchainConfig.getString("compiler"), flags);
    }

    /**
     * Builds the command line for one compilation.
     * @param sourceFile The generated C file.
     * @param executable The executable to produce.
     * @return The command and its arguments.
     */
    public List<String> command(Path sourceFile, Path executable) {
        List<String> args = new ArrayList<>();
        args.add(compiler);
        args.addAll(flags);
        args.add(sourceFile.toString());
        args.add("-o");
        args.add(executable.toString());
        return args;
    }

    /**
     * Runs the compiler and waits for it to finish. Its combined output is logged.
     *
     * @param sourceFile The generated C file.
     * @param executable The executable to produce.
     * @return The compiler's exit code.
     * @throws IOException if the compiler cannot be started.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public int compile(Path sourceFile, Path executable) throws IOException, InterruptedException {
        List<String> args = command(sourceFile, executable);
        log.debug("Running {}", String.join(" ", args));

        ProcessBuilder pb = new ProcessBuilder(args);
        pb.redirectErrorStream(true);
        Process process = pb.start();

        String output;
        try (InputStream stream = process.getInputStream()) {
            output = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
        int exitCode = process.waitFor();

        if (!output.isBlank()) {
            if (exitCode == 0) {
                log.info("[{}] {}", compiler, output.strip());
            } else {
                log.error("[{}] {}", compiler, output.strip());
            }
        }
        return exitCode;
    }

    public String getCompiler() {
        return compiler;
    }
}
