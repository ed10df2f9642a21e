package org.stabel.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.stabel.cli.CommandLineInterface;
import org.stabel.cli.config.ConfigLoader;
import org.stabel.cli.toolchain.NativeCompiler;
import org.stabel.compiler.Transpiler;
import org.stabel.compiler.api.ITranspiler;
import org.stabel.compiler.api.TranspilationException;
import org.stabel.compiler.api.TranspiledProgram;
import org.stabel.compiler.api.TranspilerOptions;
import org.stabel.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(name = "transpile", description = "Transpiles a Stabel program to C and optionally builds it.")
public class TranspileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranspileCommand.class);

    /** The program could not be transpiled. */
    static final int EXIT_TRANSPILATION_FAILED = 1;
    /** A file could not be read or written, or the options are unusable. */
    static final int EXIT_IO_ERROR = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The Stabel source file.")
    private File file;

    @Option(names = {"-o", "--output"}, description = "The C file to write. Defaults to the source file with the configured extension.")
    private File output;

    @Option(names = "--stdout", description = "Print the generated C code instead of writing a file.")
    private boolean toStdout;

    @Option(names = "--native", description = "Compile the generated C file with the configured C compiler.")
    private boolean buildNative;

    @Option(names = {"-v", "--verbosity"}, defaultValue = "-1",
            description = "Transpiler log verbosity: 0=error, 1=warn, 2=info, 3=debug, 4=trace.")
    private int verbosity;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Function<TranspilerOptions, ITranspiler> transpilerFactory;

    public TranspileCommand() {
        this(Transpiler::new);
    }

    /**
     * Creates the command with a custom transpiler, e.g. a test double.
     * @param transpilerFactory Creates the transpiler from the configured options.
     */
    public TranspileCommand(Function<TranspilerOptions, ITranspiler> transpilerFactory) {
        this.transpilerFactory = transpilerFactory;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (toStdout && buildNative) {
            err.println("--native needs a C file on disk and cannot be combined with --stdout.");
            return EXIT_IO_ERROR;
        }

        final Config config;
        final TranspilerOptions options;
        try {
            config = parent != null ? parent.getConfig() : ConfigLoader.load(null);
            options = TranspilerOptions.fromConfig(config.getConfig("stabel.transpiler"));
        } catch (ConfigException e) {
            log.error("Failed to load or parse configuration: {}", e.getMessage());
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        final String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read {}", file, e);
            err.println("Cannot read " + file + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        ITranspiler transpiler = transpilerFactory.apply(options);
        transpiler.setVerbosity(verbosity);

        final TranspiledProgram program;
        try {
            program = transpiler.transpile(source, file.getPath());
        } catch (TranspilationException e) {
            log.debug("Transpilation of {} failed with {}", file, e.getErrorCode());
            err.println(e.getMessage());
            return EXIT_TRANSPILATION_FAILED;
        }
        for (Diagnostic warning : program.warnings()) {
            err.println(warning);
        }

        if (toStdout) {
            out.print(program.sourceCode());
            out.flush();
            return 0;
        }

        Path cFile = output != null
                ? output.toPath()
                : replaceExtension(file.toPath(), config.getString("stabel.output.extension"));
        if (cFile.toAbsolutePath().normalize().equals(file.toPath().toAbsolutePath().normalize())) {
            err.println("Refusing to overwrite the source file " + file + "; use --output.");
            return EXIT_IO_ERROR;
        }
        try {
            Files.writeString(cFile, program.sourceCode(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write {}", cFile, e);
            err.println("Cannot write " + cFile + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        log.info("Wrote {} ({} tokens, {} variables)", cFile, program.tokens().size(), program.declaredVariables().size());
        out.println(cFile);

        if (!buildNative) {
            return 0;
        }
        return compileNative(config, cFile, out, err);
    }

    private int compileNative(Config config, Path cFile, PrintWriter out, PrintWriter err) {
        NativeCompiler compiler = NativeCompiler.fromConfig(config.getConfig("stabel.toolchain"));
        Path executable = replaceExtension(cFile, config.getString("stabel.toolchain.executable-extension"));
        try {
            int exitCode = compiler.compile(cFile, executable);
            if (exitCode != 0) {
                err.println(compiler.getCompiler() + " exited with code " + exitCode);
                return exitCode;
            }
        } catch (IOException e) {
            log.error("Failed to start {}", compiler.getCompiler(), e);
            err.println("Failed to start " + compiler.getCompiler() + ". Please ensure it is installed and in your PATH.");
            return EXIT_IO_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted while waiting for " + compiler.getCompiler());
            return EXIT_TRANSPILATION_FAILED;
        }
        out.println(executable);
        return 0;
    }

    /**
     * Replaces the extension of the file name, or appends one if it has none.
     */
    static Path replaceExtension(Path path, String extension) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return path.resolveSibling(base + extension);
    }
}
