package org.stabel.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.stabel.cli.commands.TokensCommand;
import org.stabel.cli.commands.TranspileCommand;
import org.stabel.cli.config.ConfigLoader;
import org.stabel.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "stabel",
    mixinStandardHelpOptions = true,
    version = "Stabel 1.0",
    description = "Stabel - transpiles postfix stack programs to C",
    subcommands = {
        TranspileCommand.class,
        TokensCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("stabel");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Returns the merged configuration, loading it and applying its logging settings on first use.
     *
     * @return The resolved configuration.
     * @throws ConfigException if the configuration cannot be loaded or parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
