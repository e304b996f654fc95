package org.littlemanplus.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.littlemanplus.cli.commands.AssembleCommand;
import org.littlemanplus.cli.commands.RunCommand;
import org.littlemanplus.cli.config.ConfigLoader;
import org.littlemanplus.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "lmp",
    mixinStandardHelpOptions = true,
    version = "LittleMan Plus 1.0",
    description = "LittleMan Plus - assembler and simulator for an extended Little Man Computer",
    subcommands = {
        AssembleCommand.class,
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        try {
            if (configFile != null) {
                if (!configFile.isFile()) {
                    throw new CommandLine.ParameterException(spec.commandLine(),
                            "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
                }
                config = ConfigLoader.load(configFile);
            } else {
                config = ConfigLoader.load();
            }
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
