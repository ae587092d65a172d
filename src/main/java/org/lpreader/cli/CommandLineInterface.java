package org.lpreader.cli;

import com.typesafe.config.Config;
import org.lpreader.cli.commands.InspectCommand;
import org.lpreader.cli.commands.ValidateCommand;
import org.lpreader.config.ConfigLoader;
import org.lpreader.config.LoggingConfigurator;
import org.lpreader.config.ReaderOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "lpreader",
    mixinStandardHelpOptions = true,
    version = "lp-reader 1.0",
    description = "Reads optimization models in the LP file format",
    subcommands = {
        InspectCommand.class,
        ValidateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("lpreader");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The merged configuration.
     * @throws CommandLine.ParameterException if an explicit configuration file does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.isFile()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * @return The reader options of the merged configuration.
     */
    public ReaderOptions getReaderOptions() {
        return ReaderOptions.fromConfig(getConfig());
    }
}
