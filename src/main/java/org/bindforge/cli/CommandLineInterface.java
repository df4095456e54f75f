package org.bindforge.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.bindforge.cli.commands.LowerCommand;
import org.bindforge.cli.commands.StringifyCommand;
import org.bindforge.config.ConfigLoader;
import org.bindforge.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "bindforge",
    mixinStandardHelpOptions = true,
    version = "Bindforge 1.0",
    description = "Bindforge - parameter lowering for native library bindings",
    subcommands = {
        LowerCommand.class,
        StringifyCommand.class,
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
        commandLine.setCommandName("bindforge");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws ConfigException if the configuration can not be parsed.
     * @throws IllegalArgumentException if the file given with {@code --config} does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
