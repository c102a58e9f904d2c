package org.pep2rpm.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.pep2rpm.cli.commands.CompareCommand;
import org.pep2rpm.cli.commands.ConvertCommand;
import org.pep2rpm.cli.commands.EncodeCommand;
import org.pep2rpm.cli.commands.TagsCommand;
import org.pep2rpm.cli.config.ConfigLoader;
import org.pep2rpm.cli.config.LoggingConfigurator;
import org.pep2rpm.cli.config.TranslatorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "pep2rpm",
    mixinStandardHelpOptions = true,
    version = "pep2rpm 1.0",
    description = "Translate Python package requirements and versions into RPM dependencies",
    subcommands = {
        ConvertCommand.class,
        EncodeCommand.class,
        CompareCommand.class,
        TagsCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/pep2rpm.conf)"
    )
    private File configFile;

    @Option(
        names = {"--flavour"},
        description = "Distribution flavour whose capability templates are used (default: pep2rpm.flavour)"
    )
    private String flavour;

    private TranslatorSettings settings;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("pep2rpm");
        return commandLine;
    }

    /**
     * Loads configuration on first use and derives the translator settings from it.
     *
     * @return The settings for the selected flavour.
     * @throws IllegalArgumentException if the configuration names unknown files, flavours or values.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public TranslatorSettings getSettings() {
        if (settings == null) {
            final Config config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> log.debug(message);
                    case WARN -> log.warn(message);
                }
            });
            LoggingConfigurator.configure(config);
            settings = TranslatorSettings.fromConfig(config, flavour);
            log.debug("Using flavour '{}' with templates {}", settings.flavour(), settings.templates());
        }
        return settings;
    }
}
