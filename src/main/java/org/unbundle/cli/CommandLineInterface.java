package org.unbundle.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unbundle.cli.commands.SplitCommand;
import org.unbundle.cli.config.ConfigLoader;
import org.unbundle.cli.config.LoggingConfigurator;
import org.unbundle.cli.config.SplitterConfig;

import com.typesafe.config.Config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "unbundle",
    mixinStandardHelpOptions = true,
    version = "unbundle 1.0",
    description = "Splits webpack chunks back into per-module ES sources",
    subcommands = {
        SplitCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String LOGGING_FORMAT = SplitterConfig.ROOT + ".logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/unbundle.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand given
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line with all subcommands registered.
     * Tests use this to run commands exactly as the entry point does.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("unbundle");
        return commandLine;
    }

    /**
     * Returns the resolved configuration, loading it and applying its logging settings on first use.
     *
     * @throws IllegalArgumentException            If an explicitly named config file does not exist.
     * @throws com.typesafe.config.ConfigException If the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
            final Config resolved = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });

            if (resolved.hasPath(LOGGING_FORMAT)) {
                final String format = resolved.getString(LOGGING_FORMAT);
                System.setProperty(LOGGING_FORMAT, "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
                reconfigureLogback();
            }
            LoggingConfigurator.configure(resolved);
            config = resolved;
        }
        return config;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
