package org.battlebots.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.battlebots.cli.commands.BotCommand;
import org.battlebots.cli.commands.RunCommand;
import org.battlebots.cli.config.ConfigLoader;
import org.battlebots.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "battlebots",
    mixinStandardHelpOptions = true,
    version = "Battlebots 1.0",
    description = "Battlebots - lockstep simulation of bots controlled by external programs",
    subcommands = {
        RunCommand.class,
        BotCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Logs are written to stderr. When started as a bot, stdout carries the bot protocol."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/battlebots.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand given
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
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
        commandLine.setCommandName("battlebots");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            System.exit(1);
        } catch (com.typesafe.config.ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            System.exit(1);
        }

        if (config.hasPath("logging.format") && "COLOR".equalsIgnoreCase(config.getString("logging.format"))) {
            System.setProperty("battlebots.logging.appender", "STDERR_COLOR");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (ch.qos.logback.core.joran.spi.JoranException | ClassCastException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
