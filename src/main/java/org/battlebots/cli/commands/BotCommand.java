package org.battlebots.cli.commands;

import java.util.concurrent.Callable;

import org.battlebots.ipc.RelayException;
import org.battlebots.sdk.BotProcessRunner;
import org.battlebots.sdk.examples.ReversingBot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;

/**
 * Runs the bundled {@link ReversingBot} over stdin/stdout. This is the default child process
 * of {@code battlebots run}.
 * <p>
 * Does not read the configuration file; the bot receives the simulation's configuration with
 * its {@code Init} message.
 */
@Command(
    name = "bot",
    description = "Run the bundled example bot on stdin/stdout (used as a child process)"
)
public class BotCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BotCommand.class);

    @Override
    public Integer call() {
        try {
            BotProcessRunner.runOnStandardStreams(new ReversingBot());
            return 0;
        } catch (RelayException e) {
            log.error("Bot stopped: {}", e.getMessage());
            return 1;
        }
    }
}
