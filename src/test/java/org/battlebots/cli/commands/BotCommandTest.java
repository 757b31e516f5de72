package org.battlebots.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.battlebots.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import picocli.CommandLine;

@Tag("unit")
class BotCommandTest {

    @Test
    void commandIsRegistered() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKey("bot");
    }

    @Test
    void helpDescribesTheCommand() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        cmdLine.execute("help", "bot");

        assertThat(out.toString()).contains("example bot");
    }
}
