package org.battlebots.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colors the level in the {@code STDERR_COLOR} appender.
 * ERROR is red, WARN yellow, INFO cyan and TRACE dimmed; DEBUG keeps the terminal color.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String CYAN = "\u001B[36m";
    private static final String DIM = "\u001B[2m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return switch (event.getLevel().toInt()) {
            case Level.ERROR_INT -> RED + in + RESET;
            case Level.WARN_INT -> YELLOW + in + RESET;
            case Level.INFO_INT -> CYAN + in + RESET;
            case Level.TRACE_INT -> DIM + in + RESET;
            default -> in;
        };
    }
}
