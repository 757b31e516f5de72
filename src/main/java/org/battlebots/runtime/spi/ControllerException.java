package org.battlebots.runtime.spi;

/**
 * Base class for errors raised by an {@link IRoboController} callback.
 * <p>
 * A controller exception terminates only the run loop of the bot that raised it. It never
 * stops the world or sibling bots directly; escalation is decided by whoever supervises the
 * bot's thread.
 */
public class ControllerException extends Exception {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message.
     */
    public ControllerException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message.
     * @param cause the underlying cause.
     */
    public ControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
