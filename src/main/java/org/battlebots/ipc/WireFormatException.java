package org.battlebots.ipc;

/**
 * Thrown when a wire payload cannot be encoded or is not valid JSON of the expected shape.
 */
public class WireFormatException extends Exception {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message.
     */
    public WireFormatException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message.
     * @param cause the underlying cause.
     */
    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
