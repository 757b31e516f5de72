package org.battlebots.runtime;

/**
 * Thrown when the world loop cannot continue, e.g. because a robo's state was poisoned while
 * the world was publishing snapshots.
 */
public class WorldException extends Exception {

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message.
     * @param cause the underlying cause.
     */
    public WorldException(String message, Throwable cause) {
        super(message, cause);
    }
}
