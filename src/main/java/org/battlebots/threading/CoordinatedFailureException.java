package org.battlebots.threading;

/**
 * Escalates the failure of a coordinated closure to the caller's thread.
 */
public class CoordinatedFailureException extends RuntimeException {

    /**
     * Constructs a new exception wrapping the closure's failure.
     *
     * @param cause what the closure threw.
     */
    public CoordinatedFailureException(Throwable cause) {
        super("Coordinated thread failed: " + cause, cause);
    }
}
