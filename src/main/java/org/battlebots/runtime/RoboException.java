package org.battlebots.runtime;

import org.battlebots.runtime.spi.ControllerException;

/**
 * Thrown when a {@link Robo} cannot continue its run loop.
 * <p>
 * This is a checked exception: it ends the run loop of one bot only and is returned to
 * whoever supervises that bot's thread, which decides whether the failure is fatal.
 */
public class RoboException extends Exception {

    /**
     * Why the run loop ended.
     */
    public enum Reason {
        /** A previous callback failed with an unchecked exception while holding the controller lock. */
        STATE_POISONED,
        /** The controller reported an error from one of its callbacks. */
        CONTROLLER
    }

    private final int roboId;
    private final Reason reason;

    private RoboException(int roboId, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.roboId = roboId;
        this.reason = reason;
    }

    /**
     * Creates the exception for a robo whose controller state is no longer trustworthy.
     *
     * @param roboId the id of the affected robo.
     * @return the exception.
     */
    public static RoboException poisoned(int roboId) {
        return new RoboException(roboId, Reason.STATE_POISONED,
                "Robo " + roboId + ": controller state poisoned by an earlier failure", null);
    }

    /**
     * Wraps an error reported by the controller.
     *
     * @param roboId the id of the affected robo.
     * @param cause the controller's error.
     * @return the exception.
     */
    public static RoboException controller(int roboId, ControllerException cause) {
        return new RoboException(roboId, Reason.CONTROLLER,
                "Robo " + roboId + ": " + cause.getMessage(), cause);
    }

    public int getRoboId() {
        return roboId;
    }

    public Reason getReason() {
        return reason;
    }
}
