package org.battlebots.runtime.spi;

import java.time.Duration;

/**
 * The pluggable decision-making unit driving one bot.
 * <p>
 * A controller is only ever called by its owning {@link org.battlebots.runtime.Robo}, which
 * serializes all calls behind one lock. Implementations therefore need no synchronization of
 * their own, but {@link #publicData()} must return a value that stays valid after the lock is
 * released (an immutable object or a defensive copy).
 *
 * @param <P> the type of the externally visible snapshot.
 */
public interface IRoboController<P> {

    /**
     * Called once before the first tick.
     *
     * @throws ControllerException if the controller cannot start.
     */
    void init() throws ControllerException;

    /**
     * Advances the controller by one tick.
     *
     * @param elapsed wall-clock time since the previous tick (or since the run loop started).
     * @throws ControllerException if the tick cannot be completed.
     */
    void tick(Duration elapsed) throws ControllerException;

    /**
     * Called once after the world has stopped.
     *
     * @throws ControllerException if the controller cannot shut down cleanly.
     */
    void kill() throws ControllerException;

    /**
     * Returns a snapshot of the externally visible data.
     *
     * @return an immutable or defensively copied snapshot.
     */
    P publicData();
}
