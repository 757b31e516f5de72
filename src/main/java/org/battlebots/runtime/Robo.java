package org.battlebots.runtime;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.battlebots.runtime.spi.ControllerException;
import org.battlebots.runtime.spi.IRoboController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one controller through its init, tick and kill lifecycle in lockstep with the world.
 * <p>
 * The controller lives behind an exclusive lock. The run loop only touches it between the
 * start and end barrier of a tick, while the world only reads {@link #publicData()} outside
 * of any tick, so snapshots never observe a half-applied tick.
 * <p>
 * <b>Poisoning:</b> if a callback throws an unchecked exception or error while the lock is
 * held, the controller's state can no longer be trusted. The throwable is rethrown unchanged
 * and every later access fails with {@link RoboException.Reason#STATE_POISONED}.
 *
 * @param <P> the type of the controller's public snapshot.
 */
public class Robo<P> {

    private static final Logger LOG = LoggerFactory.getLogger(Robo.class);

    @FunctionalInterface
    private interface ControllerCall<P, R> {
        R apply(IRoboController<P> controller) throws ControllerException;
    }

    private final int id;
    private final IRoboController<P> controller;
    private final ReentrantLock stateLock = new ReentrantLock();
    private boolean poisoned;
    private final AtomicLong ticksDone = new AtomicLong();

    /**
     * Creates a robo around the given controller.
     *
     * @param id a numeric id used in thread names and log messages.
     * @param controller the controller to drive; owned by this robo from now on.
     */
    public Robo(int id, IRoboController<P> controller) {
        this.id = id;
        this.controller = controller;
    }

    /**
     * Runs the controller until the world stops. Should be called exactly once, usually on
     * a dedicated thread.
     * <ol>
     *   <li>{@code init()} once under the lock</li>
     *   <li>for every admitted tick, {@code tick(elapsed)} under the lock, between the start
     *       and end barrier</li>
     *   <li>once {@link TickLock#take()} returns empty, {@code kill()} once and return</li>
     * </ol>
     *
     * @param tickLock the tick lock shared with the world and all other robos.
     * @throws RoboException if the controller fails or its state is poisoned; only this
     *                       robo's loop ends.
     * @throws InterruptedException if the thread is interrupted while waiting for a tick.
     */
    public void run(TickLock tickLock) throws RoboException, InterruptedException {
        locked(c -> {
            c.init();
            return null;
        });
        LOG.debug("Robo {} initialised", id);

        long previousTick = System.nanoTime();
        while (true) {
            Optional<TickGuard> taken = tickLock.take();
            if (taken.isEmpty()) {
                locked(c -> {
                    c.kill();
                    return null;
                });
                LOG.debug("Robo {} stopped after {} ticks", id, ticksDone.get());
                return;
            }

            try (TickGuard ignored = taken.get()) {
                long now = System.nanoTime();
                Duration elapsed = Duration.ofNanos(now - previousTick);
                locked(c -> {
                    c.tick(elapsed);
                    return null;
                });
                previousTick = now;
                ticksDone.incrementAndGet();
            }
        }
    }

    /**
     * Returns the controller's public snapshot. Takes the controller lock briefly; must not be
     * called from inside another robo's tick.
     *
     * @return the snapshot.
     * @throws RoboException if the controller state is poisoned.
     */
    public P publicData() throws RoboException {
        return locked(IRoboController::publicData);
    }

    public int getId() {
        return id;
    }

    /**
     * Returns the number of ticks this robo has completed.
     *
     * @return the completed tick count.
     */
    public long getTicksDone() {
        return ticksDone.get();
    }

    private <R> R locked(ControllerCall<P, R> call) throws RoboException {
        stateLock.lock();
        try {
            if (poisoned) {
                throw RoboException.poisoned(id);
            }
            try {
                return call.apply(controller);
            } catch (ControllerException e) {
                throw RoboException.controller(id, e);
            } catch (RuntimeException | Error e) {
                poisoned = true;
                throw e;
            }
        } finally {
            stateLock.unlock();
        }
    }
}
