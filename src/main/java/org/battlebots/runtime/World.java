package org.battlebots.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.battlebots.runtime.config.SimulationConfig;
import org.battlebots.runtime.spi.IRoboController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every {@link Robo}, triggers each global tick through the shared {@link TickLock},
 * paces ticks to the configured rate and publishes a consistent snapshot of all robos.
 * <p>
 * Snapshots are collected before the world enters the next tick, i.e. strictly between two
 * barrier crossings. The published list therefore always reflects the state after the previous
 * tick and before the current one. The list is replaced as a whole, never mutated in place.
 * <p>
 * The robos themselves are not started here: each {@link Robo#run(TickLock)} must run on its
 * own thread with {@link #getTickLock()}, otherwise the world cannot make progress.
 * <p>
 * <b>Liveness:</b> a robo whose controller fails leaves the tick loop for good, while the world
 * and every other robo keep waiting for it on the start barrier. From then on no tick starts,
 * {@link #requestStop()} is not honoured and no other controller is killed. Whoever runs the
 * world must bound its wait and release the bots' resources itself.
 *
 * @param <P> the type of the robos' public snapshots.
 */
public class World<P> {

    private static final Logger LOG = LoggerFactory.getLogger(World.class);

    private final SimulationConfig config;
    private final List<Robo<P>> robos;
    private final TickLock tickLock;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong ticksDone = new AtomicLong();

    // Explicit lock rather than the monitor, held only while swapping the list.
    private final ReentrantLock snapshotLock = new ReentrantLock();
    private List<P> snapshots;

    /**
     * Creates a world. Each controller is wrapped in a {@link Robo} whose id is its position
     * in iteration order.
     *
     * @param config the simulation configuration.
     * @param controllers the initial controllers.
     */
    public World(SimulationConfig config, Collection<? extends IRoboController<P>> controllers) {
        this.config = config;
        List<Robo<P>> created = new ArrayList<>(controllers.size());
        List<P> initial = new ArrayList<>(controllers.size());
        int id = 0;
        for (IRoboController<P> controller : controllers) {
            initial.add(controller.publicData());
            created.add(new Robo<>(id++, controller));
        }
        this.robos = Collections.unmodifiableList(created);
        this.snapshots = Collections.unmodifiableList(initial);
        this.tickLock = new TickLock(created.size());
    }

    /**
     * Runs the world until a stop request has been honoured.
     * <p>
     * Each iteration publishes snapshots, enters the next tick, stops the world if requested
     * and sleeps for whatever is left of the tick budget. A tick that overran is not caught up:
     * the deadline still advances by exactly one tick duration.
     *
     * @throws WorldException if a robo's snapshot could not be taken.
     * @throws InterruptedException if the world thread is interrupted.
     */
    public void run() throws WorldException, InterruptedException {
        Duration tickDuration = config.tickDuration();
        long tickNanos = tickDuration.toNanos();
        long nextTickTime = System.nanoTime() + tickNanos;

        LOG.info("World started: robos={}, ticksPerSecond={}, ticksPerStep={}",
                robos.size(), config.ticksPerSecond(), config.ticksPerStep());

        while (true) {
            publishSnapshots();

            Optional<TickGuard> taken = tickLock.take();
            if (taken.isEmpty()) {
                LOG.info("World stopped after {} ticks", ticksDone.get());
                return;
            }

            try (TickGuard guard = taken.get()) {
                long tick = ticksDone.incrementAndGet();

                if (stopRequested.get()) {
                    LOG.debug("Stopping world during tick {}", tick);
                    guard.stop();
                }

                long remaining = nextTickTime - System.nanoTime();
                if (remaining > 0) {
                    TimeUnit.NANOSECONDS.sleep(remaining);
                } else if (LOG.isTraceEnabled()) {
                    LOG.trace("Tick {} overran its budget by {} µs", tick, -remaining / 1000);
                }
                nextTickTime += tickNanos;
            }
        }
    }

    /**
     * Asks the world to stop at the next tick. Non-blocking, idempotent and safe to call
     * from any thread.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            LOG.info("World stop requested");
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Returns the most recently published snapshots, one per robo in robo order.
     * The returned list is unmodifiable and never changes after being returned.
     *
     * @return the current snapshot list.
     */
    public List<P> getSnapshots() {
        snapshotLock.lock();
        try {
            return snapshots;
        } finally {
            snapshotLock.unlock();
        }
    }

    public List<Robo<P>> getRobos() {
        return robos;
    }

    public TickLock getTickLock() {
        return tickLock;
    }

    public SimulationConfig getConfig() {
        return config;
    }

    /**
     * Returns the number of ticks the world has entered.
     *
     * @return the tick count.
     */
    public long getTicksDone() {
        return ticksDone.get();
    }

    private void publishSnapshots() throws WorldException {
        List<P> fresh = new ArrayList<>(robos.size());
        for (Robo<P> robo : robos) {
            try {
                fresh.add(robo.publicData());
            } catch (RoboException e) {
                throw new WorldException("Failed to snapshot robo " + robo.getId(), e);
            }
        }
        List<P> published = Collections.unmodifiableList(fresh);

        snapshotLock.lock();
        try {
            snapshots = published;
        } finally {
            snapshotLock.unlock();
        }
    }
}
