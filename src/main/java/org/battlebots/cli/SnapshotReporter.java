package org.battlebots.cli;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.battlebots.runtime.World;
import org.battlebots.runtime.model.BotState;
import org.battlebots.runtime.model.Vector2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Headless view of a running world. Reads the published snapshots at a fixed interval and
 * logs a one-line summary.
 * <p>
 * Returns when its run time is over or once the world was asked to stop. A zero run time means
 * no limit.
 */
public class SnapshotReporter implements Callable<Void> {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotReporter.class);

    /**
     * Aggregate over one snapshot list.
     *
     * @param ticks the world's tick count when the snapshots were read.
     * @param bots the number of bots.
     * @param meanPosition the average position, or the origin if there are no bots.
     * @param meanSpeed the average speed.
     */
    public record Summary(long ticks, int bots, Vector2 meanPosition, double meanSpeed) {}

    private final World<BotState> world;
    private final Duration interval;
    private final Duration runTime;

    /**
     * @param world the world to observe.
     * @param interval time between two summaries.
     * @param runTime how long to report before returning, or zero to report until the world stops.
     */
    public SnapshotReporter(World<BotState> world, Duration interval, Duration runTime) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("report-interval must be positive, got " + interval);
        }
        if (runTime.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative, got " + runTime);
        }
        this.world = world;
        this.interval = interval;
        this.runTime = runTime;
    }

    @Override
    public Void call() throws InterruptedException {
        long deadline = runTime.isZero() ? Long.MAX_VALUE : System.nanoTime() + runTime.toNanos();

        while (!world.isStopRequested()) {
            long remaining = deadline == Long.MAX_VALUE ? Long.MAX_VALUE : deadline - System.nanoTime();
            if (remaining <= 0) {
                LOG.info("Run time of {} elapsed", runTime);
                return null;
            }
            TimeUnit.NANOSECONDS.sleep(Math.min(interval.toNanos(), remaining));

            Summary summary = summarize(world.getTicksDone(), world.getSnapshots());
            LOG.info("Tick {}: {} bots, mean position ({}, {}), mean speed {}",
                    summary.ticks(), summary.bots(),
                    String.format("%.2f", summary.meanPosition().x()),
                    String.format("%.2f", summary.meanPosition().y()),
                    String.format("%.2f", summary.meanSpeed()));
        }
        return null;
    }

    /**
     * Computes the summary of a snapshot list.
     *
     * @param ticks the tick count to report.
     * @param snapshots the bots' snapshots.
     * @return the summary.
     */
    public static Summary summarize(long ticks, List<BotState> snapshots) {
        if (snapshots.isEmpty()) {
            return new Summary(ticks, 0, Vector2.ZERO, 0.0);
        }
        Vector2 sum = Vector2.ZERO;
        double speed = 0.0;
        for (BotState state : snapshots) {
            sum = sum.plus(state.getPos());
            speed += state.getSpeed();
        }
        int n = snapshots.size();
        return new Summary(ticks, n, sum.times(1.0 / n), speed / n);
    }
}
