package org.battlebots.runtime;

import java.util.Optional;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A reusable double barrier that keeps {@code N} bots and one world in lockstep.
 * <p>
 * Every tick is bounded by two barrier crossings: all {@code N + 1} parties wait on the
 * <em>start</em> barrier in {@link #take()}, do their work for the tick, and then wait on the
 * <em>end</em> barrier when they close the returned {@link TickGuard}. Nothing that happens
 * between the end of one tick and the start of the next can observe a party mid-tick.
 * <p>
 * <b>Stop protocol:</b> a {@code running} flag guarded by a read/write lock lets the world halt
 * all future ticks without deadlocking a bot mid-tick. Each party holds the read lock from the
 * moment it enters {@link #take()} until its guard releases it, right before the end barrier.
 * {@link TickGuard#stop()} takes the write lock, which is only granted once every other party
 * has finished its tick segment, flips the flag, and from then on {@link #take()} returns
 * empty for every caller without touching the barriers.
 * <p>
 * <b>Thread safety:</b> each party must use its own thread, call {@link #take()} at most once
 * per tick and close the guard on the same thread before calling {@link #take()} again.
 * Mismatched party counts are a programming error and are not detected.
 */
public class TickLock {

    private final CyclicBarrier startBarrier;
    private final CyclicBarrier endBarrier;
    private final ReentrantReadWriteLock runningLock = new ReentrantReadWriteLock();
    private boolean running = true;

    /**
     * Creates a tick lock for the given number of bots. The world is the extra party.
     *
     * @param partyCount the number of bots, {@code >= 0}.
     * @throws IllegalArgumentException if {@code partyCount < 0}.
     */
    public TickLock(int partyCount) {
        if (partyCount < 0) {
            throw new IllegalArgumentException("Party count must be >= 0, got " + partyCount);
        }
        this.startBarrier = new CyclicBarrier(partyCount + 1);
        this.endBarrier = new CyclicBarrier(partyCount + 1);
    }

    /**
     * Waits until every party is ready to start the next tick.
     * <p>
     * If the world has been stopped this returns empty immediately, without waiting on the
     * barrier, so parties that already left never block a late caller.
     *
     * @return a guard for the current tick, or empty once the world has stopped.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     * @throws IllegalStateException if the barrier was broken by another party's interruption.
     */
    public Optional<TickGuard> take() throws InterruptedException {
        Lock readLock = runningLock.readLock();
        readLock.lock();
        boolean admitted = false;
        try {
            if (!running) {
                return Optional.empty();
            }
            await(startBarrier);
            admitted = true;
            return Optional.of(new TickGuard(this, readLock));
        } finally {
            if (!admitted) {
                readLock.unlock();
            }
        }
    }

    /**
     * Returns whether ticks are still being admitted.
     *
     * @return {@code false} once a guard has stopped the world.
     */
    public boolean isRunning() {
        Lock readLock = runningLock.readLock();
        readLock.lock();
        try {
            return running;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Blocks until every other party released its read lock, then clears the running flag.
     * The caller must not hold the read lock itself.
     */
    void markStopped() {
        Lock writeLock = runningLock.writeLock();
        writeLock.lock();
        try {
            running = false;
        } finally {
            writeLock.unlock();
        }
    }

    void awaitEnd() throws InterruptedException {
        await(endBarrier);
    }

    private static void await(CyclicBarrier barrier) throws InterruptedException {
        try {
            barrier.await();
        } catch (BrokenBarrierException e) {
            throw new IllegalStateException("Tick barrier broken: another party was interrupted", e);
        }
    }
}
