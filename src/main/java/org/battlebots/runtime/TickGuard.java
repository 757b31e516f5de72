package org.battlebots.runtime;

import java.util.concurrent.locks.Lock;

/**
 * Token for one admitted tick, returned by {@link TickLock#take()}.
 * <p>
 * Closing the guard ends the tick for its owner: it first releases the read lock on the
 * running flag and then waits on the end barrier. The order matters, since a world blocked in
 * {@link #stop()} must not wait on a party that is merely finishing its tick.
 * <p>
 * A guard belongs to the thread that acquired it and must be closed by that thread.
 */
public final class TickGuard implements AutoCloseable {

    private final TickLock tickLock;
    private Lock readLock;
    private boolean closed;

    TickGuard(TickLock tickLock, Lock readLock) {
        this.tickLock = tickLock;
        this.readLock = readLock;
    }

    /**
     * Stops the world. Only the world may call this.
     * <p>
     * Releases this guard's read lock, then blocks until every other party has finished its
     * current tick segment and clears the running flag. The guard must still be closed
     * afterwards so that all parties cross the end barrier of this tick; every later
     * {@link TickLock#take()} returns empty.
     */
    public void stop() {
        releaseReadLock();
        tickLock.markStopped();
    }

    /**
     * Releases the read lock if still held, then waits for every party at the end barrier.
     * Calling this more than once has no further effect.
     *
     * @throws InterruptedException if interrupted while waiting on the end barrier.
     */
    @Override
    public void close() throws InterruptedException {
        if (closed) {
            return;
        }
        closed = true;
        releaseReadLock();
        tickLock.awaitEnd();
    }

    private void releaseReadLock() {
        if (readLock != null) {
            readLock.unlock();
            readLock = null;
        }
    }
}
