package org.battlebots.threading;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs closures on their own threads and collects how each of them ended.
 * <p>
 * Nothing a closure throws escapes its thread: the value or the throwable is posted to a
 * completion queue as an {@link Outcome}. Callers wait for the first completion with
 * {@link #waitNext()} or for all of them with {@link #waitAll()}. Threads are daemons, so a
 * closure that never returns does not keep the JVM alive.
 * <p>
 * A coordinator is used by one thread at a time. It may be handed to another thread after the
 * last {@link #spawn(String, Callable)}.
 *
 * @param <T> the closures' result type.
 */
public class Coordinator<T> {

    private static final Logger LOG = LoggerFactory.getLogger(Coordinator.class);

    private record Completion<V>(int index, Outcome<V> outcome) {}

    private final BlockingQueue<Completion<T>> completions = new LinkedBlockingQueue<>();
    private int spawned;
    private int active;

    /**
     * Starts {@code task} on a new daemon thread.
     *
     * @param name the thread name.
     * @param task the closure to run.
     */
    public void spawn(String name, Callable<T> task) {
        int index = spawned;
        Thread thread = new Thread(() -> {
            Outcome<T> outcome;
            try {
                outcome = new Outcome.Success<>(task.call());
            } catch (Throwable t) {
                LOG.debug("Coordinated thread '{}' failed", name, t);
                outcome = new Outcome.Failure<>(t);
            }
            completions.add(new Completion<>(index, outcome));
        }, name);
        thread.setDaemon(true);

        spawned++;
        active++;
        thread.start();
    }

    /**
     * Waits for any one active closure to end. Other closures keep running.
     *
     * @return the outcome, or empty at once if no closure is active.
     * @throws InterruptedException if interrupted while waiting.
     */
    public Optional<Outcome<T>> waitNext() throws InterruptedException {
        if (active == 0) {
            return Optional.empty();
        }
        Completion<T> completion = completions.take();
        active--;
        return Optional.of(completion.outcome());
    }

    /**
     * Waits for every active closure to end.
     *
     * @return one entry per spawned closure, in spawn order. Entries already taken by
     *         {@link #waitNext()} are empty.
     * @throws InterruptedException if interrupted while waiting.
     */
    public List<Optional<Outcome<T>>> waitAll() throws InterruptedException {
        List<Optional<Outcome<T>>> outcomes = emptyOutcomes();
        while (active > 0) {
            collect(outcomes, completions.take());
        }
        return outcomes;
    }

    /**
     * Waits for every active closure to end, but no longer than {@code timeout}.
     *
     * @param timeout the maximum total time to wait.
     * @return one entry per spawned closure, in spawn order. Closures that did not end in time,
     *         and those already taken by {@link #waitNext()}, are empty.
     * @throws InterruptedException if interrupted while waiting.
     */
    public List<Optional<Outcome<T>>> waitAll(Duration timeout) throws InterruptedException {
        List<Optional<Outcome<T>>> outcomes = emptyOutcomes();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (active > 0) {
            long remaining = deadline - System.nanoTime();
            Completion<T> completion = remaining > 0 ? completions.poll(remaining, TimeUnit.NANOSECONDS) : null;
            if (completion == null) {
                LOG.debug("{} coordinated thread(s) still running after {}", active, timeout);
                break;
            }
            collect(outcomes, completion);
        }
        return outcomes;
    }

    /**
     * @return the number of closures whose outcome has not been taken yet.
     */
    public int activeCount() {
        return active;
    }

    private List<Optional<Outcome<T>>> emptyOutcomes() {
        return new ArrayList<>(Collections.nCopies(spawned, Optional.<Outcome<T>>empty()));
    }

    private void collect(List<Optional<Outcome<T>>> outcomes, Completion<T> completion) {
        outcomes.set(completion.index(), Optional.of(completion.outcome()));
        active--;
    }
}
