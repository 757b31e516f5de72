package org.battlebots.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLongArray;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@Tag("unit")
class TickLockTest {

    private final List<Thread> threads = new ArrayList<>();
    private final ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

    @AfterEach
    void tearDown() throws InterruptedException {
        for (Thread thread : threads) {
            thread.interrupt();
            thread.join(1000);
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 5, 16})
    void everyPartyCompletesExactlyTheTicksBeforeTheStop(int parties) throws InterruptedException {
        int stopTick = 10;
        TickLock tickLock = new TickLock(parties);
        AtomicLongArray ticks = new AtomicLongArray(Math.max(parties, 1));

        for (int i = 0; i < parties; i++) {
            int index = i;
            start(() -> {
                Optional<TickGuard> guard;
                while ((guard = tickLock.take()).isPresent()) {
                    try (TickGuard ignored = guard.get()) {
                        ticks.incrementAndGet(index);
                    }
                }
            });
        }

        int worldTicks = 0;
        Optional<TickGuard> guard;
        while ((guard = tickLock.take()).isPresent()) {
            try (TickGuard g = guard.get()) {
                worldTicks++;
                if (worldTicks == stopTick) {
                    g.stop();
                }
            }
        }

        joinAll();
        assertThat(errors).isEmpty();
        assertThat(worldTicks).isEqualTo(stopTick);
        assertThat(tickLock.isRunning()).isFalse();
        for (int i = 0; i < parties; i++) {
            assertThat(ticks.get(i)).as("ticks of party %d", i).isEqualTo(stopTick);
        }
    }

    @Test
    void noPartyStartsTickKPlusOneBeforeAllFinishedTickK() throws InterruptedException {
        int parties = 4;
        int stopTick = 50;
        TickLock tickLock = new TickLock(parties);
        AtomicInteger inTick = new AtomicInteger();
        AtomicInteger finishedInCurrentTick = new AtomicInteger();
        AtomicInteger violations = new AtomicInteger();

        for (int i = 0; i < parties; i++) {
            start(() -> {
                Optional<TickGuard> guard;
                while ((guard = tickLock.take()).isPresent()) {
                    try (TickGuard ignored = guard.get()) {
                        inTick.incrementAndGet();
                        finishedInCurrentTick.incrementAndGet();
                    }
                }
            });
        }

        for (int tick = 1; tick <= stopTick; tick++) {
            TickGuard guard = tickLock.take().orElseThrow();
            if (tick == stopTick) {
                guard.stop();
                // after stop() every party has released its read lock, i.e. finished its segment
                if (finishedInCurrentTick.get() != parties) {
                    violations.incrementAndGet();
                }
            }
            guard.close();
            finishedInCurrentTick.set(0);
        }

        joinAll();
        assertThat(errors).isEmpty();
        assertThat(violations.get()).isZero();
        assertThat(inTick.get()).isEqualTo(parties * stopTick);
    }

    @Test
    void takeAfterStopReturnsEmptyWithoutBlocking() throws InterruptedException {
        TickLock tickLock = new TickLock(0);

        TickGuard guard = tickLock.take().orElseThrow();
        guard.stop();
        guard.close();

        assertThat(tickLock.take()).isEmpty();
        assertThat(tickLock.take()).isEmpty();
    }

    @Test
    void closeIsIdempotent() throws InterruptedException {
        TickLock tickLock = new TickLock(0);

        TickGuard guard = tickLock.take().orElseThrow();
        guard.close();
        guard.close();

        assertThat(tickLock.isRunning()).isTrue();
    }

    @Test
    void worldBlocksUntilAllPartiesArrive() {
        TickLock tickLock = new TickLock(1);
        AtomicInteger worldTicks = new AtomicInteger();

        start(() -> {
            TickGuard guard = tickLock.take().orElseThrow();
            worldTicks.incrementAndGet();
            guard.stop();
            guard.close();
        });

        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1))
                .untilAsserted(() -> assertThat(worldTicks.get()).isZero());

        start(() -> {
            Optional<TickGuard> guard = tickLock.take();
            guard.orElseThrow().close();
        });

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            assertThat(worldTicks.get()).isEqualTo(1);
            assertThat(tickLock.isRunning()).isFalse();
        });
        assertThat(errors).isEmpty();
    }

    @Test
    void rejectsNegativePartyCount() {
        assertThatThrownBy(() -> new TickLock(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void start(InterruptibleRunnable body) {
        Thread thread = new Thread(() -> {
            try {
                body.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Throwable t) {
                errors.add(t);
            }
        }, "tick-lock-test-" + threads.size());
        thread.setDaemon(true);
        threads.add(thread);
        thread.start();
    }

    private void joinAll() throws InterruptedException {
        for (Thread thread : threads) {
            thread.join(5000);
            assertThat(thread.isAlive()).as("%s still alive", thread.getName()).isFalse();
        }
    }

    @FunctionalInterface
    private interface InterruptibleRunnable {
        void run() throws Exception;
    }
}
