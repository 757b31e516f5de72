package org.battlebots.threading;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CoordinatorTest {

    @Test
    void waitNextIsEmptyWhenNothingWasSpawned() throws Exception {
        Coordinator<Integer> coordinator = new Coordinator<>();

        assertThat(coordinator.waitNext()).isEmpty();
        assertThat(coordinator.waitAll()).isEmpty();
    }

    @Test
    void waitNextReturnsTheValue() throws Exception {
        Coordinator<Integer> coordinator = new Coordinator<>();
        coordinator.spawn("one", () -> 1);

        Optional<Outcome<Integer>> outcome = coordinator.waitNext();

        assertThat(outcome).contains(new Outcome.Success<>(1));
        assertThat(coordinator.activeCount()).isZero();
        assertThat(coordinator.waitNext()).isEmpty();
    }

    @Test
    void thrownErrorsBecomeFailures() throws Exception {
        Coordinator<Integer> coordinator = new Coordinator<>();
        IllegalStateException boom = new IllegalStateException("boom");
        coordinator.spawn("failing", () -> {
            throw boom;
        });

        Outcome<Integer> outcome = coordinator.waitNext().orElseThrow();

        assertThat(outcome.isFailure()).isTrue();
        assertThat(((Outcome.Failure<Integer>) outcome).error()).isSameAs(boom);
        assertThatThrownBy(outcome::getOrThrow)
                .isInstanceOf(CoordinatedFailureException.class)
                .hasCause(boom);
    }

    @Test
    void waitNextReturnsWhicheverEndsFirst() throws Exception {
        Coordinator<String> coordinator = new Coordinator<>();
        CountDownLatch release = new CountDownLatch(1);
        coordinator.spawn("slow", () -> {
            release.await();
            return "slow";
        });
        coordinator.spawn("fast", () -> "fast");

        assertThat(coordinator.waitNext().orElseThrow().getOrThrow()).isEqualTo("fast");
        assertThat(coordinator.activeCount()).isEqualTo(1);

        release.countDown();
        List<Optional<Outcome<String>>> all = coordinator.waitAll();

        assertThat(all).containsExactly(Optional.of(new Outcome.Success<>("slow")), Optional.empty());
    }

    @Test
    void waitAllKeepsSpawnOrder() throws Exception {
        Coordinator<Integer> coordinator = new Coordinator<>();
        CountDownLatch firstMayEnd = new CountDownLatch(1);
        coordinator.spawn("first", () -> {
            firstMayEnd.await(5, TimeUnit.SECONDS);
            return 0;
        });
        coordinator.spawn("second", () -> {
            firstMayEnd.countDown();
            return 1;
        });
        coordinator.spawn("third", () -> 2);

        List<Optional<Outcome<Integer>>> all = coordinator.waitAll();

        assertThat(all).extracting(o -> o.orElseThrow().getOrThrow()).containsExactly(0, 1, 2);
        assertThat(all).hasSize(3);
        assertThat(coordinator.activeCount()).isZero();
    }

    @Test
    void waitAllWithTimeoutLeavesStuckClosuresEmpty() throws Exception {
        Coordinator<Integer> coordinator = new Coordinator<>();
        CountDownLatch never = new CountDownLatch(1);
        coordinator.spawn("stuck", () -> {
            never.await();
            return -1;
        });
        coordinator.spawn("done", () -> 7);

        List<Optional<Outcome<Integer>>> all = coordinator.waitAll(Duration.ofMillis(200));

        assertThat(all).containsExactly(Optional.empty(), Optional.of(new Outcome.Success<>(7)));
        assertThat(coordinator.activeCount()).isEqualTo(1);

        never.countDown();
        assertThat(coordinator.waitAll(Duration.ofSeconds(5)).get(0)).contains(new Outcome.Success<>(-1));
    }

    @Test
    void valueFailureAndStuckClosureAreReportedSeparately() throws Exception {
        Coordinator<Integer> coordinator = new Coordinator<>();
        CountDownLatch never = new CountDownLatch(1);
        coordinator.spawn("value", () -> 1);
        coordinator.spawn("throws", () -> {
            throw new IllegalArgumentException("bad");
        });
        coordinator.spawn("stuck", () -> {
            never.await();
            return -1;
        });

        Outcome<Integer> first = coordinator.waitNext().orElseThrow();
        assertThat(coordinator.activeCount()).isEqualTo(2);

        List<Optional<Outcome<Integer>>> rest = coordinator.waitAll(Duration.ofMillis(300));

        assertThat(rest).hasSize(3);
        assertThat(rest.get(2)).isEmpty();
        Optional<Outcome<Integer>> other = first.isFailure() ? rest.get(0) : rest.get(1);
        Optional<Outcome<Integer>> taken = first.isFailure() ? rest.get(1) : rest.get(0);
        assertThat(taken).isEmpty();
        assertThat(other).isPresent();
        assertThat(other.get().isFailure()).isNotEqualTo(first.isFailure());
        if (first.isFailure()) {
            assertThat(((Outcome.Failure<Integer>) first).error()).hasMessage("bad");
            assertThat(other).contains(new Outcome.Success<>(1));
        } else {
            assertThat(first).isEqualTo(new Outcome.Success<>(1));
            assertThat(((Outcome.Failure<Integer>) other.get()).error()).hasMessage("bad");
        }
        assertThat(coordinator.activeCount()).isEqualTo(1);
        never.countDown();
    }
}
