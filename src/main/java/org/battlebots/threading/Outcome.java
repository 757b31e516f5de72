package org.battlebots.threading;

/**
 * How a supervised closure ended: with a value, or with anything it threw.
 *
 * @param <T> the closure's result type.
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    record Success<T>(T value) implements Outcome<T> {}

    record Failure<T>(Throwable error) implements Outcome<T> {}

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * Returns the value, or escalates the failure.
     *
     * @return the closure's value.
     * @throws CoordinatedFailureException if the closure failed; the original throwable is the cause.
     */
    default T getOrThrow() {
        if (this instanceof Failure<T> failure) {
            throw new CoordinatedFailureException(failure.error());
        }
        return ((Success<T>) this).value();
    }
}
