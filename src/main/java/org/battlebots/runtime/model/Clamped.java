package org.battlebots.runtime.model;

import java.util.OptionalDouble;

/**
 * An inclusive range of allowed values which can be clamped to or checked against.
 * <p>
 * The simulation uses {@link #check(double)} to validate commands coming from a bot
 * (out-of-range values are rejected), while the bot-side SDK uses {@link #clamp(double)}
 * so that a well-behaved bot never sends a value the simulation would reject.
 *
 * @param min the smallest allowed value.
 * @param max the largest allowed value.
 */
public record Clamped(double min, double max) {

    public Clamped {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("Range bounds must not be NaN");
        }
        if (min > max) {
            throw new IllegalArgumentException("Range min " + min + " is greater than max " + max);
        }
    }

    /**
     * Clamps the given value to {@code [min, max]}.
     *
     * @param value the value to clamp.
     * @return {@code min} if below the range, {@code max} if above, otherwise {@code value}.
     */
    public double clamp(double value) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }

    /**
     * Checks if {@code value} lies within {@code [min, max]} (inclusive).
     * NaN is never within range.
     *
     * @param value the value to check.
     * @return the unchanged value if within range, otherwise empty.
     */
    public OptionalDouble check(double value) {
        return contains(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    private boolean contains(double value) {
        return min <= value && value <= max;
    }
}
