package org.battlebots.runtime.model;

/**
 * An immutable two-dimensional vector with {@code double} components.
 *
 * @param x the horizontal component.
 * @param y the vertical component.
 */
public record Vector2(double x, double y) {

    /** The zero vector. */
    public static final Vector2 ZERO = new Vector2(0.0, 0.0);

    /**
     * Returns the unit vector pointing along the given angle, measured anticlockwise
     * from the positive X axis.
     *
     * @param radians the angle in radians.
     * @return the unit vector for that angle.
     */
    public static Vector2 fromAngle(double radians) {
        return new Vector2(Math.cos(radians), Math.sin(radians));
    }

    public Vector2 plus(Vector2 other) {
        return new Vector2(x + other.x, y + other.y);
    }

    public Vector2 times(double scalar) {
        return new Vector2(x * scalar, y * scalar);
    }
}
