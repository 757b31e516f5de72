package org.battlebots.runtime.model;

import java.util.Objects;

/**
 * The physical state of a single bot.
 * <p>
 * All angles are in radians, measured anticlockwise with 0 pointing along the positive X axis.
 * Instances are mutable and owned by exactly one controller; everything handed to other
 * threads (the world's snapshot list, the relay towards the bot's logic) is a {@link #copy()}.
 */
public class BotState {

    /** Position, with the origin in the lower left. */
    private Vector2 pos = Vector2.ZERO;

    /** Absolute direction the body is facing. */
    private double heading;

    /** Absolute direction the gun is facing. */
    private double gunHeading;

    /** Absolute direction the radar is facing. */
    private double radarHeading;

    /** Velocity in units per second along {@link #heading}. */
    private double speed;

    /** Acceleration in units per second squared. */
    private double thrust;

    /** Rotation rate of the body. */
    private double turnRate;

    /** Rotation rate of the gun, relative to the body. */
    private double gunTurnRate;

    /** Rotation rate of the radar, relative to the body. */
    private double radarTurnRate;

    /** When this reaches zero the bot dies. */
    private double hitPoints;

    /** Shooting consumes shoot power, which regenerates over time. */
    private double shootPower;

    public BotState() {
    }

    /**
     * Creates a resting bot at the given position.
     *
     * @param pos the initial position.
     * @param hitPoints the initial hit points.
     */
    public BotState(Vector2 pos, double hitPoints) {
        this.pos = Objects.requireNonNull(pos, "pos");
        this.hitPoints = hitPoints;
    }

    /**
     * Returns an independent copy of this state.
     *
     * @return a new {@code BotState} with identical field values.
     */
    public BotState copy() {
        BotState copy = new BotState();
        copy.pos = pos;
        copy.heading = heading;
        copy.gunHeading = gunHeading;
        copy.radarHeading = radarHeading;
        copy.speed = speed;
        copy.thrust = thrust;
        copy.turnRate = turnRate;
        copy.gunTurnRate = gunTurnRate;
        copy.radarTurnRate = radarTurnRate;
        copy.hitPoints = hitPoints;
        copy.shootPower = shootPower;
        return copy;
    }

    public Vector2 getPos() { return pos; }
    public void setPos(Vector2 pos) { this.pos = Objects.requireNonNull(pos, "pos"); }

    public double getHeading() { return heading; }
    public void setHeading(double heading) { this.heading = heading; }

    public double getGunHeading() { return gunHeading; }
    public void setGunHeading(double gunHeading) { this.gunHeading = gunHeading; }

    public double getRadarHeading() { return radarHeading; }
    public void setRadarHeading(double radarHeading) { this.radarHeading = radarHeading; }

    public double getSpeed() { return speed; }
    public void setSpeed(double speed) { this.speed = speed; }

    public double getThrust() { return thrust; }
    public void setThrust(double thrust) { this.thrust = thrust; }

    public double getTurnRate() { return turnRate; }
    public void setTurnRate(double turnRate) { this.turnRate = turnRate; }

    public double getGunTurnRate() { return gunTurnRate; }
    public void setGunTurnRate(double gunTurnRate) { this.gunTurnRate = gunTurnRate; }

    public double getRadarTurnRate() { return radarTurnRate; }
    public void setRadarTurnRate(double radarTurnRate) { this.radarTurnRate = radarTurnRate; }

    public double getHitPoints() { return hitPoints; }
    public void setHitPoints(double hitPoints) { this.hitPoints = hitPoints; }

    public double getShootPower() { return shootPower; }
    public void setShootPower(double shootPower) { this.shootPower = shootPower; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BotState other)) return false;
        return Double.compare(heading, other.heading) == 0
                && Double.compare(gunHeading, other.gunHeading) == 0
                && Double.compare(radarHeading, other.radarHeading) == 0
                && Double.compare(speed, other.speed) == 0
                && Double.compare(thrust, other.thrust) == 0
                && Double.compare(turnRate, other.turnRate) == 0
                && Double.compare(gunTurnRate, other.gunTurnRate) == 0
                && Double.compare(radarTurnRate, other.radarTurnRate) == 0
                && Double.compare(hitPoints, other.hitPoints) == 0
                && Double.compare(shootPower, other.shootPower) == 0
                && pos.equals(other.pos);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pos, heading, gunHeading, radarHeading, speed, thrust,
                turnRate, gunTurnRate, radarTurnRate, hitPoints, shootPower);
    }

    @Override
    public String toString() {
        return String.format("BotState{pos=(%.3f, %.3f), heading=%.3f, speed=%.3f, thrust=%.3f, turnRate=%.3f, hp=%.1f, shootPower=%.2f}",
                pos.x(), pos.y(), heading, speed, thrust, turnRate, hitPoints, shootPower);
    }
}
