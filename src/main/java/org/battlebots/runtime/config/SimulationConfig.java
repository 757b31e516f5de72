package org.battlebots.runtime.config;

import java.time.Duration;

import org.battlebots.runtime.model.Clamped;
import org.battlebots.runtime.model.Vector2;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable simulation parameters shared by the world and every bot.
 * <p>
 * The same value is sent to each external bot in its {@code Init} message, so every field
 * here is part of the wire format.
 *
 * @param worldSize            the size of the world.
 * @param ticksPerSecond       the simulation frame rate (not necessarily the rendering rate).
 * @param ticksPerStep         the number of ticks between two steps of a bot's logic.
 * @param driveFriction        multiplicative friction applied to a bot's speed every tick.
 * @param thrustLimits         allowed thrust values.
 * @param turnRateLimits       allowed body turn rates.
 * @param gunTurnRateLimits    allowed gun turn rates.
 * @param radarTurnRateLimits  allowed radar turn rates.
 * @param bulletPowerLimits    allowed bullet powers.
 * @param maxShootPower        upper bound of a bot's stored shoot power.
 * @param shootPowerRegen      shoot power regained per second.
 * @param initialHitPoints     hit points of a freshly spawned bot.
 */
public record SimulationConfig(
        Vector2 worldSize,
        int ticksPerSecond,
        int ticksPerStep,
        double driveFriction,
        Clamped thrustLimits,
        Clamped turnRateLimits,
        Clamped gunTurnRateLimits,
        Clamped radarTurnRateLimits,
        Clamped bulletPowerLimits,
        double maxShootPower,
        double shootPowerRegen,
        double initialHitPoints) {

    /** Configuration path of the simulation section. */
    public static final String CONFIG_PATH = "battlebots";

    public SimulationConfig {
        if (worldSize == null || worldSize.x() <= 0 || worldSize.y() <= 0) {
            throw new IllegalArgumentException("world-size must be positive in both dimensions, got " + worldSize);
        }
        if (ticksPerSecond <= 0) {
            throw new IllegalArgumentException("ticks-per-second must be > 0, got " + ticksPerSecond);
        }
        if (ticksPerStep <= 0) {
            throw new IllegalArgumentException("ticks-per-step must be > 0, got " + ticksPerStep);
        }
        if (driveFriction < 0.0 || driveFriction > 1.0) {
            throw new IllegalArgumentException("drive-friction must be within [0, 1], got " + driveFriction);
        }
        if (thrustLimits == null || turnRateLimits == null || gunTurnRateLimits == null
                || radarTurnRateLimits == null || bulletPowerLimits == null) {
            throw new IllegalArgumentException("All limit ranges must be configured");
        }
        if (maxShootPower < 0.0 || shootPowerRegen < 0.0) {
            throw new IllegalArgumentException("max-shoot-power and shoot-power-regen must be >= 0");
        }
    }

    /**
     * Returns the defaults from {@code reference.conf}.
     *
     * @return the default simulation configuration.
     */
    public static SimulationConfig defaults() {
        return fromConfig(ConfigFactory.defaultReference().getConfig(CONFIG_PATH));
    }

    /**
     * Builds a configuration from the {@code battlebots} section of a HOCON document.
     * Missing keys fall back to {@code reference.conf}.
     *
     * @param section the {@code battlebots} configuration section.
     * @return the validated simulation configuration.
     * @throws IllegalArgumentException if a value is missing, has the wrong type or is out of range.
     */
    public static SimulationConfig fromConfig(Config section) {
        Config finalConfig = section.withFallback(ConfigFactory.defaultReference().getConfig(CONFIG_PATH));
        try {
            return new SimulationConfig(
                    new Vector2(finalConfig.getDouble("world-size.x"), finalConfig.getDouble("world-size.y")),
                    finalConfig.getInt("ticks-per-second"),
                    finalConfig.getInt("ticks-per-step"),
                    finalConfig.getDouble("drive-friction"),
                    range(finalConfig, "thrust-limits"),
                    range(finalConfig, "turn-rate-limits"),
                    range(finalConfig, "gun-turn-rate-limits"),
                    range(finalConfig, "radar-turn-rate-limits"),
                    range(finalConfig, "bullet-power-limits"),
                    finalConfig.getDouble("max-shoot-power"),
                    finalConfig.getDouble("shoot-power-regen"),
                    finalConfig.getDouble("initial-hit-points"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid simulation configuration: " + e.getMessage(), e);
        }
    }

    private static Clamped range(Config config, String path) {
        return new Clamped(config.getDouble(path + ".min"), config.getDouble(path + ".max"));
    }

    /**
     * Calculates the length of one tick from {@link #ticksPerSecond()}.
     *
     * @return the tick duration.
     */
    public Duration tickDuration() {
        return Duration.ofNanos(1_000_000_000L / ticksPerSecond);
    }
}
