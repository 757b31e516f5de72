package org.battlebots.sdk;

import java.util.ArrayList;
import java.util.List;

import org.battlebots.ipc.Response;
import org.battlebots.runtime.config.SimulationConfig;
import org.battlebots.runtime.model.BotState;

/**
 * A bot's view of itself during one callback, and the way it issues commands.
 * <p>
 * Setters clamp their argument to the configured range, update the local state and record the
 * matching {@link Response}. A well-behaved bot therefore never sends a value the simulation
 * would reject.
 */
public class BotHook {

    private final SimulationConfig config;
    private final BotState state;
    private final List<Response> responses = new ArrayList<>();

    /**
     * Creates a hook over a private copy of {@code state}.
     *
     * @param config the simulation configuration.
     * @param state the bot's state as sent by the simulation.
     */
    public BotHook(SimulationConfig config, BotState state) {
        this.config = config;
        this.state = state.copy();
    }

    public SimulationConfig config() {
        return config;
    }

    /**
     * Returns the bot's state, including any changes made through this hook.
     *
     * @return the state.
     */
    public BotState state() {
        return state;
    }

    /**
     * @return the gun's heading relative to the body.
     */
    public double relGunHeading() {
        return state.getGunHeading() - state.getHeading();
    }

    /**
     * @return the radar's heading relative to the body.
     */
    public double relRadarHeading() {
        return state.getRadarHeading() - state.getHeading();
    }

    public void setThrust(double thrust) {
        double clamped = config.thrustLimits().clamp(thrust);
        state.setThrust(clamped);
        responses.add(new Response.SetThrust(clamped));
    }

    public void setTurnRate(double turnRate) {
        double clamped = config.turnRateLimits().clamp(turnRate);
        state.setTurnRate(clamped);
        responses.add(new Response.SetTurnRate(clamped));
    }

    public void setGunTurnRate(double gunTurnRate) {
        double clamped = config.gunTurnRateLimits().clamp(gunTurnRate);
        state.setGunTurnRate(clamped);
        responses.add(new Response.SetGunTurnRate(clamped));
    }

    public void setRadarTurnRate(double radarTurnRate) {
        double clamped = config.radarTurnRateLimits().clamp(radarTurnRate);
        state.setRadarTurnRate(clamped);
        responses.add(new Response.SetRadarTurnRate(clamped));
    }

    /**
     * Shoots a bullet with the given power, clamped to the bullet power limits. Shooting more
     * than once per step is an error on the simulation side. The shot is silently ignored while
     * the bot's shoot power is below {@code power}.
     *
     * @param power the bullet power.
     */
    public void shoot(double power) {
        responses.add(new Response.Shoot(config.bulletPowerLimits().clamp(power)));
    }

    /**
     * Prints a message to the simulation's log.
     *
     * @param message the message.
     */
    public void debugPrint(String message) {
        responses.add(new Response.DebugPrint(message));
    }

    /**
     * @return the commands recorded so far, in order.
     */
    public List<Response> responses() {
        return List.copyOf(responses);
    }
}
