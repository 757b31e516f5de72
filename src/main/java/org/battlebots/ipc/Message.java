package org.battlebots.ipc;

import org.battlebots.runtime.config.SimulationConfig;
import org.battlebots.runtime.model.Vector2;

/**
 * A message sent from the simulation to a bot's logic.
 * Every message is answered by exactly one (possibly empty) list of {@link Response}s.
 */
public sealed interface Message permits Message.Init, Message.Step, Message.Scan, Message.Kill {

    /**
     * Sent once, before the first step.
     *
     * @param config the simulation configuration.
     */
    record Init(SimulationConfig config) implements Message {}

    /**
     * Sent every {@code ticksPerStep} ticks.
     *
     * @param elapsed seconds since the previous step, or since initialisation for the first one.
     */
    record Step(double elapsed) implements Message {}

    /**
     * Sent when an enemy bot is scanned.
     *
     * @param scanPos where the enemy was seen.
     */
    record Scan(Vector2 scanPos) implements Message {}

    /** Sent when the bot dies or the simulation ends. The last message a bot receives. */
    record Kill() implements Message {}
}
