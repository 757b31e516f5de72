package org.battlebots.sdk;

import org.battlebots.runtime.model.Vector2;

/**
 * The decision-making code of a bot, as written by a bot author.
 * <p>
 * Every callback receives a {@link BotHook} carrying the bot's state at the time the simulation
 * sent the message. Commands issued through the hook are sent back once the callback returns.
 * All callbacks default to doing nothing.
 */
public interface IBotLogic {

    /**
     * Called once, before the first step.
     *
     * @param hook the bot's hook.
     */
    default void init(BotHook hook) {
    }

    /**
     * Called every few ticks, as configured by {@code ticks-per-step}.
     *
     * @param hook the bot's hook.
     * @param elapsed seconds since the previous step, or since initialisation for the first one.
     */
    default void step(BotHook hook, double elapsed) {
    }

    /**
     * Called when an enemy bot is scanned.
     *
     * @param hook the bot's hook.
     * @param scanPos where the enemy was seen.
     */
    default void scan(BotHook hook, Vector2 scanPos) {
    }

    /**
     * Called when the bot dies or the simulation ends. Commands issued here are discarded.
     *
     * @param hook the bot's hook.
     */
    default void kill(BotHook hook) {
    }
}
