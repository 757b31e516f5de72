package org.battlebots.ipc;

import org.battlebots.runtime.model.BotState;

/**
 * One outbound unit on a relay: the bot's state at send time and the message to act on.
 *
 * @param state a copy of the bot's state, owned by the envelope.
 * @param message the message.
 */
public record Envelope(BotState state, Message message) {
}
