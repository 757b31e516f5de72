package org.battlebots.ctl;

import org.battlebots.runtime.spi.ControllerException;

/**
 * A bot misbehaved or its connection broke. The bot is not restarted.
 */
public class BotControllerException extends ControllerException {

    public enum Reason {
        /** The relay pump died; the cause holds its error. */
        PROCESS,
        /** The bot had not answered the previous message when the next step was due. */
        SLOW_RESPONSE,
        BAD_THRUST,
        BAD_TURN_RATE,
        BAD_GUN_TURN_RATE,
        BAD_RADAR_TURN_RATE,
        BAD_BULLET_POWER,
        /** More than one shot within a single step. */
        TOO_MANY_BULLETS
    }

    private final int botId;
    private final Reason reason;
    private final double value;

    private BotControllerException(int botId, Reason reason, double value, String message, Throwable cause) {
        super(message, cause);
        this.botId = botId;
        this.reason = reason;
        this.value = value;
    }

    /**
     * The bot's relay pump failed.
     *
     * @param botId the bot.
     * @param cause the pump's recorded failure.
     * @return the exception.
     */
    public static BotControllerException process(int botId, Throwable cause) {
        return new BotControllerException(botId, Reason.PROCESS, Double.NaN,
                "Bot " + botId + " connection failed: " + cause.getMessage(), cause);
    }

    /**
     * The bot did not answer within one step.
     *
     * @param botId the bot.
     * @return the exception.
     */
    public static BotControllerException slowResponse(int botId) {
        return new BotControllerException(botId, Reason.SLOW_RESPONSE, Double.NaN,
                "Bot " + botId + " did not respond in time", null);
    }

    /**
     * The bot sent a value outside its configured range, or shot too often.
     *
     * @param botId the bot.
     * @param reason one of the value-carrying reasons.
     * @param value the offending value.
     * @return the exception.
     */
    public static BotControllerException rejected(int botId, Reason reason, double value) {
        return new BotControllerException(botId, reason, value,
                "Bot " + botId + " sent a rejected command: " + reason + " (" + value + ")", null);
    }

    public int getBotId() {
        return botId;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the offending value.
     *
     * @return the rejected value, or NaN for {@link Reason#PROCESS} and {@link Reason#SLOW_RESPONSE}.
     */
    public double getValue() {
        return value;
    }
}
