package org.battlebots.ipc;

/**
 * A command sent back by a bot's logic. Values are validated by the controller, never clamped.
 */
public sealed interface Response permits Response.SetThrust, Response.SetTurnRate,
        Response.SetGunTurnRate, Response.SetRadarTurnRate, Response.Shoot, Response.DebugPrint {

    record SetThrust(double value) implements Response {}

    record SetTurnRate(double value) implements Response {}

    /** Gun turn rate relative to the body. */
    record SetGunTurnRate(double value) implements Response {}

    /** Radar turn rate relative to the body. */
    record SetRadarTurnRate(double value) implements Response {}

    /** At most one shot per step; ignored while the bot's shoot power is below {@code power}. */
    record Shoot(double power) implements Response {}

    record DebugPrint(String message) implements Response {}
}
