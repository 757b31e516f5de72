package org.battlebots.ctl;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.TimeUnit;

import org.battlebots.ipc.Message;
import org.battlebots.ipc.ProcessPump;
import org.battlebots.ipc.Relay;
import org.battlebots.ipc.Response;
import org.battlebots.ipc.WireCodec;
import org.battlebots.runtime.config.SimulationConfig;
import org.battlebots.runtime.model.BotState;
import org.battlebots.runtime.model.Clamped;
import org.battlebots.runtime.model.Vector2;
import org.battlebots.runtime.spi.IRoboController;
import org.battlebots.sdk.BotSession;
import org.battlebots.sdk.IBotLogic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controls one bot whose logic runs elsewhere, behind a {@link Relay}.
 * <p>
 * Every {@code ticksPerStep} ticks the controller expects the answer to its previous message,
 * validates and applies it, and sends the next {@code Step}. A bot that has not answered by then
 * fails with {@link BotControllerException.Reason#SLOW_RESPONSE}. Physics is integrated every tick
 * using the wall-clock time the tick took.
 * <p>
 * Commands are validated against the configured ranges and rejected rather than clamped; the
 * first rejected command fails the tick and leaves the remaining commands of that batch unapplied.
 */
public class BotController implements IRoboController<BotState> {

    private static final Logger LOG = LoggerFactory.getLogger(BotController.class);

    private static final long STARTUP_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final int id;
    private final SimulationConfig config;
    private final Relay relay;
    private final BotState state;

    private Duration startupTimeout = Duration.ZERO;
    private int ticksUntilStep;
    private double secondsSinceStep;

    /**
     * Creates a controller over an existing relay. Whoever answers the relay must already be running.
     *
     * @param id the bot id, used in logs and errors.
     * @param initialPos the starting position.
     * @param config the simulation configuration.
     * @param relay the relay to the bot's logic.
     */
    public BotController(int id, Vector2 initialPos, SimulationConfig config, Relay relay) {
        this.id = id;
        this.config = config;
        this.relay = relay;
        this.state = new BotState(initialPos, config.initialHitPoints());
        this.ticksUntilStep = config.ticksPerStep();
    }

    /**
     * Creates a controller for a bot running as an external process and starts its relay pump.
     *
     * @param id the bot id.
     * @param initialPos the starting position.
     * @param config the simulation configuration.
     * @param toBot the process's standard input.
     * @param fromBot the process's standard output.
     * @return the controller.
     */
    public static BotController forProcess(int id, Vector2 initialPos, SimulationConfig config,
                                           OutputStream toBot, InputStream fromBot) {
        Relay relay = new Relay();
        new ProcessPump("bot-" + id + "-relay", relay,
                new BufferedWriter(new OutputStreamWriter(toBot, StandardCharsets.UTF_8)),
                new BufferedReader(new InputStreamReader(fromBot, StandardCharsets.UTF_8)),
                new WireCodec()).start();
        return new BotController(id, initialPos, config, relay);
    }

    /**
     * Creates a controller for a bot whose logic runs in this JVM on its own actor thread.
     *
     * @param id the bot id.
     * @param initialPos the starting position.
     * @param config the simulation configuration.
     * @param logic the bot's logic.
     * @return the controller.
     */
    public static BotController forActor(int id, Vector2 initialPos, SimulationConfig config, IBotLogic logic) {
        Relay relay = new Relay();
        new ActorPump("bot-" + id + "-actor", relay, new BotSession(logic, config)).start();
        return new BotController(id, initialPos, config, relay);
    }

    /**
     * Makes {@link #init()} wait up to {@code timeout} for the answer to {@code Init}. A bot that
     * needs longer to start than one step, such as a freshly started JVM, would otherwise fail
     * with {@link BotControllerException.Reason#SLOW_RESPONSE} on its first step.
     *
     * @param timeout the maximum time to wait; zero sends {@code Init} without waiting.
     */
    public void setStartupTimeout(Duration timeout) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("startup-timeout must not be negative, got " + timeout);
        }
        this.startupTimeout = timeout;
    }

    @Override
    public void init() throws BotControllerException {
        secondsSinceStep = 0.0;
        relay.send(state, new Message.Init(config));
        if (startupTimeout.isZero()) {
            return;
        }

        long deadline = System.nanoTime() + startupTimeout.toNanos();
        try {
            while (!relay.awaitInbound(Math.min(STARTUP_POLL_NANOS, deadline - System.nanoTime()),
                    TimeUnit.NANOSECONDS)) {
                Optional<Throwable> failure = relay.failure();
                if (failure.isPresent()) {
                    throw BotControllerException.process(id, failure.get());
                }
                if (System.nanoTime() - deadline >= 0) {
                    throw BotControllerException.slowResponse(id);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw BotControllerException.process(id, e);
        }
        LOG.debug("Bot {} answered Init", id);
    }

    @Override
    public void tick(Duration elapsed) throws BotControllerException {
        double dt = elapsed.toNanos() / 1_000_000_000.0;
        secondsSinceStep += dt;

        ticksUntilStep--;
        if (ticksUntilStep <= 0) {
            ticksUntilStep = config.ticksPerStep();

            Optional<List<Response>> responses = relay.tryReceive();
            if (responses.isEmpty()) {
                Optional<Throwable> failure = relay.failure();
                if (failure.isPresent()) {
                    throw BotControllerException.process(id, failure.get());
                }
                throw BotControllerException.slowResponse(id);
            }

            boolean shot = false;
            for (Response response : responses.get()) {
                shot = apply(response, shot);
            }

            relay.send(state, new Message.Step(secondsSinceStep));
            secondsSinceStep = 0.0;
        }

        integrate(dt);
    }

    @Override
    public void kill() {
        relay.send(state, new Message.Kill());
        LOG.debug("Bot {} killed", id);
    }

    @Override
    public BotState publicData() {
        return state.copy();
    }

    public int getId() {
        return id;
    }

    /**
     * Applies one command.
     *
     * @param response the command.
     * @param alreadyShot whether this step's batch already contained a shot.
     * @return whether the batch contains a shot after this command.
     */
    private boolean apply(Response response, boolean alreadyShot) throws BotControllerException {
        if (response instanceof Response.SetThrust r) {
            state.setThrust(checked(config.thrustLimits(), r.value(), BotControllerException.Reason.BAD_THRUST));
        } else if (response instanceof Response.SetTurnRate r) {
            state.setTurnRate(checked(config.turnRateLimits(), r.value(), BotControllerException.Reason.BAD_TURN_RATE));
        } else if (response instanceof Response.SetGunTurnRate r) {
            state.setGunTurnRate(checked(config.gunTurnRateLimits(), r.value(),
                    BotControllerException.Reason.BAD_GUN_TURN_RATE));
        } else if (response instanceof Response.SetRadarTurnRate r) {
            state.setRadarTurnRate(checked(config.radarTurnRateLimits(), r.value(),
                    BotControllerException.Reason.BAD_RADAR_TURN_RATE));
        } else if (response instanceof Response.Shoot r) {
            double power = checked(config.bulletPowerLimits(), r.power(), BotControllerException.Reason.BAD_BULLET_POWER);
            if (alreadyShot) {
                throw BotControllerException.rejected(id, BotControllerException.Reason.TOO_MANY_BULLETS, power);
            }
            if (state.getShootPower() >= power) {
                state.setShootPower(state.getShootPower() - power);
                LOG.debug("Bot {} fired with power {}", id, power);
            }
            return true;
        } else if (response instanceof Response.DebugPrint r) {
            LOG.info("Bot {}: {}", id, r.message());
        }
        return alreadyShot;
    }

    private double checked(Clamped limits, double value, BotControllerException.Reason reason)
            throws BotControllerException {
        OptionalDouble accepted = limits.check(value);
        if (accepted.isEmpty()) {
            throw BotControllerException.rejected(id, reason, value);
        }
        return accepted.getAsDouble();
    }

    private void integrate(double dt) {
        double turnRate = state.getTurnRate();
        state.setHeading(state.getHeading() + turnRate * dt);
        state.setGunHeading(state.getGunHeading() + (state.getGunTurnRate() + turnRate) * dt);
        state.setRadarHeading(state.getRadarHeading() + (state.getRadarTurnRate() + turnRate) * dt);

        double speed = (state.getSpeed() + state.getThrust() * dt) * config.driveFriction();
        state.setSpeed(speed);
        state.setPos(state.getPos().plus(Vector2.fromAngle(state.getHeading()).times(speed * dt)));

        state.setShootPower(Math.min(config.maxShootPower(), state.getShootPower() + config.shootPowerRegen() * dt));
    }
}
