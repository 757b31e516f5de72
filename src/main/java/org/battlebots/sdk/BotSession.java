package org.battlebots.sdk;

import java.util.List;

import org.battlebots.ipc.Envelope;
import org.battlebots.ipc.Message;
import org.battlebots.ipc.Response;
import org.battlebots.runtime.config.SimulationConfig;

/**
 * Drives an {@link IBotLogic} one envelope at a time.
 * <p>
 * Keeps the configuration received with {@code Init} for later hooks and ends the session on
 * {@code Kill}. Until {@code Init} arrives the classpath defaults are used. Not thread-safe;
 * a session belongs to the single thread that pumps its bot.
 */
public class BotSession {

    private final IBotLogic logic;
    private SimulationConfig config;
    private boolean alive = true;

    public BotSession(IBotLogic logic) {
        this(logic, SimulationConfig.defaults());
    }

    public BotSession(IBotLogic logic, SimulationConfig initialConfig) {
        this.logic = logic;
        this.config = initialConfig;
    }

    /**
     * Hands one message to the logic and collects its commands.
     *
     * @param envelope the bot's state and the message.
     * @return the commands to send back; always empty for {@code Kill}.
     * @throws IllegalStateException if the session has already been killed.
     */
    public List<Response> dispatch(Envelope envelope) {
        if (!alive) {
            throw new IllegalStateException("Bot session already received Kill");
        }

        Message message = envelope.message();
        if (message instanceof Message.Init init) {
            config = init.config();
        }

        BotHook hook = new BotHook(config, envelope.state());
        if (message instanceof Message.Init) {
            logic.init(hook);
        } else if (message instanceof Message.Step step) {
            logic.step(hook, step.elapsed());
        } else if (message instanceof Message.Scan scan) {
            logic.scan(hook, scan.scanPos());
        } else if (message instanceof Message.Kill) {
            alive = false;
            logic.kill(hook);
            return List.of();
        }
        return hook.responses();
    }

    public boolean isAlive() {
        return alive;
    }

    public SimulationConfig getConfig() {
        return config;
    }
}
