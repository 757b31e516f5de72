package org.battlebots.cli;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

import org.battlebots.ctl.BotController;
import org.battlebots.runtime.config.SimulationConfig;
import org.battlebots.runtime.model.Vector2;
import org.battlebots.sdk.IBotLogic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the bots of a run: starts one child process (or one in-process actor) per bot and
 * places each at a seeded random position inside the world.
 * <p>
 * Closing the launcher destroys any child process that is still alive.
 */
public class BotLauncher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BotLauncher.class);

    private final SimulationConfig config;
    private final Random random;
    private final Duration startupTimeout;
    private final List<Process> processes = new ArrayList<>();

    public BotLauncher(SimulationConfig config, long seed) {
        this(config, seed, Duration.ZERO);
    }

    /**
     * @param config the simulation configuration.
     * @param seed the seed for initial positions.
     * @param startupTimeout how long each bot may take to answer {@code Init}; see
     *        {@link BotController#setStartupTimeout(Duration)}.
     */
    public BotLauncher(SimulationConfig config, long seed, Duration startupTimeout) {
        this.config = config;
        this.random = new Random(seed);
        this.startupTimeout = startupTimeout;
    }

    /**
     * Starts {@code count} child processes running {@code command}. Their stderr is inherited.
     *
     * @param count the number of bots.
     * @param command the command line of one bot.
     * @return one controller per process, ids starting at 0.
     * @throws IOException if a process cannot be started. Processes started so far stay
     *         registered and are destroyed by {@link #close()}.
     */
    public List<BotController> launchProcesses(int count, List<String> command) throws IOException {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Bot command must not be empty");
        }
        LOG.info("Starting {} bot processes: {}", count, String.join(" ", command));

        List<BotController> controllers = new ArrayList<>(count);
        for (int id = 0; id < count; id++) {
            Process process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
            processes.add(process);
            BotController controller = BotController.forProcess(id, nextPosition(), config,
                    process.getOutputStream(), process.getInputStream());
            controller.setStartupTimeout(startupTimeout);
            controllers.add(controller);
        }
        return controllers;
    }

    /**
     * Starts {@code count} in-process actors.
     *
     * @param count the number of bots.
     * @param logic creates the logic of one bot.
     * @return one controller per actor, ids starting at 0.
     */
    public List<BotController> launchActors(int count, Supplier<? extends IBotLogic> logic) {
        LOG.info("Starting {} in-process bots", count);
        List<BotController> controllers = new ArrayList<>(count);
        for (int id = 0; id < count; id++) {
            BotController controller = BotController.forActor(id, nextPosition(), config, logic.get());
            controller.setStartupTimeout(startupTimeout);
            controllers.add(controller);
        }
        return controllers;
    }

    /**
     * @return a uniformly random position inside the world.
     */
    Vector2 nextPosition() {
        Vector2 size = config.worldSize();
        return new Vector2(random.nextDouble() * size.x(), random.nextDouble() * size.y());
    }

    /**
     * Builds the command that runs the bundled example bot in a fresh JVM with this JVM's classpath.
     *
     * @return the command line.
     */
    public static List<String> defaultBotCommand() {
        String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        return List.of(java, "-cp", System.getProperty("java.class.path"),
                CommandLineInterface.class.getName(), "bot");
    }

    @Override
    public void close() {
        int destroyed = 0;
        for (Process process : processes) {
            if (process.isAlive()) {
                process.destroy();
                destroyed++;
            }
        }
        if (destroyed > 0) {
            LOG.info("Destroyed {} bot processes that were still running", destroyed);
        }
    }
}
