package org.battlebots.cli.commands;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.battlebots.cli.BotLauncher;
import org.battlebots.cli.CommandLineInterface;
import org.battlebots.cli.SnapshotReporter;
import org.battlebots.ctl.BotController;
import org.battlebots.runtime.Robo;
import org.battlebots.runtime.World;
import org.battlebots.runtime.config.SimulationConfig;
import org.battlebots.runtime.model.BotState;
import org.battlebots.sdk.examples.ReversingBot;
import org.battlebots.threading.Coordinator;
import org.battlebots.threading.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs a simulation until its duration is over, a thread fails, or the JVM is shut down.
 * <p>
 * Every robo runs on a thread of its own coordinator. A second coordinator runs the world, the
 * snapshot reporter and a supervisor that fails as soon as any robo fails. Whichever of those
 * three ends first ends the run: the world is asked to stop, which in turn stops every robo,
 * and the remaining threads get {@code shutdown-timeout} to finish.
 */
@Command(
    name = "run",
    description = "Run a simulation"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    private static final String RUN_PATH = SimulationConfig.CONFIG_PATH + ".run";

    @Option(
        names = {"--bots"},
        description = "Number of bots (default: battlebots.run.bot-count)"
    )
    private Integer botCount;

    @Option(
        names = {"--in-process"},
        description = "Run bots as in-process actors instead of child processes"
    )
    private boolean inProcess;

    @Option(
        names = {"--duration"},
        description = "How long to run, e.g. 30s or 2m; 0s runs until interrupted (default: battlebots.run.duration)"
    )
    private String duration;

    @Option(
        names = {"--bot-command"},
        arity = "1..*",
        description = "Command line that starts one bot (default: the bundled example bot)"
    )
    private List<String> botCommand;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var err = spec.commandLine().getErr();

        final Config runConfig;
        final SimulationConfig simulationConfig;
        try {
            Config config = withOverrides(parent.getConfig());
            simulationConfig = SimulationConfig.fromConfig(config.getConfig(SimulationConfig.CONFIG_PATH));
            runConfig = config.getConfig(RUN_PATH);
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }

        int count = runConfig.getInt("bot-count");
        List<String> command = runConfig.getStringList("bot-command");
        if (command.isEmpty()) {
            command = BotLauncher.defaultBotCommand();
        }

        try (BotLauncher launcher = new BotLauncher(simulationConfig, runConfig.getLong("seed"),
                runConfig.getDuration("startup-timeout"))) {
            List<BotController> controllers = runConfig.getBoolean("in-process")
                    ? launcher.launchActors(count, ReversingBot::new)
                    : launcher.launchProcesses(count, command);

            return runSimulation(simulationConfig, controllers,
                    runConfig.getDuration("report-interval"),
                    runConfig.getDuration("duration"),
                    runConfig.getDuration("shutdown-timeout"));
        } catch (IOException e) {
            log.error("Failed to start bots: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while running the simulation");
            return 1;
        }
    }

    /**
     * Runs a world over the given controllers and waits for it to end.
     *
     * @param config the simulation configuration.
     * @param controllers one controller per bot, already connected to its logic.
     * @param reportInterval time between two snapshot summaries.
     * @param duration how long to run, zero for no limit.
     * @param shutdownTimeout how long to wait for the remaining threads once the world was asked to stop.
     * @return the exit code: 0 if every thread ended cleanly, 1 otherwise.
     * @throws InterruptedException if interrupted while waiting.
     */
    static int runSimulation(SimulationConfig config, List<BotController> controllers,
                             Duration reportInterval, Duration duration, Duration shutdownTimeout)
            throws InterruptedException {
        World<BotState> world = new World<>(config, controllers);

        Coordinator<Void> roboCoordinator = new Coordinator<>();
        for (Robo<BotState> robo : world.getRobos()) {
            roboCoordinator.spawn("robo-" + robo.getId(), () -> {
                robo.run(world.getTickLock());
                return null;
            });
        }

        Coordinator<Void> mainCoordinator = new Coordinator<>();
        mainCoordinator.spawn("world", () -> {
            world.run();
            return null;
        });
        mainCoordinator.spawn("snapshot-reporter", new SnapshotReporter(world, reportInterval, duration));
        mainCoordinator.spawn("robo-supervisor", () -> {
            superviseRobos(roboCoordinator);
            return null;
        });

        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            world.requestStop();
            try {
                finished.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "battlebots-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            // Without failures this is the reporter, once the run time is over
            Outcome<Void> first = mainCoordinator.waitNext().orElseThrow();
            world.requestStop();

            int exitCode = 0;
            if (first.isFailure()) {
                reportFailure(((Outcome.Failure<Void>) first).error());
                exitCode = 1;
            }

            List<Optional<Outcome<Void>>> remaining = mainCoordinator.waitAll(shutdownTimeout);
            for (Optional<Outcome<Void>> outcome : remaining) {
                if (outcome.isPresent() && outcome.get() instanceof Outcome.Failure<Void> failure) {
                    reportFailure(failure.error());
                    exitCode = 1;
                }
            }
            if (mainCoordinator.activeCount() > 0) {
                log.warn("{} thread(s) did not stop within {}", mainCoordinator.activeCount(), shutdownTimeout);
                exitCode = 1;
            }

            if (exitCode == 0) {
                log.info("Simulation finished after {} ticks", world.getTicksDone());
            }
            return exitCode;
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    /**
     * Drains the robo coordinator and escalates the first robo failure.
     */
    private static void superviseRobos(Coordinator<Void> roboCoordinator) throws InterruptedException {
        Optional<Outcome<Void>> next;
        while ((next = roboCoordinator.waitNext()).isPresent()) {
            next.get().getOrThrow();
        }
    }

    private static void reportFailure(Throwable error) {
        StringBuilder message = new StringBuilder(String.valueOf(error.getMessage()));
        for (Throwable cause = error.getCause(); cause != null; cause = cause.getCause()) {
            message.append(" <- ").append(cause.getMessage());
        }
        log.error("Simulation failed: {}", message);
        log.debug("Failure details:", error);
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // The JVM is already shutting down and runs the hook itself
            log.debug("Shutdown hook not removed: {}", e.getMessage());
        }
    }

    private Config withOverrides(Config config) {
        Map<String, Object> overrides = new HashMap<>();
        if (botCount != null) {
            overrides.put(RUN_PATH + ".bot-count", botCount);
        }
        if (inProcess) {
            overrides.put(RUN_PATH + ".in-process", true);
        }
        if (duration != null) {
            overrides.put(RUN_PATH + ".duration", duration);
        }
        if (botCommand != null && !botCommand.isEmpty()) {
            overrides.put(RUN_PATH + ".bot-command", botCommand);
        }
        return ConfigFactory.parseMap(overrides).withFallback(config);
    }
}
