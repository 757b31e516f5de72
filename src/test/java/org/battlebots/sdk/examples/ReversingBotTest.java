package org.battlebots.sdk.examples;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Random;

import org.battlebots.ipc.Response;
import org.battlebots.runtime.config.SimulationConfig;
import org.battlebots.runtime.model.BotState;
import org.battlebots.sdk.BotHook;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ReversingBotTest {

    private final SimulationConfig config = SimulationConfig.defaults();

    @Test
    void initTurnsSpinsTheGunAndDrivesForward() {
        BotHook hook = new BotHook(config, new BotState());

        new ReversingBot(new Random(1)).init(hook);

        assertThat(hook.responses()).containsExactly(
                new Response.SetTurnRate(2.0),
                new Response.SetGunTurnRate(-2.0),
                new Response.SetThrust(10.0));
    }

    @Test
    void flipsThrustEvery16To35Steps() {
        ReversingBot bot = new ReversingBot(new Random(7));
        int steps = 0;
        int lastFlip = 0;
        int flips = 0;

        while (flips < 10) {
            steps++;
            BotHook hook = new BotHook(config, new BotState());
            bot.step(hook, 0.1);
            if (!hook.responses().isEmpty()) {
                int interval = steps - lastFlip;
                assertThat(interval).isBetween(16, 35);
                double expected = bot.isReversing() ? -10.0 : 10.0;
                assertThat(hook.responses()).containsExactly(new Response.SetThrust(expected));
                lastFlip = steps;
                flips++;
            }
        }
    }
}
