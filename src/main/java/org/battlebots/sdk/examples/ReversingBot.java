package org.battlebots.sdk.examples;

import java.util.Random;

import org.battlebots.sdk.BotHook;
import org.battlebots.sdk.IBotLogic;

/**
 * Drives in circles with a spinning gun and flips between full forward and full reverse
 * thrust every 16 to 35 steps.
 */
public class ReversingBot implements IBotLogic {

    private static final double FULL_THRUST = 10.0;

    private final Random random;
    private int stepsUntilFlip;
    private boolean reversing;

    public ReversingBot() {
        this(new Random());
    }

    public ReversingBot(Random random) {
        this.random = random;
        this.stepsUntilFlip = nextInterval();
    }

    @Override
    public void init(BotHook hook) {
        // Out of range on purpose; the hook clamps to the configured limits.
        hook.setTurnRate(10.0);
        hook.setGunTurnRate(-10.0);
        hook.setThrust(FULL_THRUST);
    }

    @Override
    public void step(BotHook hook, double elapsed) {
        stepsUntilFlip--;
        if (stepsUntilFlip == 0) {
            stepsUntilFlip = nextInterval();
            reversing = !reversing;
            hook.setThrust(reversing ? -FULL_THRUST : FULL_THRUST);
        }
    }

    public boolean isReversing() {
        return reversing;
    }

    private int nextInterval() {
        return 16 + random.nextInt(20);
    }
}
