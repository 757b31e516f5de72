package org.battlebots.ctl;

import org.battlebots.ipc.Envelope;
import org.battlebots.ipc.Message;
import org.battlebots.ipc.Relay;
import org.battlebots.sdk.BotSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a bot's logic in this JVM: an actor thread draining a {@link Relay} as its mailbox.
 * <p>
 * Behaves like an external bot without serialization. Each envelope is dispatched through a
 * {@link BotSession} and the resulting commands are delivered back. The actor ends after
 * answering {@code Kill}. An exception thrown by the logic ends it too and is recorded as the
 * relay's failure.
 */
class ActorPump implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ActorPump.class);

    private final String name;
    private final Relay relay;
    private final BotSession session;

    ActorPump(String name, Relay relay, BotSession session) {
        this.name = name;
        this.relay = relay;
        this.session = session;
    }

    Thread start() {
        Thread thread = new Thread(this, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try {
            while (true) {
                Envelope envelope = relay.nextOutbound();
                relay.deliver(session.dispatch(envelope));
                if (envelope.message() instanceof Message.Kill) {
                    LOG.debug("Actor '{}' finished", name);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            relay.fail(e);
            LOG.debug("Actor '{}' interrupted", name);
        } catch (RuntimeException e) {
            relay.fail(e);
            LOG.warn("Bot logic on actor '{}' failed: {}", name, e.getMessage());
            LOG.debug("Bot logic failure details:", e);
        }
    }
}
