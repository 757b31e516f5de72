package org.battlebots.ipc;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.battlebots.runtime.model.BotState;

/**
 * Mailbox between a controller and whatever runs the bot's logic.
 * <p>
 * Two independent FIFO queues: envelopes flow out, response lists flow back in. The controller
 * side only blocks while waiting for a bot to start. The pump side blocks on {@link #nextOutbound()} until the controller sends
 * something. Every outbound envelope is answered by exactly one inbound response list, in order.
 * <p>
 * A pump that dies records its error with {@link #fail(Throwable)} so the controller can report
 * the cause instead of merely observing that no responses arrive.
 */
public class Relay {

    private final BlockingQueue<Envelope> outbound = new LinkedBlockingQueue<>();
    private final BlockingDeque<List<Response>> inbound = new LinkedBlockingDeque<>();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    /**
     * Queues a message for the bot. The state is copied, so the caller may keep mutating it.
     *
     * @param state the bot's current state.
     * @param message the message.
     */
    public void send(BotState state, Message message) {
        outbound.add(new Envelope(state.copy(), message));
    }

    /**
     * Takes the oldest response list if one has arrived.
     *
     * @return the responses, or empty if the bot has not answered yet.
     */
    public Optional<List<Response>> tryReceive() {
        return Optional.ofNullable(inbound.pollFirst());
    }

    /**
     * Waits until a response list is available without taking it. Controller side only.
     *
     * @param timeout the maximum time to wait.
     * @param unit the unit of {@code timeout}.
     * @return whether a response list is available.
     * @throws InterruptedException if interrupted while waiting.
     */
    public boolean awaitInbound(long timeout, TimeUnit unit) throws InterruptedException {
        List<Response> head = inbound.pollFirst(timeout, unit);
        if (head == null) {
            return false;
        }
        inbound.offerFirst(head);
        return true;
    }

    /**
     * Blocks until the controller has sent an envelope.
     *
     * @return the oldest unsent envelope.
     * @throws InterruptedException if interrupted while waiting.
     */
    public Envelope nextOutbound() throws InterruptedException {
        return outbound.take();
    }

    /**
     * Hands the bot's answer to the controller.
     *
     * @param responses the responses, in the order the bot produced them.
     */
    public void deliver(List<Response> responses) {
        inbound.addLast(List.copyOf(responses));
    }

    /**
     * Records why the pump stopped. Only the first failure is kept.
     *
     * @param cause the error that ended the pump.
     */
    public void fail(Throwable cause) {
        failure.compareAndSet(null, cause);
    }

    /**
     * Returns the pump's recorded failure, if any.
     *
     * @return the first recorded failure.
     */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure.get());
    }

    /**
     * @return the number of envelopes not yet taken by the pump.
     */
    public int pendingOutbound() {
        return outbound.size();
    }
}
