package org.battlebots.ipc;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves envelopes from a {@link Relay} to an external bot and its answers back.
 * <p>
 * One daemon thread per bot runs a strict write-then-read cycle: encode the next envelope as one
 * line, write and flush it, then block until the bot answers with exactly one line. The pump ends
 * after relaying {@code Kill}, when the bot closes its output, or on the first error. Errors are
 * recorded on the relay; they never propagate to other threads.
 */
public class ProcessPump implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessPump.class);

    private final String name;
    private final Relay relay;
    private final Writer toBot;
    private final BufferedReader fromBot;
    private final WireCodec codec;

    /**
     * Creates a pump. Nothing happens until {@link #start()}.
     *
     * @param name the thread name.
     * @param relay the relay shared with the controller.
     * @param toBot the bot's standard input.
     * @param fromBot the bot's standard output.
     * @param codec the wire codec.
     */
    public ProcessPump(String name, Relay relay, Writer toBot, BufferedReader fromBot, WireCodec codec) {
        this.name = name;
        this.relay = relay;
        this.toBot = toBot;
        this.fromBot = fromBot;
        this.codec = codec;
    }

    /**
     * Starts the pump thread.
     *
     * @return the started daemon thread.
     */
    public Thread start() {
        Thread thread = new Thread(this, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try {
            while (pumpOne()) {
                // keep relaying
            }
            LOG.debug("Relay pump '{}' finished", name);
        } catch (RelayException e) {
            relay.fail(e);
            LOG.warn("Relay pump '{}' stopped: {}", name, e.getMessage());
            LOG.debug("Relay pump '{}' failure details:", name, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            relay.fail(e);
            LOG.debug("Relay pump '{}' interrupted", name);
        }
    }

    /**
     * Relays one envelope and its answer.
     *
     * @return {@code false} once the pump should end.
     * @throws RelayException if any stage of the cycle fails.
     * @throws InterruptedException if interrupted while waiting for an envelope.
     */
    boolean pumpOne() throws RelayException, InterruptedException {
        Envelope envelope = relay.nextOutbound();
        boolean last = envelope.message() instanceof Message.Kill;

        String line;
        try {
            line = codec.encodeEnvelope(envelope);
        } catch (WireFormatException e) {
            throw new RelayException(RelayException.Kind.SERIALIZATION, e.getMessage(), e);
        }

        try {
            toBot.write(line);
            toBot.write('\n');
            toBot.flush();
        } catch (IOException e) {
            throw new RelayException(RelayException.Kind.WRITING, e.getMessage(), e);
        }

        String reply;
        try {
            reply = fromBot.readLine();
        } catch (IOException e) {
            throw new RelayException(RelayException.Kind.READING, e.getMessage(), e);
        }

        if (reply == null) {
            if (last) {
                return false;
            }
            throw new RelayException(RelayException.Kind.READING, "bot closed its output", null);
        }

        List<Response> responses;
        try {
            responses = codec.decodeResponses(reply);
        } catch (WireFormatException e) {
            throw new RelayException(RelayException.Kind.DESERIALIZATION, e.getMessage(), e);
        }
        relay.deliver(responses);
        return !last;
    }
}
