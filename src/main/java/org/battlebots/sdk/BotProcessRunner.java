package org.battlebots.sdk;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.battlebots.ipc.Envelope;
import org.battlebots.ipc.RelayException;
import org.battlebots.ipc.Response;
import org.battlebots.ipc.WireCodec;
import org.battlebots.ipc.WireFormatException;

/**
 * The child-process side of the bot protocol.
 * <p>
 * Reads one envelope per line, dispatches it to the bot's logic and answers with exactly one
 * line of responses, until {@code Kill} has been answered.
 */
public final class BotProcessRunner {

    private BotProcessRunner() {
    }

    /**
     * Runs a bot over the process's standard input and output. Standard output must not be
     * used for anything else while this runs.
     *
     * @param logic the bot's logic.
     * @throws RelayException if the protocol breaks down.
     */
    public static void runOnStandardStreams(IBotLogic logic) throws RelayException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        run(logic, in, out);
    }

    /**
     * Runs a bot until it is killed.
     *
     * @param logic the bot's logic.
     * @param in the simulation's messages, one per line.
     * @param out where responses are written, one line per message.
     * @throws RelayException if a line cannot be read, decoded, encoded or written, or the
     *         simulation closes the stream before sending {@code Kill}.
     */
    public static void run(IBotLogic logic, BufferedReader in, Writer out) throws RelayException {
        WireCodec codec = new WireCodec();
        BotSession session = new BotSession(logic);

        while (session.isAlive()) {
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new RelayException(RelayException.Kind.READING, e.getMessage(), e);
            }
            if (line == null) {
                throw new RelayException(RelayException.Kind.READING, "simulation closed the stream", null);
            }

            Envelope envelope;
            try {
                envelope = codec.decodeEnvelope(line);
            } catch (WireFormatException e) {
                throw new RelayException(RelayException.Kind.DESERIALIZATION, e.getMessage(), e);
            }

            List<Response> responses = session.dispatch(envelope);

            String reply;
            try {
                reply = codec.encodeResponses(responses);
            } catch (WireFormatException e) {
                throw new RelayException(RelayException.Kind.SERIALIZATION, e.getMessage(), e);
            }
            try {
                out.write(reply);
                out.write('\n');
                out.flush();
            } catch (IOException e) {
                throw new RelayException(RelayException.Kind.WRITING, e.getMessage(), e);
            }
        }
    }
}
