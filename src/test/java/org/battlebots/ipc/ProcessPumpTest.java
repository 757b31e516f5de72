package org.battlebots.ipc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.battlebots.runtime.model.BotState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ProcessPumpTest {

    private final List<Thread> threads = new ArrayList<>();

    @AfterEach
    void tearDown() throws InterruptedException {
        for (Thread thread : threads) {
            thread.interrupt();
            thread.join(1000);
        }
    }

    @Test
    void relaysEveryMessageAndDeliversAnswersInOrder() throws Exception {
        Relay relay = new Relay();
        PipedOutputStream pumpToBot = new PipedOutputStream();
        PipedInputStream botStdin = new PipedInputStream(pumpToBot);
        PipedOutputStream botStdout = new PipedOutputStream();
        PipedInputStream botToPump = new PipedInputStream(botStdout);

        // The stub bot answers step n with SetThrust(n)
        Thread bot = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(new InputStreamReader(botStdin, StandardCharsets.UTF_8));
                 PrintWriter out = new PrintWriter(new OutputStreamWriter(botStdout, StandardCharsets.UTF_8), true)) {
                WireCodec codec = new WireCodec();
                String line;
                while ((line = in.readLine()) != null) {
                    Message message = codec.decodeEnvelope(line).message();
                    if (message instanceof Message.Step step) {
                        out.println(codec.encodeResponses(List.of(new Response.SetThrust(step.elapsed()))));
                    } else {
                        out.println("[]");
                    }
                }
            } catch (IOException e) {
                // the pump is gone and the pipe is dead
            } catch (WireFormatException e) {
                throw new IllegalStateException(e);
            }
        }, "stub-bot");
        bot.setDaemon(true);
        threads.add(bot);
        bot.start();

        Thread pump = new ProcessPump("pump-test", relay,
                new OutputStreamWriter(pumpToBot, StandardCharsets.UTF_8),
                new BufferedReader(new InputStreamReader(botToPump, StandardCharsets.UTF_8)),
                new WireCodec()).start();
        threads.add(pump);
        assertThat(pump.isDaemon()).isTrue();

        int messages = 20;
        for (int n = 1; n <= messages; n++) {
            relay.send(new BotState(), new Message.Step(n));
        }

        List<List<Response>> received = new ArrayList<>();
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            Optional<List<Response>> next;
            while ((next = relay.tryReceive()).isPresent()) {
                received.add(next.get());
            }
            assertThat(received).hasSize(messages);
        });
        for (int n = 1; n <= messages; n++) {
            assertThat(received.get(n - 1)).containsExactly(new Response.SetThrust(n));
        }

        relay.send(new BotState(), new Message.Kill());
        pump.join(5000);
        assertThat(pump.isAlive()).isFalse();
        assertThat(relay.failure()).isEmpty();
    }

    @Test
    void oneCycleWritesOneLineAndReadsOneLine() throws Exception {
        Relay relay = new Relay();
        StringWriter written = new StringWriter();
        ProcessPump pump = new ProcessPump("pump-test", relay, written,
                new BufferedReader(new StringReader("[{\"Shoot\":1.0}]\n[]\n")), new WireCodec());

        relay.send(new BotState(), new Message.Step(0.5));
        assertThat(pump.pumpOne()).isTrue();

        assertThat(written.toString()).endsWith("{\"Step\":{\"elapsed\":0.5}}]\n");
        assertThat(relay.tryReceive()).hasValue(List.of(new Response.Shoot(1.0)));

        relay.send(new BotState(), new Message.Kill());
        assertThat(pump.pumpOne()).isFalse();
        assertThat(relay.tryReceive()).hasValue(List.of());
    }

    @Test
    void botClosingItsOutputIsRecordedAsReadingFailure() {
        Relay relay = new Relay();
        ProcessPump pump = new ProcessPump("pump-test", relay, new StringWriter(),
                new BufferedReader(new StringReader("")), new WireCodec());

        relay.send(new BotState(), new Message.Step(0.1));
        pump.run();

        assertThat(relay.failure()).hasValueSatisfying(failure -> {
            assertThat(failure).isInstanceOf(RelayException.class);
            assertThat(((RelayException) failure).getKind()).isEqualTo(RelayException.Kind.READING);
        });
    }

    @Test
    void garbageAnswerIsRecordedAsDeserializationFailure() {
        Relay relay = new Relay();
        ProcessPump pump = new ProcessPump("pump-test", relay, new StringWriter(),
                new BufferedReader(new StringReader("{oops\n")), new WireCodec());

        relay.send(new BotState(), new Message.Step(0.1));
        pump.run();

        assertThat(relay.failure()).hasValueSatisfying(failure ->
                assertThat(((RelayException) failure).getKind()).isEqualTo(RelayException.Kind.DESERIALIZATION));
        assertThat(relay.tryReceive()).isEmpty();
    }

    @Test
    void writeFailureIsRecorded() {
        Relay relay = new Relay();
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("Broken pipe");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        ProcessPump pump = new ProcessPump("pump-test", relay, broken,
                new BufferedReader(new StringReader("[]\n")), new WireCodec());

        relay.send(new BotState(), new Message.Step(0.1));
        pump.run();

        assertThat(relay.failure()).hasValueSatisfying(failure ->
                assertThat(((RelayException) failure).getKind()).isEqualTo(RelayException.Kind.WRITING));
    }
}
