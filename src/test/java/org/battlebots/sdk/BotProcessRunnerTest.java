package org.battlebots.sdk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.BufferedReader;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import org.battlebots.ipc.Envelope;
import org.battlebots.ipc.Message;
import org.battlebots.ipc.RelayException;
import org.battlebots.ipc.Response;
import org.battlebots.ipc.WireCodec;
import org.battlebots.runtime.config.SimulationConfig;
import org.battlebots.runtime.model.BotState;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class BotProcessRunnerTest {

    private final WireCodec codec = new WireCodec();

    @Test
    void answersEveryLineUntilKill() throws Exception {
        String input = String.join("\n",
                codec.encodeEnvelope(new Envelope(new BotState(), new Message.Init(SimulationConfig.defaults()))),
                codec.encodeEnvelope(new Envelope(new BotState(), new Message.Step(0.1))),
                codec.encodeEnvelope(new Envelope(new BotState(), new Message.Kill())),
                "this line is never read") + "\n";
        StringWriter output = new StringWriter();

        BotProcessRunner.run(new IBotLogic() {
            @Override
            public void init(BotHook hook) {
                hook.setThrust(4.0);
            }

            @Override
            public void step(BotHook hook, double elapsed) {
                hook.debugPrint("elapsed " + elapsed);
            }
        }, new BufferedReader(new StringReader(input)), output);

        String[] lines = output.toString().split("\n");
        assertThat(lines).hasSize(3);
        assertThat(codec.decodeResponses(lines[0])).containsExactly(new Response.SetThrust(4.0));
        assertThat(codec.decodeResponses(lines[1])).containsExactly(new Response.DebugPrint("elapsed 0.1"));
        assertThat(codec.decodeResponses(lines[2])).isEqualTo(List.of());
    }

    @Test
    void endOfInputBeforeKillIsAReadingError() {
        assertThatThrownBy(() -> BotProcessRunner.run(new IBotLogic() { },
                new BufferedReader(new StringReader("")), new StringWriter()))
                .isInstanceOf(RelayException.class)
                .satisfies(e -> assertThat(((RelayException) e).getKind()).isEqualTo(RelayException.Kind.READING));
    }

    @Test
    void malformedLineIsADeserializationError() {
        assertThatThrownBy(() -> BotProcessRunner.run(new IBotLogic() { },
                new BufferedReader(new StringReader("[1,2,3]\n")), new StringWriter()))
                .isInstanceOf(RelayException.class)
                .satisfies(e -> assertThat(((RelayException) e).getKind())
                        .isEqualTo(RelayException.Kind.DESERIALIZATION));
    }
}
