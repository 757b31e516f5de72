package org.battlebots.sdk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.List;

import org.battlebots.ipc.Envelope;
import org.battlebots.ipc.Message;
import org.battlebots.ipc.Response;
import org.battlebots.runtime.config.SimulationConfig;
import org.battlebots.runtime.model.BotState;
import org.battlebots.runtime.model.Vector2;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class BotSessionTest {

    @Test
    void dispatchesEachMessageToTheMatchingCallback() {
        IBotLogic logic = mock(IBotLogic.class);
        BotSession session = new BotSession(logic);
        SimulationConfig config = SimulationConfig.defaults();

        session.dispatch(new Envelope(new BotState(), new Message.Init(config)));
        session.dispatch(new Envelope(new BotState(), new Message.Step(0.25)));
        session.dispatch(new Envelope(new BotState(), new Message.Scan(new Vector2(1.0, 2.0))));

        verify(logic).init(any(BotHook.class));
        verify(logic).step(any(BotHook.class), eq(0.25));
        verify(logic).scan(any(BotHook.class), eq(new Vector2(1.0, 2.0)));
        verify(logic, never()).kill(any());
        assertThat(session.isAlive()).isTrue();
    }

    @Test
    void initReplacesTheConfigurationUsedForClamping() {
        SimulationConfig narrow = SimulationConfig.fromConfig(
                ConfigFactory.parseString("thrust-limits { min = -1, max = 1 }"));
        BotSession session = new BotSession(new IBotLogic() {
            @Override
            public void step(BotHook hook, double elapsed) {
                hook.setThrust(5.0);
            }
        });

        assertThat(session.dispatch(new Envelope(new BotState(), new Message.Step(0.1))))
                .containsExactly(new Response.SetThrust(5.0));

        session.dispatch(new Envelope(new BotState(), new Message.Init(narrow)));

        assertThat(session.getConfig()).isEqualTo(narrow);
        assertThat(session.dispatch(new Envelope(new BotState(), new Message.Step(0.1))))
                .containsExactly(new Response.SetThrust(1.0));
    }

    @Test
    void killEndsTheSessionAndDiscardsCommands() {
        IBotLogic logic = new IBotLogic() {
            @Override
            public void kill(BotHook hook) {
                hook.setThrust(1.0);
            }
        };
        BotSession session = new BotSession(logic);

        List<Response> responses = session.dispatch(new Envelope(new BotState(), new Message.Kill()));

        assertThat(responses).isEmpty();
        assertThat(session.isAlive()).isFalse();
        assertThatThrownBy(() -> session.dispatch(new Envelope(new BotState(), new Message.Step(0.1))))
                .isInstanceOf(IllegalStateException.class);
    }
}
