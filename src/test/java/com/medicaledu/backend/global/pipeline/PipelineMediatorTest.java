package com.medicaledu.backend.global.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PipelineMediatorTest {

    record Ping(String message) implements Request<String> {
    }

    record Unhandled() implements Request<String> {
    }

    static class PingHandler implements RequestHandler<Ping, String> {

        private final List<String> trail;

        PingHandler(List<String> trail) {
            this.trail = trail;
        }

        @Override
        public String handle(Ping request) {
            trail.add("handler");
            return "pong:" + request.message();
        }
    }

    static class SecondPingHandler implements RequestHandler<Ping, String> {

        @Override
        public String handle(Ping request) {
            return "other";
        }
    }

    static class RecordingBehavior implements PipelineBehavior {

        private final String name;
        private final List<String> trail;

        RecordingBehavior(String name, List<String> trail) {
            this.name = name;
            this.trail = trail;
        }

        @Override
        public <R> R handle(Request<R> request, RequestHandlerDelegate<R> next) {
            trail.add(name + ":before");
            R response = next.invoke();
            trail.add(name + ":after");
            return response;
        }
    }

    @Test
    @DisplayName("behaviours wrap the handler in list order, outermost first")
    void runsBehavioursInOrder() {
        List<String> trail = new ArrayList<>();
        PipelineMediator mediator = new PipelineMediator(
                List.of(new PingHandler(trail)),
                List.of(new RecordingBehavior("validation", trail), new RecordingBehavior("logging", trail))
        );

        String response = mediator.send(new Ping("hi"));

        assertThat(response).isEqualTo("pong:hi");
        assertThat(trail).containsExactly(
                "validation:before", "logging:before", "handler", "logging:after", "validation:after");
    }

    @Test
    void failsWithoutHandler() {
        PipelineMediator mediator = new PipelineMediator(List.of(new PingHandler(new ArrayList<>())), List.of());

        assertThatThrownBy(() -> mediator.send(new Unhandled()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unhandled");
        assertThatThrownBy(() -> mediator.send(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("two handlers for one request type are rejected at startup")
    void rejectsDuplicateHandlers() {
        assertThatThrownBy(() -> new PipelineMediator(
                List.of(new PingHandler(new ArrayList<>()), new SecondPingHandler()), List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Multiple handlers");
    }
}
