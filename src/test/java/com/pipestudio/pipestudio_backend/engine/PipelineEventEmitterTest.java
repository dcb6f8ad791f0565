package com.pipestudio.pipestudio_backend.engine;

import com.pipestudio.pipestudio_backend.model.event.PipelineEvent;
import com.pipestudio.pipestudio_backend.model.event.PipelineEventType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class PipelineEventEmitterTest {

    private static PipelineEvent event(String executionId, PipelineEventType type) {
        return PipelineEvent.builder().type(type).executionId(executionId).pipelineId("p1").build();
    }

    @Test
    void subscribersOnlySeeTheirOwnTopic() {
        PipelineEventEmitter emitter = new PipelineEventEmitter(List.of());
        List<PipelineEvent> first = new ArrayList<>();
        List<PipelineEvent> second = new ArrayList<>();
        emitter.subscribe(PipelineEventEmitter.topicFor("exec-1"), first::add);
        emitter.subscribe(PipelineEventEmitter.topicFor("exec-2"), second::add);

        emitter.emit(event("exec-1", PipelineEventType.PIPELINE_START));

        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
    }

    @Test
    void globalListenersSeeEveryTopic() {
        List<String> topics = new ArrayList<>();
        PipelineEventEmitter emitter = new PipelineEventEmitter(List.of((topic, e) -> topics.add(topic)));

        emitter.emit(event("exec-1", PipelineEventType.NODE_START));
        emitter.emit(event("exec-2", PipelineEventType.NODE_START));

        assertThat(topics).containsExactly("pipeline-exec-1", "pipeline-exec-2");
    }

    @Test
    void unsubscribedObserversStopReceiving() {
        PipelineEventEmitter emitter = new PipelineEventEmitter(List.of());
        List<PipelineEvent> received = new ArrayList<>();
        PipelineEventEmitter.Subscription subscription = emitter.subscribe("pipeline-exec-1", received::add);

        emitter.emit(event("exec-1", PipelineEventType.NODE_START));
        subscription.unsubscribe();
        emitter.emit(event("exec-1", PipelineEventType.NODE_COMPLETE));

        assertThat(received).extracting(PipelineEvent::getType).containsExactly(PipelineEventType.NODE_START);
        assertThat(emitter.subscriberCount("pipeline-exec-1")).isZero();
    }

    @Test
    void failingTransportsAreSwallowed() {
        List<PipelineEvent> received = new ArrayList<>();
        PipelineEventEmitter emitter = new PipelineEventEmitter(List.of((topic, e) -> {
            throw new IllegalStateException("socket closed");
        }));
        emitter.subscribe("pipeline-exec-1", e -> {
            throw new IllegalStateException("subscriber gone");
        });
        emitter.subscribe("pipeline-exec-1", received::add);

        assertThatCode(() -> emitter.emit(event("exec-1", PipelineEventType.LOG))).doesNotThrowAnyException();
        assertThat(received).hasSize(1);
    }
}
