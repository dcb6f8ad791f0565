package com.pipestudio.pipestudio_backend.engine;

import com.pipestudio.pipestudio_backend.model.event.PipelineEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Publish/subscribe channel for execution events.
 *
 * Every event goes to the topic "pipeline-{executionId}". Global listeners (the STOMP forwarder)
 * see all topics; in-process subscribers see only the topic they subscribed to. Delivery is to
 * whoever is subscribed at publish time; nothing is buffered for late subscribers. A failing
 * subscriber or transport is logged and skipped so publishing never throws.
 */
@Slf4j
@Component
public class PipelineEventEmitter {

    public static final String TOPIC_PREFIX = "pipeline-";

    private final List<PipelineEventListener> listeners;
    private final Map<String, List<Consumer<PipelineEvent>>> subscribers = new ConcurrentHashMap<>();

    public PipelineEventEmitter(List<PipelineEventListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public static String topicFor(String executionId) {
        return TOPIC_PREFIX + executionId;
    }

    public void emit(PipelineEvent event) {
        String topic = topicFor(event.getExecutionId());

        for (PipelineEventListener listener : listeners) {
            try {
                listener.onEvent(topic, event);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed on {} event for {}: {}",
                        listener.getClass().getSimpleName(), event.getType(), topic, ex.getMessage());
            }
        }

        List<Consumer<PipelineEvent>> topicSubscribers = subscribers.get(topic);
        if (topicSubscribers == null) return;
        for (Consumer<PipelineEvent> subscriber : topicSubscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException ex) {
                log.warn("Subscriber on {} failed on {} event: {}", topic, event.getType(), ex.getMessage());
            }
        }
    }

    public Subscription subscribe(String topic, Consumer<PipelineEvent> subscriber) {
        subscribers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(subscriber);
        return () -> subscribers.computeIfPresent(topic, (t, list) -> {
            list.remove(subscriber);
            return list.isEmpty() ? null : list;
        });
    }

    public int subscriberCount(String topic) {
        List<Consumer<PipelineEvent>> list = subscribers.get(topic);
        return list != null ? list.size() : 0;
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
