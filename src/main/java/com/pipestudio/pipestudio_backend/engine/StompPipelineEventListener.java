package com.pipestudio.pipestudio_backend.engine;

import com.pipestudio.pipestudio_backend.model.event.PipelineEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Forwards execution events to STOMP subscribers. The IDE subscribes to
 * /topic/pipeline-{executionId} to watch a run live.
 */
@Slf4j
@Component
public class StompPipelineEventListener implements PipelineEventListener {

    private static final String TOPIC = "/topic/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    public StompPipelineEventListener(SimpMessagingTemplate messagingTemplate,
                                      ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    @Override
    public void onEvent(String topic, PipelineEvent event) {
        String destination = TOPIC + topic;
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("Publishing {} to {} via {}", event.getType(), destination, bridge != null ? "Redis" : "Direct");
        if (bridge != null) {
            bridge.publish(destination, event);
        } else {
            messagingTemplate.convertAndSend(destination, event);
        }
    }
}
