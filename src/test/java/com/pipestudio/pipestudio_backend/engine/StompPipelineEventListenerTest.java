package com.pipestudio.pipestudio_backend.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pipestudio.pipestudio_backend.model.event.PipelineEvent;
import com.pipestudio.pipestudio_backend.model.event.PipelineEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StompPipelineEventListenerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private SimpMessagingTemplate messagingTemplate;
    private StringRedisTemplate redisTemplate;
    private ObjectProvider<RedisWebSocketBridge> bridgeProvider;

    private final PipelineEvent event = PipelineEvent.builder()
            .type(PipelineEventType.NODE_START)
            .executionId("execution_1")
            .nodeId("input-1")
            .data(Map.of("nodeId", "input-1", "progress", 0))
            .build();

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        messagingTemplate = mock(SimpMessagingTemplate.class);
        redisTemplate = mock(StringRedisTemplate.class);
        bridgeProvider = mock(ObjectProvider.class);
    }

    @Test
    void sendsStraightToTheTopicWithoutABridge() {
        when(bridgeProvider.getIfAvailable()).thenReturn(null);
        StompPipelineEventListener listener = new StompPipelineEventListener(messagingTemplate, bridgeProvider);

        listener.onEvent("pipeline-execution_1", event);

        verify(messagingTemplate).convertAndSend("/topic/pipeline-execution_1", event);
    }

    @Test
    void publishesThroughRedisWhenTheBridgeIsEnabled() throws Exception {
        RedisWebSocketBridge bridge = new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper);
        when(bridgeProvider.getIfAvailable()).thenReturn(bridge);
        StompPipelineEventListener listener = new StompPipelineEventListener(messagingTemplate, bridgeProvider);

        listener.onEvent("pipeline-execution_1", event);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq(RedisWebSocketBridge.REDIS_CHANNEL), json.capture());
        verify(messagingTemplate, never()).convertAndSend(anyString(), any(Object.class));

        JsonNode relayed = objectMapper.readTree(json.getValue());
        assertThat(relayed.get("destination").asText()).isEqualTo("/topic/pipeline-execution_1");
        assertThat(relayed.at("/payload/type").asText()).isEqualTo("node-start");
        assertThat(relayed.at("/payload/nodeId").asText()).isEqualTo("input-1");
    }

    @Test
    void relayedMessagesAreDeliveredToTheLocalBroker() {
        RedisWebSocketBridge bridge = new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper);
        String body = "{\"destination\":\"/topic/pipeline-execution_2\",\"payload\":{\"type\":\"log\"}}";

        bridge.onMessage(new DefaultMessage(RedisWebSocketBridge.REDIS_CHANNEL.getBytes(StandardCharsets.UTF_8),
                body.getBytes(StandardCharsets.UTF_8)), null);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/pipeline-execution_2"), payload.capture());
        assertThat(payload.getValue()).isInstanceOf(JsonNode.class);
        assertThat(((JsonNode) payload.getValue()).get("type").asText()).isEqualTo("log");
    }

    @Test
    void malformedRelayMessagesAreSkipped() {
        RedisWebSocketBridge bridge = new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper);

        bridge.onMessage(new DefaultMessage(RedisWebSocketBridge.REDIS_CHANNEL.getBytes(StandardCharsets.UTF_8),
                "not json".getBytes(StandardCharsets.UTF_8)), null);

        verify(messagingTemplate, never()).convertAndSend(anyString(), any(Object.class));
    }

    @Test
    void brokerFailureDoesNotEscapeTheListenerThread() {
        RedisWebSocketBridge bridge = new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper);
        doThrow(new MessageDeliveryException("broker down"))
                .when(messagingTemplate).convertAndSend(anyString(), any(Object.class));
        String body = "{\"destination\":\"/topic/pipeline-execution_3\",\"payload\":{\"type\":\"log\"}}";

        assertThatCode(() -> bridge.onMessage(new DefaultMessage(
                RedisWebSocketBridge.REDIS_CHANNEL.getBytes(StandardCharsets.UTF_8),
                body.getBytes(StandardCharsets.UTF_8)), null))
                .doesNotThrowAnyException();
    }
}
