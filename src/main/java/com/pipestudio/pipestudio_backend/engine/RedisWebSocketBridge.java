package com.pipestudio.pipestudio_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipestudio.pipestudio_backend.model.event.PipelineEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;

/**
 * Pipeline events in a multi-instance deployment. The instance running an execution publishes its
 * events to {@link #REDIS_CHANNEL} as {destination, payload} envelopes; every instance, itself
 * included, hands each envelope to its local STOMP broker, so an IDE watching
 * /topic/pipeline-{executionId} sees the run whichever instance it is connected to.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisWebSocketBridge implements MessageListener {

    public static final String REDIS_CHANNEL = "pipestudio:pipeline-events";

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public void publish(String destination, PipelineEvent event) {
        EventEnvelope envelope = new EventEnvelope(destination, objectMapper.valueToTree(event));
        try {
            redisTemplate.convertAndSend(REDIS_CHANNEL, objectMapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            log.error("Dropped {} event for {}: not serializable", event.getType(), destination, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        EventEnvelope envelope;
        try {
            envelope = objectMapper.readValue(body, EventEnvelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed message on {}: {}", REDIS_CHANNEL, e.getOriginalMessage());
            return;
        }
        // Runs on the Redis listener thread: a broker failure must not stop later deliveries
        try {
            messagingTemplate.convertAndSend(envelope.destination(), envelope.payload());
        } catch (MessagingException e) {
            log.warn("Could not deliver relayed event to {}: {}", envelope.destination(), e.getMessage());
        }
    }

    private record EventEnvelope(String destination, JsonNode payload) {}
}
