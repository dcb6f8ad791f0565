package com.pipestudio.pipestudio_backend.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Binds a node's free-form config map onto the typed config class of its node type.
 */
@Component
@RequiredArgsConstructor
public class NodeConfigBinder {

    private final ObjectMapper objectMapper;

    public <T> T bind(PipelineNode node, Class<T> configType) {
        try {
            return objectMapper.convertValue(node.getConfig(), configType);
        } catch (IllegalArgumentException ex) {
            throw new NodeExecutionException(
                    "Malformed configuration for node " + node.getId() + ": " + ex.getMessage(), ex);
        }
    }
}
