package com.pipestudio.pipestudio_backend.executor;

import com.pipestudio.pipestudio_backend.model.domain.NodeType;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class NodeExecutorRegistry {

    private final List<NodeExecutor> executors;
    private final Map<NodeType, NodeExecutor> registry = new EnumMap<>(NodeType.class);

    @PostConstruct
    public void init() {
        executors.forEach(executor -> registry.put(executor.supportedType(), executor));
    }

    public NodeExecutor get(PipelineNode node) {
        NodeType type = node.getNodeType()
                .orElseThrow(() -> new NodeExecutionException("Unknown node type: " + node.getType()));
        NodeExecutor executor = registry.get(type);
        if (executor == null) {
            throw new NodeExecutionException("No executor registered for node type: " + type.getTag());
        }
        return executor;
    }
}
