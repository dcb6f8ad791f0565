package com.pipestudio.pipestudio_backend.executor.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipestudio.pipestudio_backend.executor.NodeConfigBinder;
import com.pipestudio.pipestudio_backend.executor.NodeExecutionException;
import com.pipestudio.pipestudio_backend.executor.NodeExecutor;
import com.pipestudio.pipestudio_backend.model.config.AiNodeConfig;
import com.pipestudio.pipestudio_backend.model.context.NodeExecutionContext;
import com.pipestudio.pipestudio_backend.model.domain.NodeType;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes AI nodes. Model invocation lives outside this service, so every aiType answers with a
 * placeholder result stamped with a timestamp.
 *
 * Output: { "result": placeholder, "data": placeholder }
 */
@Component
@RequiredArgsConstructor
public class AiNodeExecutor implements NodeExecutor {

    private static final String DATA_PLACEHOLDER = "{{data}}";
    private static final String DEFAULT_MODEL    = "default";

    private final NodeConfigBinder configBinder;
    private final ObjectMapper     objectMapper;

    @Override
    public NodeType supportedType() {
        return NodeType.AI;
    }

    @Override
    public Map<String, Object> execute(PipelineNode node, NodeExecutionContext context) {
        AiNodeConfig config = configBinder.bind(node, AiNodeConfig.class);
        Object data = context.upstreamData();
        String aiType = config.getAiType() != null ? config.getAiType().toLowerCase() : "";
        String model = config.getModel() != null ? config.getModel() : DEFAULT_MODEL;

        Map<String, Object> result = new LinkedHashMap<>();
        switch (aiType) {
            case "llm" -> {
                result.put("model", model);
                result.put("prompt", renderPrompt(config.getPrompt(), data));
                result.put("response", "Processed by " + model);
            }
            case "classification" -> {
                result.put("modelPath", config.getModelPath());
                result.put("predictions", List.of(Map.of("label", "placeholder", "confidence", 0.0)));
            }
            case "generation" -> {
                result.put("generatorConfig", config.getGeneratorConfig() != null ? config.getGeneratorConfig() : Map.of());
                result.put("generated", List.of());
            }
            case "analysis" -> {
                result.put("analysisType", config.getAnalysisType());
                result.put("analysis", Map.of("summary", "Analysis placeholder"));
            }
            default -> throw new NodeExecutionException("Unknown AI type: " + config.getAiType());
        }
        result.put("timestamp", Instant.now().toString());

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("result", result);
        outputs.put(NodeExecutionContext.DATA_KEY, result);
        return outputs;
    }

    private String renderPrompt(String prompt, Object data) {
        if (prompt == null) return "";
        if (!prompt.contains(DATA_PLACEHOLDER)) return prompt;
        try {
            return prompt.replace(DATA_PLACEHOLDER, objectMapper.writeValueAsString(data));
        } catch (JsonProcessingException e) {
            throw new NodeExecutionException("Could not render prompt data: " + e.getOriginalMessage(), e);
        }
    }
}
