package com.pipestudio.pipestudio_backend.executor.impl;

import com.pipestudio.pipestudio_backend.engine.PipelineEventEmitter;
import com.pipestudio.pipestudio_backend.executor.NodeConfigBinder;
import com.pipestudio.pipestudio_backend.executor.NodeExecutionException;
import com.pipestudio.pipestudio_backend.executor.NodeExecutor;
import com.pipestudio.pipestudio_backend.model.config.OutputNodeConfig;
import com.pipestudio.pipestudio_backend.model.context.NodeExecutionContext;
import com.pipestudio.pipestudio_backend.model.domain.NodeType;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import com.pipestudio.pipestudio_backend.model.event.PipelineEvent;
import com.pipestudio.pipestudio_backend.model.event.PipelineEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes OUTPUT nodes: persists or displays the upstream {@code data}.
 *
 * outputType file writes json / csv / yaml (plain text otherwise), creating parent directories.
 * api sends the data as a JSON body with the configured method (POST by default).
 * display publishes an output-display event instead of persisting.
 * database always fails.
 *
 * Output: { "status": "saved", "data": data }
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutputNodeExecutor implements NodeExecutor {

    private final NodeConfigBinder     configBinder;
    private final DataFileCodec        dataFiles;
    private final RestTemplate         restTemplate;
    private final PipelineEventEmitter events;

    @Override
    public NodeType supportedType() {
        return NodeType.OUTPUT;
    }

    @Override
    public Map<String, Object> execute(PipelineNode node, NodeExecutionContext context) {
        OutputNodeConfig config = configBinder.bind(node, OutputNodeConfig.class);
        Object data = context.upstreamData();
        String outputType = config.getOutputType() != null ? config.getOutputType().toLowerCase() : "";

        switch (outputType) {
            case "file"     -> writeFile(config, data, context);
            case "api"      -> send(config, data, context);
            case "database" -> throw new NodeExecutionException("Database save operation not yet implemented");
            case "display"  -> display(node, data, context);
            default         -> log.debug("Output node {} has outputType '{}', nothing to persist", node.getId(), outputType);
        }

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("status", "saved");
        outputs.put(NodeExecutionContext.DATA_KEY, data);
        return outputs;
    }

    private void writeFile(OutputNodeConfig config, Object data, NodeExecutionContext context) {
        if (config.getFilePath() == null || config.getFilePath().isBlank()) {
            throw new NodeExecutionException("File output requires a filePath");
        }
        try {
            dataFiles.write(Path.of(config.getFilePath()), data, config.getFormat());
            context.log("Wrote " + config.getFilePath());
        } catch (IOException | RuntimeException e) {
            throw new NodeExecutionException("Failed to write file " + config.getFilePath() + ": " + e.getMessage(), e);
        }
    }

    private void send(OutputNodeConfig config, Object data, NodeExecutionContext context) {
        if (config.getApiEndpoint() == null || config.getApiEndpoint().isBlank()) {
            throw new NodeExecutionException("API output requires an apiEndpoint");
        }
        String method = config.getMethod() != null ? config.getMethod().toUpperCase() : "POST";
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            restTemplate.exchange(config.getApiEndpoint(), HttpMethod.valueOf(method),
                    new HttpEntity<>(data, headers), String.class);
            context.log(method + " " + config.getApiEndpoint());
        } catch (RestClientException e) {
            throw new NodeExecutionException("Failed to send data to API " + config.getApiEndpoint() + ": " + e.getMessage(), e);
        }
    }

    private void display(PipelineNode node, Object data, NodeExecutionContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("nodeId", node.getId());
        payload.put("output", data);
        events.emit(PipelineEvent.builder()
                .type(PipelineEventType.OUTPUT_DISPLAY)
                .executionId(context.getExecutionId())
                .pipelineId(context.getPipelineId())
                .nodeId(node.getId())
                .data(payload)
                .build());
    }
}
