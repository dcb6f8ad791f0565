package com.pipestudio.pipestudio_backend.executor.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipestudio.pipestudio_backend.executor.NodeConfigBinder;
import com.pipestudio.pipestudio_backend.executor.NodeExecutionException;
import com.pipestudio.pipestudio_backend.executor.NodeExecutor;
import com.pipestudio.pipestudio_backend.model.config.InputNodeConfig;
import com.pipestudio.pipestudio_backend.model.context.NodeExecutionContext;
import com.pipestudio.pipestudio_backend.model.domain.NodeType;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes INPUT nodes.
 *
 * Config shape:
 * {
 *   "sourceType": "file" | "api" | "database" | "static",
 *   "filePath":    "data/input.csv",
 *   "apiEndpoint": "https://api.example.com/records",
 *   "headers":     { "Authorization": "Bearer ..." },
 *   "staticData":  [ ... ]
 * }
 *
 * Output: { "data": loaded payload }. Any other source type yields staticData (or an empty map).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputNodeExecutor implements NodeExecutor {

    private final NodeConfigBinder configBinder;
    private final DataFileCodec    dataFiles;
    private final RestTemplate     restTemplate;
    private final ObjectMapper     objectMapper;

    @Override
    public NodeType supportedType() {
        return NodeType.INPUT;
    }

    @Override
    public Map<String, Object> execute(PipelineNode node, NodeExecutionContext context) {
        InputNodeConfig config = configBinder.bind(node, InputNodeConfig.class);
        String sourceType = config.getSourceType() != null ? config.getSourceType().toLowerCase() : "";

        Object data = switch (sourceType) {
            case "file"     -> loadFile(config.getFilePath());
            case "api"      -> fetch(config.getApiEndpoint(), config.getHeaders());
            case "database" -> throw new NodeExecutionException("Database integration not yet implemented");
            default         -> config.getStaticData() != null ? config.getStaticData() : new LinkedHashMap<>();
        };

        context.log("Loaded " + describe(data) + " from " + (sourceType.isEmpty() ? "static" : sourceType) + " source");

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put(NodeExecutionContext.DATA_KEY, data);
        return outputs;
    }

    private Object loadFile(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            throw new NodeExecutionException("File input requires a filePath");
        }
        try {
            return dataFiles.read(Path.of(filePath));
        } catch (IOException | RuntimeException e) {
            throw new NodeExecutionException("Failed to load file " + filePath + ": " + e.getMessage(), e);
        }
    }

    private Object fetch(String endpoint, Map<String, String> headers) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new NodeExecutionException("API input requires an apiEndpoint");
        }
        try {
            HttpHeaders httpHeaders = new HttpHeaders();
            httpHeaders.setAccept(List.of(MediaType.APPLICATION_JSON));
            if (headers != null) headers.forEach(httpHeaders::set);

            ResponseEntity<String> response = restTemplate.exchange(
                    endpoint, HttpMethod.GET, new HttpEntity<>(httpHeaders), String.class);
            String body = response.getBody();
            return body == null || body.isBlank() ? null : objectMapper.readValue(body, Object.class);

        } catch (RestClientException e) {
            throw new NodeExecutionException("Failed to fetch from API " + endpoint + ": " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new NodeExecutionException("API " + endpoint + " did not return valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String describe(Object data) {
        if (data instanceof List<?> list) return list.size() + " record(s)";
        return data == null ? "nothing" : data.getClass().getSimpleName();
    }
}
