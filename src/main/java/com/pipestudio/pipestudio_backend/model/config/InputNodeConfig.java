package com.pipestudio.pipestudio_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * <pre>
 * { "sourceType": "file", "filePath": "data/input.csv" }
 * { "sourceType": "api", "apiEndpoint": "https://...", "headers": { "Authorization": "Bearer ..." } }
 * { "sourceType": "static", "staticData": { ... } }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class InputNodeConfig {
    private String sourceType;
    private String filePath;
    private String apiEndpoint;
    private Map<String, String> headers = new HashMap<>();
    private String connectionString;
    private String query;
    private Object staticData;
}
