package com.pipestudio.pipestudio_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OutputNodeConfig {
    private String outputType;
    private String filePath;
    private String format;
    private String apiEndpoint;
    private String method = "POST";
    private String connectionString;
    private String table;
}
