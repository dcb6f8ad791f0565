package com.pipestudio.pipestudio_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AiNodeConfig {
    private String aiType;
    private String model;
    private String prompt;
    private String modelPath;
    private Map<String, Object> generatorConfig;
    private String analysisType;
}
