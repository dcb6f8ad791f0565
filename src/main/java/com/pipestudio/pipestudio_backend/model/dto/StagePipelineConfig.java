package com.pipestudio.pipestudio_backend.model.dto;

import java.util.List;
import java.util.Map;

/**
 * A linear, script-backed pipeline: each stage runs one worker script against a shared
 * run-configuration file.
 */
public record StagePipelineConfig(
        String id,
        String name,
        String description,
        List<StageDefinition> stages,
        String dataPath,
        Map<String, Object> modelConfig,
        String outputPath
) {
    public List<StageDefinition> stages() {
        return stages != null ? stages : List.of();
    }
}
