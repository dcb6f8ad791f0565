package com.pipestudio.pipestudio_backend.model.dto;

import java.util.Map;

/**
 * Request body for POST /api/pipeline/stages/create.
 */
public record StagePipelineRequest(
        String name,
        String description,
        String dataPath,
        String outputPath,
        Map<String, Object> modelConfig
) {}
