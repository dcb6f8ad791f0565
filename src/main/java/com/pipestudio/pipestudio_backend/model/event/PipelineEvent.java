package com.pipestudio.pipestudio_backend.model.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineEvent {

    private PipelineEventType type;
    private String executionId;
    private String pipelineId;

    // Set for node-scoped events; stageId mirrors nodeId for worker-backed nodes
    private String nodeId;
    private String stageId;

    private Map<String, Object> data;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
