package com.pipestudio.pipestudio_backend.model.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PipelineEventType {
    PIPELINE_START("pipeline-start"),
    NODE_START("node-start"),
    NODE_COMPLETE("node-complete"),
    PIPELINE_COMPLETE("pipeline-complete"),
    PIPELINE_ERROR("pipeline-error"),
    LOG("log"),
    OUTPUT_DISPLAY("output-display");

    private final String wireName;

    PipelineEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
