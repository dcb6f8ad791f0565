package com.pipestudio.pipestudio_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StageStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
