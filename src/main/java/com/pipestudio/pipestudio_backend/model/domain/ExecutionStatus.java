package com.pipestudio.pipestudio_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<ExecutionStatus> fromWireName(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.wireName().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
