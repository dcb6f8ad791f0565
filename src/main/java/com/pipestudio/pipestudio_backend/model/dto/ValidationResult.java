package com.pipestudio.pipestudio_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response of the editor's "validate" action.
 * executionOrder is empty whenever the graph has a cycle.
 */
public record ValidationResult(
        @JsonProperty("isValid") boolean valid,
        List<String> errors,
        List<String> warnings,
        List<String> executionOrder
) {
    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        executionOrder = executionOrder != null ? List.copyOf(executionOrder) : List.of();
    }
}
