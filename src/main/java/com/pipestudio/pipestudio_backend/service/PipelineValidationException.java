package com.pipestudio.pipestudio_backend.service;

import lombok.Getter;

import java.util.List;

/** Thrown when a pipeline is submitted with structural errors; nothing was registered or run. */
@Getter
public class PipelineValidationException extends RuntimeException {

    private final List<String> errors;

    public PipelineValidationException(List<String> errors) {
        super("Pipeline validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
