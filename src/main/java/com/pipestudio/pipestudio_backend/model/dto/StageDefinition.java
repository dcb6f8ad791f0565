package com.pipestudio.pipestudio_backend.model.dto;

/** One stage of a stage pipeline. The worker script defaults to {@code <id>.py}. */
public record StageDefinition(String id, String name, String script) {

    public String scriptOrDefault() {
        return script != null && !script.isBlank() ? script : id + ".py";
    }
}
