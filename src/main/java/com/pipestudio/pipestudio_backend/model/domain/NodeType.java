package com.pipestudio.pipestudio_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum NodeType {
    INPUT("input"),            // loads data: file, api, database, static
    PROCESSING("processing"),  // transform, filter, aggregate, script, stage
    AI("ai"),                  // llm, classification, generation, analysis
    OUTPUT("output"),          // file, api, database, display
    CONDITION("condition");    // routes to "true" / "false" handles

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /** Resolves the editor's type tag ("input", "ai", ...). Empty for anything outside the closed set. */
    public static Optional<NodeType> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.tag.equalsIgnoreCase(tag.trim()))
                .findFirst();
    }
}
