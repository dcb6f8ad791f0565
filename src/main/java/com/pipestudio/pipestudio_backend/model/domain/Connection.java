package com.pipestudio.pipestudio_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Connection {

    public static final String DEFAULT_HANDLE = "default";

    private String id;
    private String source;
    private String target;

    // Condition nodes route through "true" / "false" source handles
    private String sourceHandle;
    private String targetHandle;

    public static Connection of(String id, String source, String target) {
        return new Connection(id, source, target, null, null);
    }

    public static Connection of(String id, String source, String target, String sourceHandle) {
        return new Connection(id, source, target, sourceHandle, null);
    }

    /** Key under which the producer's outputs land in the target's input bag. */
    @JsonIgnore
    public String getInputKey() {
        return sourceHandle != null && !sourceHandle.isBlank() ? sourceHandle.trim() : DEFAULT_HANDLE;
    }
}
