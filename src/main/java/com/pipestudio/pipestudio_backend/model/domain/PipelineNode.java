package com.pipestudio.pipestudio_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One step of a pipeline, in the shape the editor sends it:
 * <pre>
 * { "id": "input-1", "type": "input", "position": {"x": 0, "y": 0},
 *   "data": { "label": "Load CSV", "config": { "sourceType": "file", "filePath": "data/input.csv" } } }
 * </pre>
 * The type stays a raw tag here so that an unknown tag survives deserialization and fails at execution time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineNode {

    private String id;
    private String type;
    private NodePosition position;
    private NodeData data;

    public static PipelineNode of(String id, String type, Map<String, Object> config) {
        return new PipelineNode(id, type, new NodePosition(0, 0),
                new NodeData(id, config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>()));
    }

    @JsonIgnore
    public Optional<NodeType> getNodeType() {
        return NodeType.fromTag(type);
    }

    @JsonIgnore
    public String getLabel() {
        return data != null && data.getLabel() != null ? data.getLabel() : id;
    }

    /** Never null; an absent config reads as empty. */
    @JsonIgnore
    public Map<String, Object> getConfig() {
        return data != null && data.getConfig() != null ? data.getConfig() : Map.of();
    }
}
