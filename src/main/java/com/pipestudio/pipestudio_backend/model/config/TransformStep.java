package com.pipestudio.pipestudio_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a transform node, applied in list order:
 * <pre>
 * { "type": "map",   "fields": { "fullName": "name", "years": "age" } }   // target field -> source field
 * { "type": "sort",  "key": "age", "order": "desc" }
 * { "type": "group", "key": "department" }
 * { "type": "noop" }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransformStep {
    private String type;
    private Map<String, String> fields = new LinkedHashMap<>();
    private String key;
    private String order;
}
