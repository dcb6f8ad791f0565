package com.pipestudio.pipestudio_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeData {

    private String label;

    // Type-dependent settings, e.g. sourceType/filePath for input nodes, aiType/model for ai nodes
    private Map<String, Object> config = new LinkedHashMap<>();
}
