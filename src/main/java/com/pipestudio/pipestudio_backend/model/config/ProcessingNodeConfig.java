package com.pipestudio.pipestudio_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessingNodeConfig {

    private String processingType;

    private List<TransformStep> transformations = new ArrayList<>();
    private List<PredicateClause> filters = new ArrayList<>();
    private List<AggregationSpec> aggregations = new ArrayList<>();

    // script: user code run in a worker process
    private String script;
    private String language = "python";

    // stage: a worker script from the stages directory
    private String stageScript;
    private String dataPath;
    private String outputPath;
    private Map<String, Object> modelConfig;
    private Map<String, Object> parameters = new LinkedHashMap<>();
}
