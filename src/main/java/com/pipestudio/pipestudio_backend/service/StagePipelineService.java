package com.pipestudio.pipestudio_backend.service;

import com.pipestudio.pipestudio_backend.model.domain.Connection;
import com.pipestudio.pipestudio_backend.model.domain.NodeType;
import com.pipestudio.pipestudio_backend.model.domain.Pipeline;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import com.pipestudio.pipestudio_backend.model.dto.StageDefinition;
import com.pipestudio.pipestudio_backend.model.dto.StagePipelineConfig;
import com.pipestudio.pipestudio_backend.model.dto.StagePipelineRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Stage pipelines: a fixed, linear sequence of worker scripts (ingestion through deployment).
 * They run through the regular engine as a chain of "stage" processing nodes.
 */
@Slf4j
@Service
public class StagePipelineService {

    static final List<StageDefinition> DEFAULT_STAGES = List.of(
            new StageDefinition("data_ingestion", "Data Ingestion", null),
            new StageDefinition("preprocessing",  "Data Preprocessing", null),
            new StageDefinition("model_training", "Model Training", null),
            new StageDefinition("evaluation",     "Model Evaluation", null),
            new StageDefinition("deployment",     "Model Deployment", null)
    );

    private static final String DEFAULT_DATA_PATH = "./data/sample_data.csv";
    private static final Pattern SAFE_PATH = Pattern.compile("^[a-zA-Z0-9/\\-_.]+$");

    private final PipelineService pipelineService;
    private final String outputsDir;

    public StagePipelineService(PipelineService pipelineService,
                                @Value("${pipeline.outputs-dir:./pipeline-outputs}") String outputsDir) {
        this.pipelineService = pipelineService;
        this.outputsDir = outputsDir;
    }

    public StagePipelineConfig create(StagePipelineRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Pipeline name is required");
        }
        checkPath("dataPath", request.dataPath());
        checkPath("outputPath", request.outputPath());

        String pipelineId = "pipeline_" + System.currentTimeMillis();
        return new StagePipelineConfig(
                pipelineId,
                request.name(),
                request.description() != null ? request.description() : "AI/ML Pipeline execution",
                DEFAULT_STAGES,
                request.dataPath() != null ? request.dataPath() : DEFAULT_DATA_PATH,
                request.modelConfig() != null ? request.modelConfig() : defaultModelConfig(),
                request.outputPath() != null ? request.outputPath() : outputsDir + "/" + pipelineId);
    }

    /** Converts the stage pipeline and submits it; returns the execution id. */
    public String execute(StagePipelineConfig config) {
        if (config == null || config.stages().isEmpty()) {
            throw new IllegalArgumentException("Pipeline configuration with stages is required");
        }
        checkPath("dataPath", config.dataPath());
        checkPath("outputPath", config.outputPath());
        return pipelineService.submit(toPipeline(config));
    }

    Pipeline toPipeline(StagePipelineConfig config) {
        String pipelineId = config.id() != null ? config.id() : "pipeline_" + System.currentTimeMillis();

        List<Map<String, Object>> stageList = new ArrayList<>();
        for (StageDefinition stage : config.stages()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", stage.id());
            entry.put("name", stage.name());
            entry.put("script", stage.scriptOrDefault());
            stageList.add(entry);
        }
        Map<String, Object> pipelineInfo = new LinkedHashMap<>();
        pipelineInfo.put("name", config.name());
        pipelineInfo.put("description", config.description());
        pipelineInfo.put("stages", stageList);

        List<PipelineNode> nodes = new ArrayList<>();
        List<Connection> edges = new ArrayList<>();
        String previous = null;
        for (StageDefinition stage : config.stages()) {
            Map<String, Object> nodeConfig = new LinkedHashMap<>();
            nodeConfig.put("processingType", "stage");
            nodeConfig.put("stageScript", stage.scriptOrDefault());
            nodeConfig.put("dataPath", config.dataPath());
            nodeConfig.put("outputPath", config.outputPath());
            nodeConfig.put("modelConfig", config.modelConfig());
            nodeConfig.put("parameters", Map.of("pipeline", pipelineInfo));

            PipelineNode node = PipelineNode.of(stage.id(), NodeType.PROCESSING.getTag(), nodeConfig);
            node.getData().setLabel(stage.name() != null ? stage.name() : stage.id());
            nodes.add(node);

            if (previous != null) {
                edges.add(Connection.of(previous + "->" + stage.id(), previous, stage.id()));
            }
            previous = stage.id();
        }

        log.debug("Converted stage pipeline {} into {} nodes", pipelineId, nodes.size());
        return Pipeline.builder()
                .id(pipelineId)
                .name(config.name())
                .description(config.description())
                .nodes(nodes)
                .edges(edges)
                .build();
    }

    private void checkPath(String field, String value) {
        if (value != null && !SAFE_PATH.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + field + ": only letters, digits, '/', '-', '_' and '.' are allowed");
        }
    }

    private Map<String, Object> defaultModelConfig() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("n_estimators", 100);
        parameters.put("max_depth", 10);
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("type", "classification");
        model.put("algorithm", "random_forest");
        model.put("parameters", parameters);
        return model;
    }
}
