package com.pipestudio.pipestudio_backend.model.domain;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

/** The pipeline as it looked when the execution was submitted, one stage entry per node. */
@Getter
public class ExecutionConfigSnapshot {

    private final String pipelineId;
    private final String name;
    private final String description;
    private final String outputPath;
    private final List<StageState> stages;

    public ExecutionConfigSnapshot(String pipelineId, String name, String description,
                                   String outputPath, List<StageState> stages) {
        this.pipelineId = pipelineId;
        this.name = name;
        this.description = description;
        this.outputPath = outputPath;
        this.stages = List.copyOf(stages);
    }

    public static ExecutionConfigSnapshot of(Pipeline pipeline, String outputsDir) {
        List<StageState> stages = pipeline.getNodes().stream()
                .map(n -> new StageState(n.getId(), n.getLabel(), n.getType()))
                .toList();
        String outputPath = outputsDir + "/" + pipeline.getId();
        return new ExecutionConfigSnapshot(pipeline.getId(), pipeline.getName(), pipeline.getDescription(),
                outputPath, stages);
    }

    public Optional<StageState> stage(String stageId) {
        return stages.stream().filter(s -> s.getId().equals(stageId)).findFirst();
    }
}
