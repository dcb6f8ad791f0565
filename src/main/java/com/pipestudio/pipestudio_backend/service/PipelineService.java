package com.pipestudio.pipestudio_backend.service;

import com.pipestudio.pipestudio_backend.engine.ExecutionRegistry;
import com.pipestudio.pipestudio_backend.engine.PipelineEventEmitter;
import com.pipestudio.pipestudio_backend.engine.PipelineExecutionEngine;
import com.pipestudio.pipestudio_backend.engine.PipelineValidator;
import com.pipestudio.pipestudio_backend.model.domain.Pipeline;
import com.pipestudio.pipestudio_backend.model.domain.PipelineExecution;
import com.pipestudio.pipestudio_backend.model.dto.ValidationResult;
import com.pipestudio.pipestudio_backend.model.event.PipelineEvent;
import com.pipestudio.pipestudio_backend.model.event.PipelineEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for the REST layer: validate, submit, inspect and stop pipeline executions.
 *
 * Submission validates first and registers the execution before returning its id; the run itself
 * happens on the pipeline task executor. A history row is written whenever a run ends.
 */
@Slf4j
@Service
public class PipelineService {

    static final String STOPPED_MESSAGE = "Execution stopped by request";

    private final PipelineValidator       validator;
    private final PipelineExecutionEngine engine;
    private final ExecutionRegistry       registry;
    private final PipelineEventEmitter    events;
    private final ExecutionHistoryService history;
    private final TaskExecutor            taskExecutor;

    public PipelineService(PipelineValidator validator,
                           PipelineExecutionEngine engine,
                           ExecutionRegistry registry,
                           PipelineEventEmitter events,
                           ExecutionHistoryService history,
                           @Qualifier("pipelineTaskExecutor") TaskExecutor taskExecutor) {
        this.validator = validator;
        this.engine = engine;
        this.registry = registry;
        this.events = events;
        this.history = history;
        this.taskExecutor = taskExecutor;
    }

    public ValidationResult validate(Pipeline pipeline) {
        return validator.validate(pipeline);
    }

    /**
     * Validates and starts the pipeline in the background.
     *
     * @return the new execution id
     * @throws PipelineValidationException when the pipeline is empty or structurally invalid
     */
    public String submit(Pipeline pipeline) {
        ValidationResult validation = validator.validate(pipeline);
        if (!validation.valid()) {
            log.warn("Rejected pipeline {}: {}", pipeline.getId(), validation.errors());
            throw new PipelineValidationException(validation.errors());
        }

        PipelineExecution execution = engine.start(pipeline);
        List<String> order = validation.executionOrder();
        taskExecutor.execute(() -> runInBackground(execution, pipeline, order));
        return execution.getId();
    }

    public Optional<PipelineExecution> status(String executionId) {
        return registry.find(executionId);
    }

    /** Stops the execution; unknown or already finished ids are a no-op. */
    public void stop(String executionId) {
        registry.stop(executionId, STOPPED_MESSAGE).ifPresent(execution -> {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("executionId", executionId);
            data.put("error", STOPPED_MESSAGE);
            data.put("cancelled", true);
            events.emit(PipelineEvent.builder()
                    .type(PipelineEventType.PIPELINE_ERROR)
                    .executionId(executionId)
                    .pipelineId(execution.getConfig().getPipelineId())
                    .nodeId(execution.getCurrentStage())
                    .data(data)
                    .build());
            history.record(execution);
        });
    }

    private void runInBackground(PipelineExecution execution, Pipeline pipeline, List<String> order) {
        try {
            engine.run(execution, pipeline, order);
        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Execution {} of pipeline {} failed: {}", execution.getId(), pipeline.getId(), msg, ex);
            if (execution.fail(msg, Instant.now())) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("executionId", execution.getId());
                data.put("error", msg);
                events.emit(PipelineEvent.builder()
                        .type(PipelineEventType.PIPELINE_ERROR)
                        .executionId(execution.getId())
                        .pipelineId(pipeline.getId())
                        .data(data)
                        .build());
            }
        } finally {
            history.record(execution);
        }
    }
}
