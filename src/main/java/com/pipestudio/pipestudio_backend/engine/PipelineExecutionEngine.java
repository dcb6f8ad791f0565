package com.pipestudio.pipestudio_backend.engine;

import com.pipestudio.pipestudio_backend.executor.ConditionNodeExecutor;
import com.pipestudio.pipestudio_backend.executor.NodeExecutorRegistry;
import com.pipestudio.pipestudio_backend.model.context.NodeExecutionContext;
import com.pipestudio.pipestudio_backend.model.domain.Connection;
import com.pipestudio.pipestudio_backend.model.domain.ExecutionConfigSnapshot;
import com.pipestudio.pipestudio_backend.model.domain.NodeType;
import com.pipestudio.pipestudio_backend.model.domain.Pipeline;
import com.pipestudio.pipestudio_backend.model.domain.PipelineExecution;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import com.pipestudio.pipestudio_backend.model.domain.StageState;
import com.pipestudio.pipestudio_backend.model.event.PipelineEvent;
import com.pipestudio.pipestudio_backend.model.event.PipelineEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Drives one execution: registers it, walks the execution order and runs each node in turn.
 *
 * Nodes run strictly one after another. Each node sees the outputs of its already-executed
 * producers, keyed by edge source handle. An edge leaving a condition node through the "true" or
 * "false" handle only delivers when it matches the condition result; the target still runs.
 * The first failing node ends the run with status error and nothing after it executes.
 * A stop request is honoured at the next node boundary.
 */
@Slf4j
@Service
public class PipelineExecutionEngine {

    private static final String EXECUTION_ID_PREFIX = "execution_";

    private final NodeExecutorRegistry executorRegistry;
    private final PipelineEventEmitter events;
    private final ExecutionRegistry    registry;
    private final String               outputsDir;

    public PipelineExecutionEngine(NodeExecutorRegistry executorRegistry,
                                   PipelineEventEmitter events,
                                   ExecutionRegistry registry,
                                   @Value("${pipeline.outputs-dir:./pipeline-outputs}") String outputsDir) {
        this.executorRegistry = executorRegistry;
        this.events = events;
        this.registry = registry;
        this.outputsDir = outputsDir;
    }

    /** Creates and registers a RUNNING execution for the pipeline. No node runs yet. */
    public PipelineExecution start(Pipeline pipeline) {
        String executionId = EXECUTION_ID_PREFIX + UUID.randomUUID();
        PipelineExecution execution = new PipelineExecution(
                executionId, ExecutionConfigSnapshot.of(pipeline, outputsDir), Instant.now());
        registry.register(execution);
        log.info("Registered execution {} for pipeline {} ({} nodes)",
                executionId, pipeline.getId(), pipeline.getNodes().size());
        return execution;
    }

    /**
     * Runs the nodes of {@code executionOrder} on the calling thread until the execution completes,
     * fails or is stopped.
     */
    public void run(PipelineExecution execution, Pipeline pipeline, List<String> executionOrder) {
        String executionId = execution.getId();
        int total = executionOrder.size();

        emit(execution, PipelineEventType.PIPELINE_START, null, data(
                "executionId", executionId,
                "pipelineId", pipeline.getId(),
                "nodeCount", total));

        // Outputs of executed nodes; lives only for this run
        Map<String, Map<String, Object>> producedOutputs = new HashMap<>();
        int completed = 0;

        for (String nodeId : executionOrder) {
            if (!execution.isRunning()) {
                log.info("Execution {} is no longer running, skipping remaining nodes", executionId);
                return;
            }

            PipelineNode node = pipeline.findNode(nodeId)
                    .orElseThrow(() -> new IllegalStateException("Execution order names unknown node " + nodeId));
            StageState stage = execution.getConfig().stage(nodeId).orElse(null);

            execution.enterStage(nodeId);
            if (stage != null) stage.markRunning(Instant.now());
            emit(execution, PipelineEventType.NODE_START, nodeId, data(
                    "nodeId", nodeId,
                    "nodeName", node.getLabel(),
                    "progress", execution.getProgress()));

            Consumer<String> logSink = stage != null ? stage::appendLog : line -> { };
            NodeExecutionContext context = new NodeExecutionContext(
                    executionId, pipeline.getId(), nodeId, gatherInputs(pipeline, nodeId, producedOutputs), logSink);

            try {
                context.recordOutputs(executorRegistry.get(node).execute(node, context));
            } catch (Exception e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("Node {} ({}) failed in execution {}: {}", nodeId, node.getType(), executionId, message);
                Instant now = Instant.now();
                if (stage != null) stage.markFailed(message, now);
                if (execution.fail(message, now)) {
                    emit(execution, PipelineEventType.PIPELINE_ERROR, nodeId, data(
                            "executionId", executionId,
                            "nodeId", nodeId,
                            "error", message));
                }
                return;
            }

            // Stopped while the node ran: the stop already emitted the terminal event
            if (!execution.isRunning()) {
                if (stage != null) stage.markFailed(execution.getError(), Instant.now());
                return;
            }

            Map<String, Object> outputs = new LinkedHashMap<>(context.getOutputs());
            producedOutputs.put(nodeId, outputs);
            execution.putResult(nodeId, outputs);
            if (stage != null) stage.markCompleted(Instant.now());

            completed++;
            execution.updateProgress(completed * 100 / total);
            emit(execution, PipelineEventType.NODE_COMPLETE, nodeId, data(
                    "nodeId", nodeId,
                    "nodeName", node.getLabel(),
                    "progress", execution.getProgress(),
                    "outputs", outputs));
        }

        if (execution.complete(Instant.now())) {
            log.info("Execution {} completed in {} ms", executionId, execution.getDurationMs());
            emit(execution, PipelineEventType.PIPELINE_COMPLETE, null, data(
                    "executionId", executionId,
                    "duration", execution.getDurationMs()));
        }
    }

    // ── Input gathering ───────────────────────────────────────────────────────

    private Map<String, Object> gatherInputs(Pipeline pipeline, String nodeId,
                                             Map<String, Map<String, Object>> producedOutputs) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        for (Connection edge : pipeline.getEdges()) {
            if (!nodeId.equals(edge.getTarget())) continue;

            Map<String, Object> produced = producedOutputs.get(edge.getSource());
            if (produced == null) continue;
            if (!branchTaken(pipeline, edge, produced)) continue;

            inputs.put(edge.getInputKey(), produced);
        }
        return inputs;
    }

    private boolean branchTaken(Pipeline pipeline, Connection edge, Map<String, Object> produced) {
        String handle = edge.getInputKey();
        if (!"true".equals(handle) && !"false".equals(handle)) return true;

        boolean fromCondition = pipeline.findNode(edge.getSource())
                .flatMap(PipelineNode::getNodeType)
                .filter(type -> type == NodeType.CONDITION)
                .isPresent();
        if (!fromCondition) return true;

        Object result = produced.get(ConditionNodeExecutor.CONDITION_KEY);
        return handle.equals(String.valueOf(Boolean.TRUE.equals(result)));
    }

    // ── Events ────────────────────────────────────────────────────────────────

    private void emit(PipelineExecution execution, PipelineEventType type, String nodeId, Map<String, Object> data) {
        events.emit(PipelineEvent.builder()
                .type(type)
                .executionId(execution.getId())
                .pipelineId(execution.getConfig().getPipelineId())
                .nodeId(nodeId)
                .data(data)
                .build());
    }

    private static Map<String, Object> data(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
