package com.pipestudio.pipestudio_backend.model.context;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Inputs and outputs of one node within one execution.
 *
 * Inputs are keyed by the source handle of the edge that delivered them ("default" when the edge
 * names none); each value is the producer's full output map. Two edges with the same handle: the
 * later edge wins. Contexts live in the coordinator's per-run table and are dropped with it.
 */
public class NodeExecutionContext {

    public static final String DATA_KEY = "data";

    @Getter private final String executionId;
    @Getter private final String pipelineId;
    @Getter private final String nodeId;

    private final Map<String, Object> inputs;
    private final Map<String, Object> outputs = new LinkedHashMap<>();
    private final Consumer<String> logSink;

    public NodeExecutionContext(String executionId, String pipelineId, String nodeId,
                                Map<String, Object> inputs, Consumer<String> logSink) {
        this.executionId = executionId;
        this.pipelineId = pipelineId;
        this.nodeId = nodeId;
        this.inputs = inputs != null ? new LinkedHashMap<>(inputs) : new LinkedHashMap<>();
        this.logSink = logSink != null ? logSink : line -> { };
    }

    public Map<String, Object> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    public Map<String, Object> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    public void recordOutputs(Map<String, Object> produced) {
        if (produced != null) outputs.putAll(produced);
    }

    /** The first upstream "data" payload, scanning handles in delivery order. Null when nothing upstream carries data. */
    @SuppressWarnings("unchecked")
    public Object upstreamData() {
        for (Object bag : inputs.values()) {
            if (bag instanceof Map<?, ?> map && map.containsKey(DATA_KEY)) {
                return ((Map<String, Object>) map).get(DATA_KEY);
            }
        }
        return null;
    }

    /** Union of every producer's outputs; later handles overwrite earlier keys. */
    @SuppressWarnings("unchecked")
    public Map<String, Object> mergedInputs() {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Object bag : inputs.values()) {
            if (bag instanceof Map<?, ?> map) {
                merged.putAll((Map<String, Object>) map);
            }
        }
        return merged;
    }

    public void log(String line) {
        logSink.accept(line);
    }

    public Consumer<String> logSink() {
        return logSink;
    }
}
