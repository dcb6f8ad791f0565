package com.pipestudio.pipestudio_backend.engine;

import com.pipestudio.pipestudio_backend.model.domain.Connection;
import com.pipestudio.pipestudio_backend.model.domain.NodeType;
import com.pipestudio.pipestudio_backend.model.domain.Pipeline;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import com.pipestudio.pipestudio_backend.model.dto.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural check of a pipeline graph and computation of its execution order.
 *
 * Errors (the pipeline must not run): no nodes, duplicate node ids, edges pointing at unknown
 * nodes, cycles. Dangling edges are reported and left out of the ordering. On a cycle the
 * execution order is empty.
 *
 * Warnings (informational): isolated nodes when there is more than one node, empty config,
 * missing required config key for the node type, unrecognised type tag.
 *
 * Ordering is Kahn's algorithm with a FIFO queue seeded in node-list order, so the same graph
 * always yields the same order.
 */
@Component
public class PipelineValidator {

    private static final Map<NodeType, String> REQUIRED_CONFIG_KEY = Map.of(
            NodeType.INPUT,      "sourceType",
            NodeType.PROCESSING, "processingType",
            NodeType.AI,         "aiType",
            NodeType.OUTPUT,     "outputType",
            NodeType.CONDITION,  "condition"
    );

    public ValidationResult validate(Pipeline pipeline) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<PipelineNode> nodes = pipeline.getNodes();

        if (nodes.isEmpty()) {
            errors.add("Pipeline has no nodes");
            return new ValidationResult(false, errors, warnings, List.of());
        }

        // Adjacency and in-degree keyed by node id, in node-list order
        Map<String, List<String>> successors = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (PipelineNode node : nodes) {
            if (node.getId() == null || node.getId().isBlank()) {
                errors.add("Node without an id");
                continue;
            }
            if (successors.containsKey(node.getId())) {
                errors.add("Duplicate node id: " + node.getId());
                continue;
            }
            successors.put(node.getId(), new ArrayList<>());
            inDegree.put(node.getId(), 0);
        }

        Set<String> connected = new HashSet<>();
        for (Connection edge : pipeline.getEdges()) {
            boolean sourceKnown = successors.containsKey(edge.getSource());
            boolean targetKnown = successors.containsKey(edge.getTarget());
            if (!sourceKnown) {
                errors.add("Connection " + edge.getId() + " references missing source node: " + edge.getSource());
            }
            if (!targetKnown) {
                errors.add("Connection " + edge.getId() + " references missing target node: " + edge.getTarget());
            }
            if (!sourceKnown || !targetKnown) continue;

            successors.get(edge.getSource()).add(edge.getTarget());
            inDegree.merge(edge.getTarget(), 1, Integer::sum);
            connected.add(edge.getSource());
            connected.add(edge.getTarget());
        }

        List<String> order = topologicalOrder(successors, inDegree);
        if (order.size() < successors.size()) {
            errors.add("Pipeline contains a cycle");
            order = List.of();
        }

        collectWarnings(nodes, connected, warnings);
        return new ValidationResult(errors.isEmpty(), errors, warnings, order);
    }

    private List<String> topologicalOrder(Map<String, List<String>> successors, Map<String, Integer> inDegree) {
        Map<String, Integer> remaining = new LinkedHashMap<>(inDegree);
        Deque<String> ready = new ArrayDeque<>();
        remaining.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });

        List<String> order = new ArrayList<>(successors.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String next : successors.get(id)) {
                if (remaining.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return order;
    }

    private void collectWarnings(List<PipelineNode> nodes, Set<String> connected, List<String> warnings) {
        for (PipelineNode node : nodes) {
            if (node.getId() == null) continue;

            if (nodes.size() > 1 && !connected.contains(node.getId())) {
                warnings.add("Node " + node.getId() + " is not connected to any other node");
            }

            if (node.getNodeType().isEmpty()) {
                warnings.add("Node " + node.getId() + " has unknown type: " + node.getType());
            }

            if (node.getConfig().isEmpty()) {
                warnings.add("Node " + node.getId() + " has no configuration");
                continue;
            }

            node.getNodeType()
                    .map(REQUIRED_CONFIG_KEY::get)
                    .filter(key -> node.getConfig().get(key) == null)
                    .ifPresent(key -> warnings.add("Node " + node.getId() + " is missing required config: " + key));
        }
    }
}
