package com.pipestudio.pipestudio_backend.executor;

import com.pipestudio.pipestudio_backend.model.config.ConditionNodeConfig;
import com.pipestudio.pipestudio_backend.model.context.NodeExecutionContext;
import com.pipestudio.pipestudio_backend.model.domain.NodeType;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes CONDITION nodes.
 *
 * Config: { "condition": { "field": "data.total", "operator": "gt", "value": 100 } }
 *
 * The clause is evaluated against the union of all upstream outputs. Output:
 * { "condition": true|false, "data": upstream data, "metadata": { "evaluatedAt": ... } }
 * Outgoing edges with source handle "true" / "false" only deliver when they match the result.
 */
@Component
@RequiredArgsConstructor
public class ConditionNodeExecutor implements NodeExecutor {

    public static final String CONDITION_KEY = "condition";

    private final NodeConfigBinder   configBinder;
    private final PredicateEvaluator predicates;

    @Override
    public NodeType supportedType() {
        return NodeType.CONDITION;
    }

    @Override
    public Map<String, Object> execute(PipelineNode node, NodeExecutionContext context) {
        ConditionNodeConfig config = configBinder.bind(node, ConditionNodeConfig.class);
        if (config.getCondition() == null) {
            throw new NodeExecutionException("Condition node " + node.getId() + " has no condition configured");
        }

        boolean result = predicates.test(context.mergedInputs(), config.getCondition());

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put(CONDITION_KEY, result);
        outputs.put(NodeExecutionContext.DATA_KEY, context.upstreamData());
        outputs.put("metadata", Map.of("evaluatedAt", Instant.now().toString()));
        return outputs;
    }
}
