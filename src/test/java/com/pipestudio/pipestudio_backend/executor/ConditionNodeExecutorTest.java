package com.pipestudio.pipestudio_backend.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipestudio.pipestudio_backend.model.context.NodeExecutionContext;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionNodeExecutorTest {

    private final ConditionNodeExecutor executor =
            new ConditionNodeExecutor(new NodeConfigBinder(new ObjectMapper()), new PredicateEvaluator());

    private NodeExecutionContext contextWith(Map<String, Object> upstream) {
        return new NodeExecutionContext("exec-1", "p1", "cond-1", Map.of("default", upstream), null);
    }

    @Test
    void evaluatesAgainstUpstreamOutputsAndPassesDataOn() {
        PipelineNode node = PipelineNode.of("cond-1", "condition",
                Map.of("condition", Map.of("field", "status", "operator", "eq", "value", "saved")));
        List<Integer> rows = List.of(1, 2);

        Map<String, Object> out = executor.execute(node, contextWith(Map.of("status", "saved", "data", rows)));

        assertThat(out).containsEntry("condition", true).containsEntry("data", rows);
        assertThat(out.get("metadata")).asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsKey("evaluatedAt");
    }

    @Test
    void missingFieldEvaluatesFalse() {
        PipelineNode node = PipelineNode.of("cond-1", "condition",
                Map.of("condition", Map.of("field", "score", "operator", "gt", "value", 1)));

        assertThat(executor.execute(node, contextWith(Map.of("data", List.of()))))
                .containsEntry("condition", false);
    }

    @Test
    void nestedFieldOfUpstreamData() {
        PipelineNode node = PipelineNode.of("cond-1", "condition",
                Map.of("condition", Map.of("field", "data.total", "operator", "gte", "value", 100)));

        assertThat(executor.execute(node, contextWith(Map.of("data", Map.of("total", 120)))))
                .containsEntry("condition", true);
    }

    @Test
    void nodeWithoutConditionFails() {
        PipelineNode node = PipelineNode.of("cond-1", "condition", Map.of("label", "x"));

        assertThatThrownBy(() -> executor.execute(node, contextWith(Map.of())))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("no condition configured");
    }
}
