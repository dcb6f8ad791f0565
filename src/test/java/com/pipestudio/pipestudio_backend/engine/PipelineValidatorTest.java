package com.pipestudio.pipestudio_backend.engine;

import com.pipestudio.pipestudio_backend.model.domain.Connection;
import com.pipestudio.pipestudio_backend.model.domain.Pipeline;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import com.pipestudio.pipestudio_backend.model.dto.ValidationResult;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineValidatorTest {

    private final PipelineValidator validator = new PipelineValidator();

    private static PipelineNode input(String id) {
        return PipelineNode.of(id, "input", Map.of("sourceType", "static"));
    }

    private static PipelineNode processing(String id) {
        return PipelineNode.of(id, "processing", Map.of("processingType", "transform"));
    }

    private static Pipeline pipeline(List<PipelineNode> nodes, List<Connection> edges) {
        return Pipeline.builder().id("p1").name("test").nodes(nodes).edges(edges).build();
    }

    @Nested
    class Ordering {

        @Test
        void linearPipelineIsOrderedSourceFirst() {
            Pipeline p = pipeline(
                    List.of(processing("b"), input("a"), processing("c")),
                    List.of(Connection.of("e1", "a", "b"), Connection.of("e2", "b", "c")));

            ValidationResult result = validator.validate(p);

            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
            assertThat(result.executionOrder()).containsExactly("a", "b", "c");
        }

        @Test
        void independentNodesKeepNodeListOrder() {
            Pipeline p = pipeline(
                    List.of(input("x"), input("y"), processing("z")),
                    List.of(Connection.of("e1", "y", "z"), Connection.of("e2", "x", "z")));

            assertThat(validator.validate(p).executionOrder()).containsExactly("x", "y", "z");
        }

        @Test
        void everyEdgePointsForwardInRandomAcyclicGraphs() {
            Random random = new Random(42);
            for (int round = 0; round < 50; round++) {
                int size = 2 + random.nextInt(12);
                List<String> ids = new ArrayList<>();
                for (int i = 0; i < size; i++) ids.add("n" + i);

                // Edges only go from lower to higher index, so the graph is acyclic
                List<Connection> edges = new ArrayList<>();
                for (int i = 0; i < size; i++) {
                    for (int j = i + 1; j < size; j++) {
                        if (random.nextInt(4) == 0) {
                            edges.add(Connection.of("e" + i + "_" + j, ids.get(i), ids.get(j)));
                        }
                    }
                }
                List<PipelineNode> nodes = new ArrayList<>(ids.stream().map(PipelineValidatorTest::processing).toList());
                Collections.shuffle(nodes, random);

                ValidationResult result = validator.validate(pipeline(nodes, edges));

                assertThat(result.errors()).isEmpty();
                assertThat(result.executionOrder()).hasSize(size).containsExactlyInAnyOrderElementsOf(ids);
                for (Connection edge : edges) {
                    assertThat(result.executionOrder().indexOf(edge.getSource()))
                            .isLessThan(result.executionOrder().indexOf(edge.getTarget()));
                }
            }
        }

        @Test
        void validatingTwiceGivesTheSameOrder() {
            Pipeline p = pipeline(
                    List.of(input("a"), input("b"), processing("c"), processing("d")),
                    List.of(Connection.of("e1", "a", "c"), Connection.of("e2", "b", "c"), Connection.of("e3", "b", "d")));

            assertThat(validator.validate(p).executionOrder())
                    .isEqualTo(validator.validate(p).executionOrder());
        }
    }

    @Nested
    class StructuralErrors {

        @Test
        void cycleIsFatalAndYieldsNoOrder() {
            Pipeline p = pipeline(
                    List.of(processing("a"), processing("b"), processing("c")),
                    List.of(Connection.of("e1", "a", "b"), Connection.of("e2", "b", "c"), Connection.of("e3", "c", "a")));

            ValidationResult result = validator.validate(p);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).anyMatch(e -> e.contains("cycle"));
            assertThat(result.executionOrder()).isEmpty();
        }

        @Test
        void selfLoopIsACycle() {
            Pipeline p = pipeline(List.of(processing("a")), List.of(Connection.of("e1", "a", "a")));

            assertThat(validator.validate(p).errors()).anyMatch(e -> e.contains("cycle"));
        }

        @Test
        void danglingEdgeIsReportedAndLeftOutOfTheOrder() {
            Pipeline p = pipeline(
                    List.of(input("a"), processing("b")),
                    List.of(Connection.of("e1", "a", "b"), Connection.of("e2", "ghost", "b")));

            ValidationResult result = validator.validate(p);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("Connection e2 references missing source node: ghost");
            assertThat(result.executionOrder()).containsExactly("a", "b");
        }

        @Test
        void emptyPipelineIsInvalid() {
            ValidationResult result = validator.validate(pipeline(List.of(), List.of()));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("Pipeline has no nodes");
        }

        @Test
        void duplicateNodeIdIsAnError() {
            Pipeline p = pipeline(List.of(input("a"), input("a")), List.of());

            assertThat(validator.validate(p).errors()).contains("Duplicate node id: a");
        }
    }

    @Nested
    class Warnings {

        @Test
        void isolatedNodeIsWarnedOnlyWhenThereAreOthers() {
            Pipeline single = pipeline(List.of(input("a")), List.of());
            Pipeline pair = pipeline(List.of(input("a"), input("b")), List.of());

            assertThat(validator.validate(single).warnings()).isEmpty();
            assertThat(validator.validate(pair).warnings())
                    .contains("Node a is not connected to any other node", "Node b is not connected to any other node");
            assertThat(validator.validate(pair).valid()).isTrue();
        }

        @Test
        void emptyConfigAndMissingRequiredKeyAreWarnings() {
            Pipeline p = pipeline(
                    List.of(PipelineNode.of("a", "input", Map.of()),
                            PipelineNode.of("b", "ai", Map.of("model", "gpt")),
                            PipelineNode.of("c", "condition", Map.of("note", "x"))),
                    List.of(Connection.of("e1", "a", "b"), Connection.of("e2", "b", "c")));

            ValidationResult result = validator.validate(p);

            assertThat(result.valid()).isTrue();
            assertThat(result.warnings()).containsExactly(
                    "Node a has no configuration",
                    "Node b is missing required config: aiType",
                    "Node c is missing required config: condition");
        }

        @Test
        void unknownTypeIsAWarningNotAnError() {
            Pipeline p = pipeline(List.of(PipelineNode.of("m", "mystery", Map.of("x", 1))), List.of());

            ValidationResult result = validator.validate(p);

            assertThat(result.valid()).isTrue();
            assertThat(result.warnings()).containsExactly("Node m has unknown type: mystery");
            assertThat(result.executionOrder()).containsExactly("m");
        }
    }
}
