package com.pipestudio.pipestudio_backend.executor.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipestudio.pipestudio_backend.executor.NodeConfigBinder;
import com.pipestudio.pipestudio_backend.executor.NodeExecutionException;
import com.pipestudio.pipestudio_backend.model.context.NodeExecutionContext;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class InputNodeExecutorTest {

    @TempDir Path tempDir;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private InputNodeExecutor executor;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        executor = new InputNodeExecutor(new NodeConfigBinder(objectMapper), new DataFileCodec(objectMapper),
                restTemplate, objectMapper);
    }

    private Object load(Map<String, Object> config) {
        PipelineNode node = PipelineNode.of("input-1", "input", config);
        return executor.execute(node, new NodeExecutionContext("exec-1", "p1", "input-1", Map.of(), null)).get("data");
    }

    @Test
    void csvRowsBecomeRecordsKeyedByHeader() throws IOException {
        Path csv = Files.writeString(tempDir.resolve("input.csv"), "name,age\nada,36\nbob,25\n");

        Object data = load(Map.of("sourceType", "file", "filePath", csv.toString()));

        assertThat(data).isEqualTo(List.of(
                Map.of("name", "ada", "age", "36"),
                Map.of("name", "bob", "age", "25")));
    }

    @Test
    void jsonAndYamlAreParsed() throws IOException {
        Path json = Files.writeString(tempDir.resolve("input.json"), "[{\"id\": 1}]");
        Path yaml = Files.writeString(tempDir.resolve("input.yaml"), "threshold: 5\nlabels:\n  - a\n");

        assertThat(load(Map.of("sourceType", "file", "filePath", json.toString())))
                .isEqualTo(List.of(Map.of("id", 1)));
        assertThat(load(Map.of("sourceType", "file", "filePath", yaml.toString())))
                .isEqualTo(Map.of("threshold", 5, "labels", List.of("a")));
    }

    @Test
    void otherExtensionsAreRawText() throws IOException {
        Path txt = Files.writeString(tempDir.resolve("notes.txt"), "hello");

        assertThat(load(Map.of("sourceType", "file", "filePath", txt.toString()))).isEqualTo("hello");
    }

    @Test
    void missingFileFailsTheNode() {
        String path = tempDir.resolve("absent.csv").toString();

        assertThatThrownBy(() -> load(Map.of("sourceType", "file", "filePath", path)))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageStartingWith("Failed to load file " + path);
    }

    @Test
    void malformedJsonFailsTheNode() throws IOException {
        Path json = Files.writeString(tempDir.resolve("broken.json"), "{not json");

        assertThatThrownBy(() -> load(Map.of("sourceType", "file", "filePath", json.toString())))
                .isInstanceOf(NodeExecutionException.class);
    }

    @Test
    void apiSourceGetsAndParsesJson() {
        server.expect(requestTo("http://data.test/records"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-Key", "k1"))
                .andRespond(withSuccess("[{\"id\":7}]", MediaType.APPLICATION_JSON));

        Object data = load(Map.of("sourceType", "api", "apiEndpoint", "http://data.test/records",
                "headers", Map.of("X-Key", "k1")));

        assertThat(data).isEqualTo(List.of(Map.of("id", 7)));
        server.verify();
    }

    @Test
    void apiErrorFailsTheNode() {
        server.expect(requestTo("http://data.test/records"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> load(Map.of("sourceType", "api", "apiEndpoint", "http://data.test/records")))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageStartingWith("Failed to fetch from API http://data.test/records");
    }

    @Test
    void databaseSourceIsNotImplemented() {
        assertThatThrownBy(() -> load(Map.of("sourceType", "database", "query", "select 1")))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessage("Database integration not yet implemented");
    }

    @Test
    void staticAndUnknownSourcesYieldStaticData() {
        assertThat(load(Map.of("sourceType", "static", "staticData", List.of(1, 2)))).isEqualTo(List.of(1, 2));
        assertThat(load(Map.of("sourceType", "queue"))).isEqualTo(Map.of());
    }
}
