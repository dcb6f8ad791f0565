package com.pipestudio.pipestudio_backend.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes the run-configuration file a worker receives as its first argument.
 * Stage workers read YAML, script harnesses read JSON.
 */
@Component
@RequiredArgsConstructor
public class RunConfigWriter {

    private final ObjectMapper objectMapper;
    private final YAMLMapper yamlMapper = new YAMLMapper();

    public Path writeYaml(Path file, Map<String, Object> config) throws IOException {
        return write(file, yamlMapper.writeValueAsString(config));
    }

    public Path writeJson(Path file, Map<String, Object> config) throws IOException {
        return write(file, objectMapper.writeValueAsString(config));
    }

    private Path write(Path file, String content) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.writeString(file, content);
    }
}
