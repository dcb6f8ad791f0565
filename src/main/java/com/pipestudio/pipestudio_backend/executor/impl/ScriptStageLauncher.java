package com.pipestudio.pipestudio_backend.executor.impl;

import com.pipestudio.pipestudio_backend.engine.RunConfigWriter;
import com.pipestudio.pipestudio_backend.engine.StageProcessRunner;
import com.pipestudio.pipestudio_backend.engine.StageResult;
import com.pipestudio.pipestudio_backend.engine.StageSpec;
import com.pipestudio.pipestudio_backend.executor.NodeExecutionException;
import com.pipestudio.pipestudio_backend.model.config.ProcessingNodeConfig;
import com.pipestudio.pipestudio_backend.model.context.NodeExecutionContext;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prepares and launches the worker process behind "script" and "stage" processing nodes.
 *
 * script: the user's code is wrapped in a harness that reads a JSON run-config
 *         (node inputs plus upstream data), runs the code and prints
 *         {"status":"success","data":result}. An exception exits non-zero with the message on stderr.
 *         Inside the code, {@code input} is the input bag, {@code data} the upstream data and
 *         {@code result} the value handed downstream.
 *
 * stage:  runs {@code <interpreter> <stages.dir>/<script> <run-config.yaml> <stageId>} where the
 *         YAML carries the pipeline, data paths, model settings and the node's parameters.
 *
 * Run-config files and harnesses live under {@code <workspace-dir>/<executionId>/<nodeId>/}.
 */
@Slf4j
@Component
public class ScriptStageLauncher {

    private static final String USER_CODE = "{{USER_CODE}}";

    private static final String PYTHON_HARNESS = """
            import json, sys

            with open(sys.argv[1]) as f:
                config = json.load(f)

            input = config.get("inputs", {})
            data = config.get("data")
            result = data

            try:
            {{USER_CODE}}
                pass
            except Exception as e:
                sys.stderr.write(str(e) + "\\n")
                sys.exit(1)

            print(json.dumps({"status": "success", "data": result}))
            """;

    private static final String JAVASCRIPT_HARNESS = """
            const fs     = require('fs');
            const config = JSON.parse(fs.readFileSync(process.argv[2], 'utf8'));
            const input  = config.inputs || {};
            const data   = config.data === undefined ? null : config.data;

            try {
                const result = (function(input, data) {
            {{USER_CODE}}
                })(input, data);
                process.stdout.write(JSON.stringify({ status: 'success', data: result === undefined ? data : result }) + '\\n');
            } catch (e) {
                process.stderr.write(String(e && e.message ? e.message : e) + '\\n');
                process.exit(1);
            }
            """;

    private final StageProcessRunner processRunner;
    private final RunConfigWriter    runConfigWriter;
    private final Path               workspaceDir;
    private final Path               stagesDir;
    private final String             pythonInterpreter;
    private final String             javascriptInterpreter;
    private final String             outputsDir;

    public ScriptStageLauncher(StageProcessRunner processRunner,
                               RunConfigWriter runConfigWriter,
                               @Value("${pipeline.workspace-dir:./pipeline-runs}") String workspaceDir,
                               @Value("${pipeline.stages.dir:./ml-pipeline/stages}") String stagesDir,
                               @Value("${pipeline.stages.interpreter:python3}") String pythonInterpreter,
                               @Value("${pipeline.script.javascript-interpreter:node}") String javascriptInterpreter,
                               @Value("${pipeline.outputs-dir:./pipeline-outputs}") String outputsDir) {
        this.processRunner = processRunner;
        this.runConfigWriter = runConfigWriter;
        this.workspaceDir = Path.of(workspaceDir);
        this.stagesDir = Path.of(stagesDir);
        this.pythonInterpreter = pythonInterpreter;
        this.javascriptInterpreter = javascriptInterpreter;
        this.outputsDir = outputsDir;
    }

    // ── script ────────────────────────────────────────────────────────────────

    public Map<String, Object> runScript(PipelineNode node, NodeExecutionContext context, ProcessingNodeConfig config) {
        if (config.getScript() == null || config.getScript().isBlank()) {
            throw new NodeExecutionException("Script node " + node.getId() + " has no script");
        }
        String language = config.getLanguage() != null ? config.getLanguage().toLowerCase() : "python";

        String interpreter;
        String harness;
        String extension;
        switch (language) {
            case "python" -> {
                interpreter = pythonInterpreter;
                harness = PYTHON_HARNESS.replace(USER_CODE, indent(config.getScript(), "    "));
                extension = "py";
            }
            case "javascript" -> {
                interpreter = javascriptInterpreter;
                harness = JAVASCRIPT_HARNESS.replace(USER_CODE, indent(config.getScript(), "        "));
                extension = "js";
            }
            default -> throw new NodeExecutionException(
                    "Unsupported script language: " + config.getLanguage() + ". Use 'python' or 'javascript'.");
        }

        Path runDir = runDirectory(context);
        Path scriptFile = runDir.resolve("script." + extension);
        Path configFile = runDir.resolve("run-config.json");
        try {
            Files.createDirectories(runDir);
            Files.writeString(scriptFile, harness);

            Map<String, Object> runConfig = new LinkedHashMap<>();
            runConfig.put("executionId", context.getExecutionId());
            runConfig.put("nodeId", node.getId());
            runConfig.put("inputs", context.getInputs());
            runConfig.put(NodeExecutionContext.DATA_KEY, context.upstreamData());
            runConfigWriter.writeJson(configFile, runConfig);
        } catch (IOException e) {
            throw new NodeExecutionException("Failed to prepare script for node " + node.getId() + ": " + e.getMessage(), e);
        }

        StageResult result = launch(node, context, List.of(
                interpreter, scriptFile.toString(), configFile.toString(), node.getId()), null);

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put(NodeExecutionContext.DATA_KEY, result.outputs().get(NodeExecutionContext.DATA_KEY));
        return outputs;
    }

    // ── stage ─────────────────────────────────────────────────────────────────

    public Map<String, Object> runStage(PipelineNode node, NodeExecutionContext context, ProcessingNodeConfig config) {
        String script = config.getStageScript() != null && !config.getStageScript().isBlank()
                ? config.getStageScript()
                : node.getId() + ".py";
        Path scriptFile = stagesDir.resolve(script);
        Path configFile = runDirectory(context).resolve("run-config.yaml");
        Path artifactsDir = Path.of(outputsDir, context.getPipelineId(), node.getId());

        try {
            runConfigWriter.writeYaml(configFile, stageRunConfig(context, config));
        } catch (IOException e) {
            throw new NodeExecutionException("Failed to write run configuration for stage " + node.getId() + ": " + e.getMessage(), e);
        }

        StageResult result = launch(node, context, List.of(
                pythonInterpreter, scriptFile.toString(), configFile.toString(), node.getId()), artifactsDir);

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put(NodeExecutionContext.DATA_KEY, context.upstreamData());
        outputs.put("outputs", result.outputs());
        outputs.put("artifacts", result.artifacts());
        outputs.put("exitCode", result.exitCode());
        return outputs;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> stageRunConfig(NodeExecutionContext context, ProcessingNodeConfig config) {
        Map<String, Object> parameters = new LinkedHashMap<>(config.getParameters() != null ? config.getParameters() : Map.of());

        Map<String, Object> pipeline = new LinkedHashMap<>();
        pipeline.put("id", context.getPipelineId());
        if (parameters.remove("pipeline") instanceof Map<?, ?> declared) {
            pipeline.putAll((Map<String, Object>) declared);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("input_path", config.getDataPath());
        data.put("output_path", config.getOutputPath() != null
                ? config.getOutputPath()
                : outputsDir + "/" + context.getPipelineId());

        Map<String, Object> runConfig = new LinkedHashMap<>();
        runConfig.put("pipeline", pipeline);
        runConfig.put("data", data);
        runConfig.put("model", config.getModelConfig() != null ? config.getModelConfig() : Map.of());
        parameters.forEach(runConfig::putIfAbsent);
        return runConfig;
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private StageResult launch(PipelineNode node, NodeExecutionContext context, List<String> command, Path artifactsDir) {
        StageSpec spec = new StageSpec(context.getExecutionId(), context.getPipelineId(), node.getId(),
                command, artifactsDir);
        log.info("Launching worker for node {} of execution {}", node.getId(), context.getExecutionId());

        StageResult result = processRunner.runStage(spec, context.logSink());
        if (!result.success()) {
            throw new NodeExecutionException(result.error());
        }
        return result;
    }

    private Path runDirectory(NodeExecutionContext context) {
        return workspaceDir.resolve(context.getExecutionId()).resolve(context.getNodeId());
    }

    private String indent(String code, String prefix) {
        return code.lines()
                .map(line -> prefix + line)
                .reduce((a, b) -> a + "\n" + b)
                .orElse("");
    }
}
