package com.pipestudio.pipestudio_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipestudio.pipestudio_backend.model.event.PipelineEvent;
import com.pipestudio.pipestudio_backend.model.event.PipelineEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Runs stage workers as external processes.
 *
 * How it works:
 *   1. Start the worker with the command from the StageSpec
 *   2. Track the live process under "executionId:stageId"
 *   3. Pump stderr on a side thread and stdout on the calling thread, line by line;
 *      every line becomes a log event and goes to the stage's log buffer as it arrives
 *   4. Wait for exit: 0 is success, anything else is a failure carrying the last stderr line
 *
 * Workers are not time-boxed here. A hung worker runs until terminateExecution() kills it.
 * Once an execution is terminated no new worker starts for it, including one whose launch was
 * already under way; the mark is dropped by forgetExecution() when the record is purged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StageProcessRunner {

    private static final long GRACE_PERIOD_SECONDS = 2;
    private static final String STATUS_KEY = "status";
    static final String STOPPED_MESSAGE = "Execution stopped";

    private final PipelineEventEmitter events;
    private final ObjectMapper objectMapper;

    private final Map<String, Process> processes = new ConcurrentHashMap<>();
    // executionId -> when it was terminated
    private final Map<String, Instant> terminatedExecutions = new ConcurrentHashMap<>();

    public StageResult runStage(StageSpec spec, Consumer<String> logBuffer) {
        List<String> logs = Collections.synchronizedList(new ArrayList<>());
        AtomicReference<String> lastStderr = new AtomicReference<>();
        Map<String, Object> outputs = new LinkedHashMap<>();

        if (terminatedExecutions.containsKey(spec.executionId())) {
            log.info("Not starting stage {}: execution {} was stopped", spec.stageId(), spec.executionId());
            return StageResult.failed(-1, logs, outputs, STOPPED_MESSAGE);
        }

        ProcessBuilder builder = new ProcessBuilder(spec.command()).redirectErrorStream(false);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.error("Failed to start worker for stage {} of execution {}: {}",
                    spec.stageId(), spec.executionId(), e.getMessage());
            return StageResult.failed(-1, logs, outputs, "Failed to start stage " + spec.stageId() + ": " + e.getMessage());
        }

        processes.put(spec.processKey(), process);
        // terminateExecution() marks before it scans, so one side always sees the other
        if (terminatedExecutions.containsKey(spec.executionId())) {
            log.info("Execution {} was stopped while stage {} started, killing pid={}",
                    spec.executionId(), spec.stageId(), process.pid());
            kill(process);
            processes.remove(spec.processKey(), process);
            return StageResult.failed(-1, logs, outputs, STOPPED_MESSAGE);
        }
        log.info("Started worker pid={} for stage {} of execution {}", process.pid(), spec.stageId(), spec.executionId());

        Thread stderrPump = new Thread(() -> {
            try {
                pump(process.getErrorStream(), line -> {
                    lastStderr.set(line);
                    onLine(spec, line, "error", logs, logBuffer);
                });
            } catch (UncheckedIOException e) {
                log.debug("stderr of stage {} closed: {}", spec.stageId(), e.getMessage());
            }
        }, "stage-stderr-" + spec.stageId());
        stderrPump.setDaemon(true);
        stderrPump.start();

        try {
            pump(process.getInputStream(), line -> {
                onLine(spec, line, "info", logs, logBuffer);
                parseResultLine(line).ifPresent(result -> {
                    outputs.clear();
                    outputs.putAll(result);
                });
            });

            int exitCode = process.waitFor();
            stderrPump.join(TimeUnit.SECONDS.toMillis(GRACE_PERIOD_SECONDS));

            if (exitCode != 0) {
                String detail = lastStderr.get() != null
                        ? lastStderr.get()
                        : "Stage " + spec.stageId() + " exited with code " + exitCode;
                log.warn("Stage {} of execution {} failed with exit code {}", spec.stageId(), spec.executionId(), exitCode);
                return StageResult.failed(exitCode, logs, outputs, detail);
            }

            log.info("Stage {} of execution {} completed", spec.stageId(), spec.executionId());
            return StageResult.ok(exitCode, logs, outputs, collectArtifacts(spec.artifactsDirectory()));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return StageResult.failed(-1, logs, outputs, "Stage " + spec.stageId() + " was interrupted");
        } catch (UncheckedIOException e) {
            process.destroyForcibly();
            return StageResult.failed(-1, logs, outputs, "Lost worker output for stage " + spec.stageId() + ": " + e.getMessage());
        } finally {
            processes.remove(spec.processKey(), process);
        }
    }

    /**
     * Kills every worker tracked for the execution: polite destroy first, forcibly after the grace
     * period. Child processes of the worker are signalled too.
     *
     * @return number of workers signalled
     */
    public int terminateExecution(String executionId) {
        terminatedExecutions.putIfAbsent(executionId, Instant.now());
        List<Map.Entry<String, Process>> targets = processes.entrySet().stream()
                .filter(entry -> ProcessKeys.belongsTo(entry.getKey(), executionId))
                .toList();

        for (Map.Entry<String, Process> entry : targets) {
            Process process = entry.getValue();
            log.info("Terminating worker {} (pid={})", entry.getKey(), process.pid());
            kill(process);
            processes.remove(entry.getKey(), process);
        }
        return targets.size();
    }

    /** Drops the stop mark of a purged execution. */
    public void forgetExecution(String executionId) {
        terminatedExecutions.remove(executionId);
    }

    /** Drops stop marks set before the cutoff, including those of records removed on stop. */
    public int forgetTerminatedBefore(Instant cutoff) {
        int before = terminatedExecutions.size();
        terminatedExecutions.values().removeIf(at -> at.isBefore(cutoff));
        return before - terminatedExecutions.size();
    }

    boolean isTerminated(String executionId) {
        return terminatedExecutions.containsKey(executionId);
    }

    public int activeProcessCount() {
        return processes.size();
    }

    public boolean isRunning(String executionId, String stageId) {
        Process process = processes.get(ProcessKeys.of(executionId, stageId));
        return process != null && process.isAlive();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    // Polite destroy of the worker and its children, forcible after the grace period
    private void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(GRACE_PERIOD_SECONDS, TimeUnit.SECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private void onLine(StageSpec spec, String line, String level, List<String> logs, Consumer<String> logBuffer) {
        logs.add(line);
        if (logBuffer != null) logBuffer.accept(line);
        log.debug("[{}:{}] {}", spec.stageId(), level, line);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("level", level);
        data.put("message", line);
        events.emit(PipelineEvent.builder()
                .type(PipelineEventType.LOG)
                .executionId(spec.executionId())
                .pipelineId(spec.pipelineId())
                .nodeId(spec.stageId())
                .stageId(spec.stageId())
                .data(data)
                .build());
    }

    private void pump(InputStream stream, Consumer<String> onLine) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) onLine.accept(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Optional<Map<String, Object>> parseResultLine(String line) {
        String trimmed = line.trim();
        if (!trimmed.startsWith("{") || !trimmed.contains("\"" + STATUS_KEY + "\"")) {
            return Optional.empty();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(trimmed, new TypeReference<Map<String, Object>>() {});
            return parsed.containsKey(STATUS_KEY) ? Optional.of(parsed) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private List<String> collectArtifacts(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) return List.of();
        try (Stream<Path> files = Files.walk(directory)) {
            return files.filter(Files::isRegularFile)
                    .map(Path::toString)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Could not list artifacts in {}: {}", directory, e.getMessage());
            return List.of();
        }
    }
}
