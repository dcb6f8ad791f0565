package com.pipestudio.pipestudio_backend.engine;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one worker run. Outputs are the last JSON object the worker printed on stdout that
 * carries a "status" key; empty when it printed none.
 */
public record StageResult(
        boolean success,
        int exitCode,
        List<String> logs,
        Map<String, Object> outputs,
        List<String> artifacts,
        String error
) {
    static StageResult ok(int exitCode, List<String> logs, Map<String, Object> outputs, List<String> artifacts) {
        return new StageResult(true, exitCode, List.copyOf(logs), outputs, List.copyOf(artifacts), null);
    }

    static StageResult failed(int exitCode, List<String> logs, Map<String, Object> outputs, String error) {
        return new StageResult(false, exitCode, List.copyOf(logs), outputs, List.of(), error);
    }
}
