package com.pipestudio.pipestudio_backend.engine;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything the process runner needs to launch one worker.
 *
 * @param command            interpreter, script and positional arguments (run-config file, stage id)
 * @param artifactsDirectory files found here after a successful run are reported as artifacts; may be null
 */
public record StageSpec(
        String executionId,
        String pipelineId,
        String stageId,
        List<String> command,
        Path artifactsDirectory
) {
    public StageSpec {
        command = List.copyOf(command);
    }

    /** Key of the live process handle: one per (execution, stage). */
    public String processKey() {
        return ProcessKeys.of(executionId, stageId);
    }
}
