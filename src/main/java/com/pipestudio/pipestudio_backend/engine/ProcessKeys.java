package com.pipestudio.pipestudio_backend.engine;

final class ProcessKeys {

    private static final String SEPARATOR = ":";

    private ProcessKeys() {}

    static String of(String executionId, String stageId) {
        return executionId + SEPARATOR + stageId;
    }

    static boolean belongsTo(String key, String executionId) {
        return key.startsWith(executionId + SEPARATOR);
    }
}
