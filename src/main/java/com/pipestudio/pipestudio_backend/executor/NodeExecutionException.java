package com.pipestudio.pipestudio_backend.executor;

/**
 * A node could not produce its outputs: unknown type or sub-type, malformed config,
 * I/O failure or a worker exiting non-zero. Aborts the whole execution.
 */
public class NodeExecutionException extends RuntimeException {

    public NodeExecutionException(String message) {
        super(message);
    }

    public NodeExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
