package com.pipestudio.pipestudio_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One run of a pipeline. Owned by the ExecutionRegistry; the coordinator mutates it while driving
 * the run and the REST layer reads it concurrently, so state changes go through the instance lock.
 * Terminal transitions only apply while the run is still RUNNING: the first of stop, failure or
 * completion wins.
 */
public class PipelineExecution {

    @Getter private final String id;
    @Getter private final ExecutionConfigSnapshot config;
    @Getter private final Instant startTime;

    private ExecutionStatus status = ExecutionStatus.RUNNING;
    private int progress;
    private String currentStage;
    private Instant endTime;
    private String error;
    private final Map<String, Object> results = new LinkedHashMap<>();

    public PipelineExecution(String id, ExecutionConfigSnapshot config, Instant startTime) {
        this.id = id;
        this.config = config;
        this.startTime = startTime;
    }

    @JsonIgnore
    public synchronized boolean isRunning() {
        return status == ExecutionStatus.RUNNING;
    }

    public synchronized void enterStage(String stageId) {
        currentStage = stageId;
    }

    public synchronized void updateProgress(int progress) {
        this.progress = Math.max(0, Math.min(100, progress));
    }

    public synchronized void putResult(String nodeId, Map<String, Object> outputs) {
        results.put(nodeId, new LinkedHashMap<>(outputs));
    }

    public synchronized boolean complete(Instant at) {
        if (status != ExecutionStatus.RUNNING) return false;
        status = ExecutionStatus.COMPLETED;
        progress = 100;
        endTime = at;
        currentStage = null;
        return true;
    }

    public synchronized boolean fail(String message, Instant at) {
        if (status != ExecutionStatus.RUNNING) return false;
        status = ExecutionStatus.ERROR;
        error = message;
        endTime = at;
        return true;
    }

    /** Elapsed run time; -1 while still running. */
    public synchronized long getDurationMs() {
        return endTime != null ? Duration.between(startTime, endTime).toMillis() : -1;
    }

    public synchronized ExecutionStatus getStatus()    { return status; }
    public synchronized int getProgress()              { return progress; }
    public synchronized String getCurrentStage()       { return currentStage; }
    public synchronized Instant getEndTime()           { return endTime; }
    public synchronized String getError()              { return error; }
    public synchronized Map<String, Object> getResults() { return new LinkedHashMap<>(results); }
}
