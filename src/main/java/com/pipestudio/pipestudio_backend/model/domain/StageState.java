package com.pipestudio.pipestudio_backend.model.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Live state of one node inside an execution. Written by the coordinator thread and by worker
 * stream pumps, read by status requests, so every mutable field is guarded by the instance lock.
 */
public class StageState {

    @Getter private final String id;
    @Getter private final String name;
    @Getter private final String type;

    private StageStatus status = StageStatus.IDLE;
    private Instant startTime;
    private Instant endTime;
    private String error;
    private final List<String> logs = new ArrayList<>();

    public StageState(String id, String name, String type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }

    public synchronized void markRunning(Instant at) {
        status = StageStatus.RUNNING;
        startTime = at;
    }

    public synchronized void markCompleted(Instant at) {
        status = StageStatus.COMPLETED;
        endTime = at;
    }

    public synchronized void markFailed(String message, Instant at) {
        status = StageStatus.ERROR;
        error = message;
        endTime = at;
    }

    public synchronized void appendLog(String line) {
        logs.add(line);
    }

    public synchronized StageStatus getStatus() { return status; }
    public synchronized Instant getStartTime()  { return startTime; }
    public synchronized Instant getEndTime()    { return endTime; }
    public synchronized String getError()       { return error; }
    public synchronized List<String> getLogs()  { return List.copyOf(logs); }
}
