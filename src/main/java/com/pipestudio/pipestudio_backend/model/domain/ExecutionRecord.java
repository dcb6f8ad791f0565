package com.pipestudio.pipestudio_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/** Summary row written once an execution reaches a terminal state. Keyed by execution id, so rewrites upsert. */
@Entity
@Table(name = "pipeline_executions")
@Data
public class ExecutionRecord {

    @Id
    @Column(name = "execution_id")
    private String executionId;

    @Column(name = "pipeline_id")
    private String pipelineId;

    private String name;

    @Enumerated(EnumType.STRING)
    private ExecutionStatus status;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "total_stages")
    private int totalStages;

    @Column(name = "completed_stages")
    private int completedStages;

    @Column(length = 2000)
    private String error;
}
