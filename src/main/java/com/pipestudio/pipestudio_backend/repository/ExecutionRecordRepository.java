package com.pipestudio.pipestudio_backend.repository;

import com.pipestudio.pipestudio_backend.model.domain.ExecutionRecord;
import com.pipestudio.pipestudio_backend.model.domain.ExecutionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, String> {

    Page<ExecutionRecord> findByStatus(ExecutionStatus status, Pageable pageable);

    Page<ExecutionRecord> findByPipelineId(String pipelineId, Pageable pageable);

    Page<ExecutionRecord> findByPipelineIdAndStatus(String pipelineId, ExecutionStatus status, Pageable pageable);
}
