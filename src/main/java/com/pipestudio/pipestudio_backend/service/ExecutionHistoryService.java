package com.pipestudio.pipestudio_backend.service;

import com.pipestudio.pipestudio_backend.model.domain.ExecutionRecord;
import com.pipestudio.pipestudio_backend.model.domain.ExecutionStatus;
import com.pipestudio.pipestudio_backend.model.domain.PipelineExecution;
import com.pipestudio.pipestudio_backend.model.domain.StageState;
import com.pipestudio.pipestudio_backend.model.domain.StageStatus;
import com.pipestudio.pipestudio_backend.model.dto.ExecutionPage;
import com.pipestudio.pipestudio_backend.repository.ExecutionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

/**
 * Summary rows of finished executions. Writing never affects the run: failures are logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionHistoryService {

    private static final int MAX_PAGE_SIZE = 100;

    private final ExecutionRecordRepository repository;

    public void record(PipelineExecution execution) {
        try {
            repository.save(toRecord(execution));
        } catch (Exception ex) {
            log.error("Could not record history for execution {}: {}", execution.getId(), ex.getMessage());
        }
    }

    /**
     * @param page 1-based page number
     */
    public ExecutionPage list(int page, int limit, ExecutionStatus status, String pipelineId) {
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
        Pageable pageable = PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "startTime"));

        boolean byPipeline = pipelineId != null && !pipelineId.isBlank();
        Page<ExecutionRecord> result;
        if (byPipeline && status != null) {
            result = repository.findByPipelineIdAndStatus(pipelineId, status, pageable);
        } else if (byPipeline) {
            result = repository.findByPipelineId(pipelineId, pageable);
        } else if (status != null) {
            result = repository.findByStatus(status, pageable);
        } else {
            result = repository.findAll(pageable);
        }

        ExecutionPage.Pagination pagination = new ExecutionPage.Pagination(
                safePage, safeLimit, result.getTotalElements(), result.getTotalPages(),
                result.hasNext(), result.hasPrevious());
        return new ExecutionPage(result.getContent(), pagination);
    }

    private ExecutionRecord toRecord(PipelineExecution execution) {
        ExecutionRecord record = new ExecutionRecord();
        record.setExecutionId(execution.getId());
        record.setPipelineId(execution.getConfig().getPipelineId());
        record.setName(execution.getConfig().getName());
        record.setStatus(execution.getStatus());
        record.setStartTime(execution.getStartTime());
        record.setEndTime(execution.getEndTime());
        long duration = execution.getDurationMs();
        record.setDurationMs(duration >= 0 ? duration : null);
        record.setTotalStages(execution.getConfig().getStages().size());
        record.setCompletedStages((int) execution.getConfig().getStages().stream()
                .map(StageState::getStatus)
                .filter(s -> s == StageStatus.COMPLETED)
                .count());
        record.setError(truncate(execution.getError()));
        return record;
    }

    private String truncate(String error) {
        return error != null && error.length() > 2000 ? error.substring(0, 2000) : error;
    }
}
