package com.pipestudio.pipestudio_backend.model.dto;

import com.pipestudio.pipestudio_backend.model.domain.ExecutionRecord;

import java.util.List;

public record ExecutionPage(List<ExecutionRecord> executions, Pagination pagination) {

    public record Pagination(
            int page,
            int limit,
            long total,
            int totalPages,
            boolean hasNextPage,
            boolean hasPreviousPage
    ) {}
}
