package com.pipestudio.pipestudio_backend.controller;

import com.pipestudio.pipestudio_backend.model.domain.ExecutionStatus;
import com.pipestudio.pipestudio_backend.model.domain.Pipeline;
import com.pipestudio.pipestudio_backend.model.dto.ExecutionPage;
import com.pipestudio.pipestudio_backend.model.dto.StagePipelineConfig;
import com.pipestudio.pipestudio_backend.model.dto.StagePipelineRequest;
import com.pipestudio.pipestudio_backend.model.dto.ValidationResult;
import com.pipestudio.pipestudio_backend.service.ExecutionHistoryService;
import com.pipestudio.pipestudio_backend.service.PipelineService;
import com.pipestudio.pipestudio_backend.service.StagePipelineService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineService         pipelineService;
    private final StagePipelineService    stagePipelineService;
    private final ExecutionHistoryService historyService;

    // POST /api/pipeline/validate: structural check and execution order, never runs anything
    @PostMapping("/validate")
    public Map<String, Object> validate(@RequestBody Pipeline pipeline) {
        ValidationResult result = pipelineService.validate(pipeline);
        return envelope("validation", result);
    }

    // POST /api/pipeline/execute: returns as soon as the execution is registered
    @PostMapping("/execute")
    public Map<String, Object> execute(@RequestBody Pipeline pipeline) {
        String executionId = pipelineService.submit(pipeline);
        return envelope("executionId", executionId);
    }

    @GetMapping("/status/{executionId}")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String executionId) {
        return pipelineService.status(executionId)
                .map(execution -> ResponseEntity.ok(envelope("status", execution)))
                .orElse(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(failure("Execution not found: " + executionId)));
    }

    // Unknown or finished ids are acknowledged as well
    @PostMapping("/stop/{executionId}")
    public Map<String, Object> stop(@PathVariable String executionId) {
        pipelineService.stop(executionId);
        return Map.of("success", true);
    }

    // GET /api/pipeline/executions: finished executions, newest first
    @GetMapping("/executions")
    public Map<String, Object> executions(@RequestParam(defaultValue = "1") int page,
                                          @RequestParam(defaultValue = "10") int limit,
                                          @RequestParam(required = false) String status,
                                          @RequestParam(required = false) String pipelineId) {
        ExecutionStatus statusFilter = null;
        if (status != null && !status.isBlank()) {
            statusFilter = ExecutionStatus.fromWireName(status)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown status: " + status));
        }
        ExecutionPage result = historyService.list(page, limit, statusFilter, pipelineId);
        return envelope("data", result);
    }

    @PostMapping("/stages/create")
    public Map<String, Object> createStagePipeline(@RequestBody StagePipelineRequest request) {
        StagePipelineConfig pipeline = stagePipelineService.create(request);
        return envelope("data", pipeline);
    }

    @PostMapping("/stages/execute")
    public Map<String, Object> executeStagePipeline(@RequestBody StagePipelineConfig config) {
        String executionId = stagePipelineService.execute(config);
        return envelope("executionId", executionId);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Map<String, Object> envelope(String key, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put(key, value);
        return body;
    }

    static Map<String, Object> failure(String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        return body;
    }
}
