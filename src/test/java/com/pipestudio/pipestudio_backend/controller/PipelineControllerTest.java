package com.pipestudio.pipestudio_backend.controller;

import com.pipestudio.pipestudio_backend.model.domain.ExecutionConfigSnapshot;
import com.pipestudio.pipestudio_backend.model.domain.ExecutionStatus;
import com.pipestudio.pipestudio_backend.model.domain.Pipeline;
import com.pipestudio.pipestudio_backend.model.domain.PipelineExecution;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import com.pipestudio.pipestudio_backend.model.dto.ExecutionPage;
import com.pipestudio.pipestudio_backend.model.dto.ValidationResult;
import com.pipestudio.pipestudio_backend.service.ExecutionHistoryService;
import com.pipestudio.pipestudio_backend.service.PipelineService;
import com.pipestudio.pipestudio_backend.service.PipelineValidationException;
import com.pipestudio.pipestudio_backend.service.StagePipelineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PipelineController.class)
class PipelineControllerTest {

    private static final String PIPELINE_JSON = """
            {"id":"p-1","name":"demo",
             "nodes":[{"id":"input-1","type":"input","position":{"x":0,"y":0},
                       "data":{"label":"Load","config":{"sourceType":"static","staticData":[1,2]}}}],
             "edges":[]}
            """;

    @Autowired MockMvc mockMvc;

    @MockBean PipelineService pipelineService;
    @MockBean StagePipelineService stagePipelineService;
    @MockBean ExecutionHistoryService historyService;

    @Test
    void validateReturnsTheValidationResult() throws Exception {
        when(pipelineService.validate(any())).thenReturn(
                new ValidationResult(true, List.of(), List.of(), List.of("input-1")));

        mockMvc.perform(post("/api/pipeline/validate").contentType(MediaType.APPLICATION_JSON).content(PIPELINE_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.validation.executionOrder[0]").value("input-1"))
                .andExpect(jsonPath("$.validation.errors").isEmpty());
    }

    @Test
    void executeReturnsTheExecutionId() throws Exception {
        when(pipelineService.submit(any())).thenReturn("execution_42");

        mockMvc.perform(post("/api/pipeline/execute").contentType(MediaType.APPLICATION_JSON).content(PIPELINE_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.executionId").value("execution_42"));
    }

    @Test
    void invalidPipelineIsABadRequestListingTheErrors() throws Exception {
        when(pipelineService.submit(any())).thenThrow(new PipelineValidationException(List.of("Pipeline contains a cycle")));

        mockMvc.perform(post("/api/pipeline/execute").contentType(MediaType.APPLICATION_JSON).content(PIPELINE_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Pipeline validation failed"))
                .andExpect(jsonPath("$.errors[0]").value("Pipeline contains a cycle"));
    }

    @Test
    void malformedBodyIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/pipeline/execute").contentType(MediaType.APPLICATION_JSON).content("{nodes:"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void statusOfAKnownExecution() throws Exception {
        Pipeline pipeline = Pipeline.builder().id("p-1").name("demo")
                .nodes(List.of(PipelineNode.of("input-1", "input", Map.of("sourceType", "static"))))
                .build();
        PipelineExecution execution = new PipelineExecution("execution_1",
                ExecutionConfigSnapshot.of(pipeline, "out"), Instant.now());
        when(pipelineService.status("execution_1")).thenReturn(Optional.of(execution));

        mockMvc.perform(get("/api/pipeline/status/execution_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status.id").value("execution_1"))
                .andExpect(jsonPath("$.status.status").value("running"))
                .andExpect(jsonPath("$.status.config.stages[0].id").value("input-1"))
                .andExpect(jsonPath("$.status.config.stages[0].status").value("idle"));
    }

    @Test
    void statusOfAnUnknownExecutionIsNotFound() throws Exception {
        when(pipelineService.status("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/pipeline/status/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Execution not found: nope"));
    }

    @Test
    void stopIsAlwaysAcknowledged() throws Exception {
        mockMvc.perform(post("/api/pipeline/stop/execution_9"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(pipelineService).stop("execution_9");
    }

    @Test
    void executionsArePagedAndFilteredByStatus() throws Exception {
        ExecutionPage page = new ExecutionPage(List.of(), new ExecutionPage.Pagination(2, 5, 6, 2, false, true));
        when(historyService.list(eq(2), eq(5), eq(ExecutionStatus.COMPLETED), isNull())).thenReturn(page);

        mockMvc.perform(get("/api/pipeline/executions").param("page", "2").param("limit", "5").param("status", "completed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pagination.total").value(6))
                .andExpect(jsonPath("$.data.pagination.hasPreviousPage").value(true));
    }

    @Test
    void unknownStatusFilterIsABadRequest() throws Exception {
        mockMvc.perform(get("/api/pipeline/executions").param("status", "paused"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown status: paused"));
    }

    @Test
    void stagePipelineCreationErrorsAreBadRequests() throws Exception {
        when(stagePipelineService.create(any())).thenThrow(new IllegalArgumentException("Pipeline name is required"));

        mockMvc.perform(post("/api/pipeline/stages/create").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Pipeline name is required"));
    }
}
