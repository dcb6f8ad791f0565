package com.pipestudio.pipestudio_backend.engine;

import com.pipestudio.pipestudio_backend.model.domain.PipelineExecution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide table of executions, keyed by execution id.
 *
 * Callers get the execution objects, never the map. Stopped executions stay in the table with
 * status error when pipeline.registry.retain-stopped is true; finished executions older than
 * pipeline.registry.finished-ttl are purged on a schedule.
 */
@Slf4j
@Component
public class ExecutionRegistry {

    private final Map<String, PipelineExecution> executions = new ConcurrentHashMap<>();
    private final StageProcessRunner processRunner;
    private final boolean retainStopped;
    private final Duration finishedTtl;

    public ExecutionRegistry(StageProcessRunner processRunner,
                             @Value("${pipeline.registry.retain-stopped:true}") boolean retainStopped,
                             @Value("${pipeline.registry.finished-ttl:PT1H}") Duration finishedTtl) {
        this.processRunner = processRunner;
        this.retainStopped = retainStopped;
        this.finishedTtl = finishedTtl;
    }

    public void register(PipelineExecution execution) {
        if (executions.putIfAbsent(execution.getId(), execution) != null) {
            throw new IllegalStateException("Execution already registered: " + execution.getId());
        }
    }

    public Optional<PipelineExecution> find(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    /**
     * Marks the execution as error and kills its workers.
     *
     * @return the execution when this call performed the transition; empty when the id is unknown
     *         or the execution had already finished (a repeated stop is a no-op)
     */
    public Optional<PipelineExecution> stop(String executionId, String reason) {
        PipelineExecution execution = executions.get(executionId);
        if (execution == null) {
            return Optional.empty();
        }

        boolean transitioned = execution.fail(reason, Instant.now());
        int killed = processRunner.terminateExecution(executionId);
        if (transitioned) {
            log.info("Stopped execution {} ({} worker(s) terminated)", executionId, killed);
        }

        if (!retainStopped) {
            executions.remove(executionId);
        }
        return transitioned ? Optional.of(execution) : Optional.empty();
    }

    @Scheduled(fixedDelayString = "${pipeline.registry.purge-interval:PT5M}")
    public void purgeFinished() {
        int purged = purgeFinishedBefore(Instant.now().minus(finishedTtl));
        if (purged > 0) {
            log.info("Purged {} finished execution(s)", purged);
        }
    }

    int purgeFinishedBefore(Instant cutoff) {
        int purged = 0;
        for (PipelineExecution execution : executions.values()) {
            Instant end = execution.getEndTime();
            if (!execution.isRunning() && end != null && end.isBefore(cutoff)
                    && executions.remove(execution.getId(), execution)) {
                processRunner.forgetExecution(execution.getId());
                purged++;
            }
        }
        processRunner.forgetTerminatedBefore(cutoff);
        return purged;
    }

    public int size() {
        return executions.size();
    }
}
