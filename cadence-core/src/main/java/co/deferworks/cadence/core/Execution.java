package co.deferworks.cadence.core;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Execution is one recorded attempt to run a job's action. Rows are written once, after the handler
 * has returned or failed, and never updated afterwards.
 */
public record Execution(
        UUID id,
        UUID jobId,
        ExecutionStatus status,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt,
        String error,
        Map<String, Object> result,
        OffsetDateTime createdAt
) {

    public Execution {
        result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    public static Execution completed(UUID jobId, OffsetDateTime startedAt, OffsetDateTime completedAt, Map<String, Object> result) {
        return new Execution(null, jobId, ExecutionStatus.COMPLETED, startedAt, completedAt, null, result, null);
    }

    public static Execution failed(UUID jobId, OffsetDateTime startedAt, OffsetDateTime completedAt, String error) {
        return new Execution(null, jobId, ExecutionStatus.FAILED, startedAt, completedAt, error, null, null);
    }

    public enum ExecutionStatus {
        RUNNING,
        COMPLETED,
        FAILED,
    }

    @Override
    public String toString() {
        return "execution.id=" + id +
                " execution.job_id=" + jobId +
                " execution.status=" + status +
                " execution.started_at=" + startedAt +
                " execution.completed_at=" + completedAt
                ;
    }
}
