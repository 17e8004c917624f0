package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Job.JobStatus;

import java.time.OffsetDateTime;

/**
 * The job update written once an execution has finished.
 *
 * @param startedAt    when the execution started, becomes {@code last_run_at}.
 * @param finishedAt   when the execution finished, becomes {@code updated_at}.
 * @param nextRunTime  the next due time, null when the job should not run again.
 * @param status       the status to move to, only applied while the job is still ACTIVE.
 * @param failureCount consecutive failures including this execution.
 */
public record RunOutcome(
        OffsetDateTime startedAt,
        OffsetDateTime finishedAt,
        OffsetDateTime nextRunTime,
        JobStatus status,
        int failureCount
) {
}
