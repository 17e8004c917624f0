package co.deferworks.cadence.core;

import co.deferworks.cadence.core.exception.JobValidationException;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Job is the unit of scheduled work in Cadence: a named action plus the schedule that decides when it
 * fires.
 * <p>
 * A Job is a snapshot of a row in the {@code jobs} table. The store assigns {@code id},
 * {@code createdAt} and {@code updatedAt}, the scheduler maintains {@code nextRunTime},
 * {@code lastRunAt} and {@code failureCount}. A job whose {@code nextRunTime} is null is never picked
 * up by the polling loop.
 * <p>
 * The record validates itself on construction: the name must be present and at most
 * {@value #MAX_NAME_LENGTH} characters, and the schedule variant must match the job type. Rows read
 * back from the database go through the same checks.
 */
public record Job(
        UUID id,
        String name,
        JobType type,
        JobStatus status,
        Schedule schedule,
        JobParameters parameters,
        OffsetDateTime nextRunTime,
        OffsetDateTime lastRunAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        int failureCount
) {

    public static final int MAX_NAME_LENGTH = 255;

    public Job {
        if (name == null || name.isBlank()) {
            throw new JobValidationException("Job name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new JobValidationException("Job name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (schedule == null) {
            throw new JobValidationException("Job schedule is required");
        }
        if (type == null) {
            throw new JobValidationException("Job type is required");
        }
        if (schedule.type() != type) {
            throw new JobValidationException("Invalid schedule for job type " + type + ": got a " + schedule.type() + " schedule");
        }
        if (parameters == null) {
            throw new JobValidationException("Job parameters are required");
        }
        if (status == null) {
            throw new JobValidationException("Job status is required");
        }
        if (failureCount < 0) {
            throw new JobValidationException("failure_count cannot be negative");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .type(type)
                .status(status)
                .schedule(schedule)
                .parameters(parameters)
                .nextRunTime(nextRunTime)
                .lastRunAt(lastRunAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .failureCount(failureCount);
    }

    public boolean isTerminal() {
        return status == JobStatus.COMPLETED || status == JobStatus.CANCELLED || status == JobStatus.FAILED;
    }

    public static final class Builder {
        private UUID id;
        private String name;
        private JobType type;
        private JobStatus status = JobStatus.PENDING;
        private Schedule schedule;
        private JobParameters parameters;
        private OffsetDateTime nextRunTime;
        private OffsetDateTime lastRunAt;
        private OffsetDateTime createdAt;
        private OffsetDateTime updatedAt;
        private int failureCount = 0;

        private Builder() {
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(JobType type) {
            this.type = type;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder schedule(Schedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder parameters(JobParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder nextRunTime(OffsetDateTime nextRunTime) {
            this.nextRunTime = nextRunTime;
            return this;
        }

        public Builder lastRunAt(OffsetDateTime lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder createdAt(OffsetDateTime createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(OffsetDateTime updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder failureCount(int failureCount) {
            this.failureCount = failureCount;
            return this;
        }

        /**
         * Builds the job. When no type was given it is taken from the schedule.
         */
        public Job build() {
            JobType resolvedType = type == null && schedule != null ? schedule.type() : type;
            return new Job(id, name, resolvedType, status, schedule, parameters, nextRunTime, lastRunAt, createdAt, updatedAt, failureCount);
        }
    }

    /**
     * The three kinds of schedule a job can follow.
     */
    public enum JobType {
        ONE_TIME,
        INTERVAL,
        CRON,
    }

    /**
     * JobStatus tracks where a job is in its lifecycle.
     * <p>
     * Only {@code ACTIVE} jobs are ever claimed by the polling loop. {@code COMPLETED},
     * {@code CANCELLED} and {@code FAILED} are terminal.
     */
    public enum JobStatus {
        // The job has been built but not yet persisted.
        PENDING,

        // The job is persisted and will run whenever its next_run_time comes due.
        ACTIVE,

        // A one-time job that has run.
        COMPLETED,

        // The job hit the configured consecutive failure limit and stopped being scheduled.
        FAILED,

        // The job was cancelled and will not be claimed again.
        CANCELLED,
    }

    @Override
    public String toString() {
        return "job.id=" + id +
                " job.name=" + name +
                " job.type=" + type +
                " job.status=" + status +
                " job.action=" + parameters.action() +
                " job.next_run_time=" + nextRunTime
                ;
    }
}
