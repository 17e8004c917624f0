package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Execution;
import co.deferworks.cadence.core.Job;
import co.deferworks.cadence.core.NextRunCalculator;
import co.deferworks.cadence.core.exception.JobNotFoundException;
import co.deferworks.cadence.core.exception.JobValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public class PostgresScheduler implements Scheduler {

    private static final Logger log = LoggerFactory.getLogger(PostgresScheduler.class);

    private final JobRepository jobRepository;
    private final HandlerRegistry handlerRegistry;
    private final Clock clock;

    public PostgresScheduler(JobRepository jobRepository, HandlerRegistry handlerRegistry, Clock clock) {
        this.jobRepository = Objects.requireNonNull(jobRepository, "jobRepository");
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "handlerRegistry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Job createJob(Job job) {
        Job created = jobRepository.create(prepare(job));
        log.info("Created job {} '{}' ({}), next run at {}", created.id(), created.name(), created.type(), created.nextRunTime());
        return created;
    }

    /**
     * Creates the job within the caller's transaction, so it only becomes visible to the engine once
     * that transaction commits.
     */
    public Job createJob(Job job, Connection connection) {
        Job created = jobRepository.create(prepare(job), connection);
        log.info("Created job {} '{}' ({}) in caller transaction", created.id(), created.name(), created.type());
        return created;
    }

    private Job prepare(Job job) {
        if (job == null) {
            throw new JobValidationException("Job is required");
        }
        String action = job.parameters().action();
        if (!handlerRegistry.isRegistered(action)) {
            throw new JobValidationException("No handler registered for action: " + action);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return job.toBuilder()
                .id(null)
                .status(Job.JobStatus.ACTIVE)
                .nextRunTime(NextRunCalculator.firstRun(job.schedule(), now).orElse(null))
                .lastRunAt(null)
                .failureCount(0)
                .createdAt(null)
                .updatedAt(null)
                .build();
    }

    @Override
    public Optional<Job> getJob(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return jobRepository.findById(id);
    }

    @Override
    public List<Job> listJobs(JobFilter filter, int limit, int offset) {
        checkPage(limit, offset);
        return jobRepository.list(filter == null ? JobFilter.all() : filter, limit, offset);
    }

    @Override
    public boolean cancelJob(UUID id) {
        if (id == null || !jobRepository.exists(id)) {
            throw new JobNotFoundException(id);
        }
        boolean cancelled = jobRepository.cancel(id, OffsetDateTime.now(clock));
        if (!cancelled) {
            log.info("Job {} already completed, not cancelled.", id);
        }
        return cancelled;
    }

    @Override
    public List<Execution> getJobExecutions(UUID id, int limit, int offset) {
        checkPage(limit, offset);
        if (id == null || !jobRepository.exists(id)) {
            throw new JobNotFoundException(id);
        }
        return jobRepository.listExecutions(id, limit, offset);
    }

    private static void checkPage(int limit, int offset) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new JobValidationException("limit must be between 1 and " + MAX_LIST_LIMIT + ", got " + limit);
        }
        if (offset < 0) {
            throw new JobValidationException("offset cannot be negative, got " + offset);
        }
    }
}
