package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Execution;
import co.deferworks.cadence.core.Job;
import co.deferworks.cadence.core.NextRunCalculator;
import co.deferworks.cadence.core.exception.HandlerExecutionException;
import co.deferworks.cadence.core.exception.JobValidationException;
import co.deferworks.cadence.core.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one claimed job: invokes its handler, records the execution and writes the job's next state.
 * <p>
 * Store failures are logged per step so that one bad write does not lose the others. The claim on
 * the job is released by {@link JobRepository#finishRun}, or explicitly when no handler exists.
 */
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final UUID instanceId;
    private final JobRepository jobRepository;
    private final HandlerRegistry handlerRegistry;
    private final HookRegistry hookRegistry;
    private final Clock clock;
    private final int maxConsecutiveFailures;

    public JobExecutor(UUID instanceId, JobRepository jobRepository, HandlerRegistry handlerRegistry,
                       HookRegistry hookRegistry, SchedulerConfig config) {
        this.instanceId = instanceId;
        this.jobRepository = jobRepository;
        this.handlerRegistry = handlerRegistry;
        this.hookRegistry = hookRegistry;
        this.clock = config.getClock();
        this.maxConsecutiveFailures = config.getMaxConsecutiveFailures();
    }

    /**
     * Executes the job once.
     *
     * @throws InterruptedException if the thread is interrupted while the handler runs. No execution
     *                              is recorded in that case.
     */
    public void execute(Job job) throws InterruptedException {
        String action = job.parameters().action();
        Optional<HandlerRegistry.RegisteredHandler> handler = handlerRegistry.find(action);
        if (handler.isEmpty()) {
            log.error("No handler registered for action '{}', skipping job {}", action, job.id());
            releaseClaim(job);
            return;
        }

        log.info("Executing job {} '{}' with action '{}'", job.id(), job.name(), action);
        OffsetDateTime startedAt = OffsetDateTime.now(clock);
        Execution execution;
        try {
            Map<String, Object> result = handlerRegistry.invoke(handler.get(), job.parameters().params());
            execution = Execution.completed(job.id(), startedAt, OffsetDateTime.now(clock), result);
            log.info("Job {} completed.", job.id());
        } catch (HandlerExecutionException e) {
            execution = Execution.failed(job.id(), startedAt, OffsetDateTime.now(clock), e.getMessage());
            log.error("Job {} failed: {}", job.id(), e.getMessage(), e);
        }

        Execution recorded = execution;
        Job updated;
        try {
            recorded = record(execution);
        } finally {
            updated = finish(job, recorded);
        }

        if (recorded.status() == Execution.ExecutionStatus.COMPLETED) {
            hookRegistry.executeOnComplete(updated, recorded);
        } else {
            hookRegistry.executeOnFail(updated, recorded);
        }
    }

    /**
     * Appends the execution. A handler result that cannot be stored is recorded as a failed
     * execution instead.
     */
    private Execution record(Execution execution) {
        Execution toStore = execution;
        try {
            try {
                return jobRepository.appendExecution(toStore);
            } catch (JobValidationException e) {
                log.error("Result of job {} cannot be stored: {}", execution.jobId(), e.getMessage(), e);
                toStore = Execution.failed(execution.jobId(), execution.startedAt(), execution.completedAt(),
                        "Handler result could not be stored: " + e.getMessage());
                return jobRepository.appendExecution(toStore);
            }
        } catch (StoreException e) {
            log.error("Failed to record execution for job {}: {}", execution.jobId(), e.getMessage(), e);
            return toStore;
        }
    }

    private Job finish(Job job, Execution execution) {
        RunOutcome outcome = outcomeOf(job, execution);
        try {
            Optional<Job> updated = jobRepository.finishRun(job.id(), outcome);
            updated.ifPresent(j -> log.info("Job {} is {}, next run at {}", j.id(), j.status(), j.nextRunTime()));
            return updated.orElse(job);
        } catch (StoreException e) {
            log.error("Failed to update job {} after its run: {}", job.id(), e.getMessage(), e);
            return job;
        }
    }

    /**
     * One-time jobs complete after their single run whatever the outcome. Recurring jobs stay ACTIVE
     * and are rescheduled from the finish time, unless the consecutive failure limit is reached.
     */
    RunOutcome outcomeOf(Job job, Execution execution) {
        boolean failed = execution.status() == Execution.ExecutionStatus.FAILED;
        int failureCount = failed ? job.failureCount() + 1 : 0;
        OffsetDateTime finishedAt = execution.completedAt();

        if (job.type() == Job.JobType.ONE_TIME) {
            return new RunOutcome(execution.startedAt(), finishedAt, null, Job.JobStatus.COMPLETED, failureCount);
        }
        if (failed && maxConsecutiveFailures > 0 && failureCount >= maxConsecutiveFailures) {
            log.warn("Job {} failed {} times in a row, marking it FAILED.", job.id(), failureCount);
            return new RunOutcome(execution.startedAt(), finishedAt, null, Job.JobStatus.FAILED, failureCount);
        }
        OffsetDateTime next = NextRunCalculator.nextRun(job, finishedAt).orElse(null);
        return new RunOutcome(execution.startedAt(), finishedAt, next, Job.JobStatus.ACTIVE, failureCount);
    }

    void releaseClaim(Job job) {
        try {
            jobRepository.releaseClaim(job.id(), instanceId);
        } catch (StoreException e) {
            log.error("Failed to release claim on job {}: {}", job.id(), e.getMessage(), e);
        }
    }
}
