package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Execution;
import co.deferworks.cadence.core.Job;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The Scheduler interface is the management surface host applications use to create, inspect and
 * cancel jobs while the engine runs.
 */
public interface Scheduler {

    int DEFAULT_LIST_LIMIT = 100;
    int MAX_LIST_LIMIT = 1000;

    /**
     * Persists a new job and activates it.
     *
     * @param job The job to create. Its id, status and timestamps are ignored.
     * @return The stored job, ACTIVE, with its first {@code nextRunTime} computed.
     * @throws co.deferworks.cadence.core.exception.JobValidationException if no handler is
     *                                                                     registered for the job's
     *                                                                     action. Nothing is stored.
     */
    Job createJob(Job job);

    Optional<Job> getJob(UUID id);

    /**
     * Lists jobs matching the filter, ordered by creation time.
     *
     * @param limit  between 1 and {@value #MAX_LIST_LIMIT}.
     * @param offset zero or more.
     */
    List<Job> listJobs(JobFilter filter, int limit, int offset);

    default List<Job> listJobs() {
        return listJobs(JobFilter.all(), DEFAULT_LIST_LIMIT, 0);
    }

    /**
     * Marks a job CANCELLED so that it is never claimed again.
     * <p>
     * Cancellation is best effort: it only flips the status. An execution already in flight runs to
     * completion and its execution record is still written, but the job is not rescheduled.
     *
     * @return true if the job was cancelled, false if it had already completed.
     * @throws co.deferworks.cadence.core.exception.JobNotFoundException if no job has this id.
     */
    boolean cancelJob(UUID id);

    /**
     * Lists a job's executions, newest first.
     *
     * @throws co.deferworks.cadence.core.exception.JobNotFoundException if no job has this id.
     */
    List<Execution> getJobExecutions(UUID id, int limit, int offset);

    default List<Execution> getJobExecutions(UUID id) {
        return getJobExecutions(id, DEFAULT_LIST_LIMIT, 0);
    }
}
