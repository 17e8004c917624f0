package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Execution;
import co.deferworks.cadence.core.Job;

import java.sql.Connection;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The JobRepository interface defines the contract for all data access operations on jobs and their
 * executions. It keeps the scheduling logic decoupled from the underlying database.
 * <p>
 * Implementations report connectivity and query failures as
 * {@link co.deferworks.cadence.core.exception.StoreException}.
 */
public interface JobRepository {

    /**
     * Inserts a new job.
     *
     * @param job The job to insert, its status and next run time are stored as given.
     * @return The stored job, including its generated ID and timestamps.
     */
    Job create(Job job);

    /**
     * Inserts a new job within an existing transaction.
     *
     * @param job        The job to insert.
     * @param connection The existing JDBC connection to use for the transaction.
     * @return The stored job, including its generated ID and timestamps.
     */
    Job create(Job job, Connection connection);

    /**
     * Retrieves a job by its unique ID.
     *
     * @param id The ID of the job to retrieve.
     * @return An Optional containing the job if found, or an empty Optional otherwise.
     */
    Optional<Job> findById(UUID id);

    boolean exists(UUID id);

    /**
     * Lists jobs matching the filter, ordered by creation time.
     */
    List<Job> list(JobFilter filter, int limit, int offset);

    /**
     * Sets the job's status to CANCELLED unless it already COMPLETED. This does not touch an execution
     * that is currently running.
     *
     * @return whether a row was updated.
     */
    boolean cancel(UUID id, OffsetDateTime now);

    /**
     * Claims the ACTIVE jobs whose next run time is at or before {@code now}. Uses a
     * SELECT ... FOR UPDATE SKIP LOCKED query, so concurrent claimants never receive the same row, and
     * stamps a lease on every claimed row. Rows leased within the last {@code lease} are skipped,
     * whoever holds them, so a job stays out of reach until its run is finished or the claim released.
     *
     * @param claimantId The scheduler instance making the claim.
     * @param now        The current time.
     * @param lease      How long a claim stays valid.
     * @param limit      Maximum number of jobs to claim.
     * @return The claimed jobs, oldest due first.
     */
    List<Job> claimDue(UUID claimantId, OffsetDateTime now, Duration lease, int limit);

    /**
     * Records the outcome of a run on the job and releases its claim. The status change only applies
     * while the job is still ACTIVE, so a cancellation that happened mid-run is kept.
     *
     * @return the updated job, or empty if it no longer exists.
     */
    Optional<Job> finishRun(UUID jobId, RunOutcome outcome);

    /**
     * Drops the claim {@code claimantId} holds on a job without changing anything else.
     */
    void releaseClaim(UUID jobId, UUID claimantId);

    /**
     * Inserts an execution record.
     *
     * @return The stored execution, including its generated ID.
     */
    Execution appendExecution(Execution execution);

    /**
     * Lists a job's executions, newest first.
     */
    List<Execution> listExecutions(UUID jobId, int limit, int offset);
}
