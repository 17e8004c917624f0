package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Execution;
import co.deferworks.cadence.core.Job;
import co.deferworks.cadence.core.exception.JobValidationException;
import co.deferworks.cadence.core.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The PostgresJobRepository is the PostgreSQL implementation of {@link JobRepository}. It handles the
 * SQL, the JSONB mapping of schedules, parameters and results, and the mapping of rows back to
 * {@link Job} and {@link Execution} records.
 * <p>
 * Every row read back is rebuilt through the typed model, so a stored schedule that no longer
 * validates surfaces as a {@link StoreException} instead of reaching the scheduler.
 */
public class PostgresJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(PostgresJobRepository.class);

    private static final String JOB_COLUMNS =
            "id, name, type, status, schedule, parameters, next_run_time, last_run_at, failure_count, created_at, updated_at";
    private static final String EXECUTION_COLUMNS =
            "id, job_id, status, started_at, completed_at, error, result, created_at";

    private final DataSource dataSource;
    private final HookRegistry hookRegistry;
    private final JobJsonCodec codec;

    public PostgresJobRepository(DataSource dataSource) {
        this(dataSource, new HookRegistry());
    }

    public PostgresJobRepository(DataSource dataSource, HookRegistry hookRegistry) {
        this(dataSource, hookRegistry, new JobJsonCodec());
    }

    public PostgresJobRepository(DataSource dataSource, HookRegistry hookRegistry, JobJsonCodec codec) {
        this.dataSource = dataSource;
        this.hookRegistry = hookRegistry;
        this.codec = codec;
    }

    private static final String CREATE_JOB_SQL = """
            INSERT INTO jobs (name, type, status, schedule, parameters, next_run_time, last_run_at, failure_count)
            VALUES (?, ?, ?, CAST(? AS JSONB), CAST(? AS JSONB), ?, ?, ?)
            RETURNING %s;
            """.formatted(JOB_COLUMNS);

    @Override
    public Job create(Job job) {
        try (var connection = dataSource.getConnection()) {
            return create(job, connection);
        } catch (SQLException e) {
            throw new StoreException("Error creating job", e);
        }
    }

    @Override
    public Job create(Job job, Connection connection) {
        try (var statement = connection.prepareStatement(CREATE_JOB_SQL)) {

            statement.setString(1, job.name());
            statement.setString(2, job.type().name());
            statement.setString(3, job.status().name());
            statement.setString(4, codec.writeSchedule(job.schedule()));
            statement.setString(5, codec.writeParameters(job.parameters()));
            setTimestamp(statement, 6, job.nextRunTime());
            setTimestamp(statement, 7, job.lastRunAt());
            statement.setInt(8, job.failureCount());

            var resultSet = statement.executeQuery();
            if (resultSet.next()) {
                Job createdJob = mapRowToJob(resultSet);
                hookRegistry.executeOnCreate(createdJob);
                return createdJob;
            } else {
                throw new StoreException("Failed to create job, no rows returned.");
            }
        } catch (SQLException e) {
            throw new StoreException("Error creating job", e);
        }
    }

    private static final String FIND_BY_ID_SQL = """
            SELECT %s
            FROM jobs
            WHERE id = ?;
            """.formatted(JOB_COLUMNS);

    @Override
    public Optional<Job> findById(UUID id) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(FIND_BY_ID_SQL)) {

            statement.setObject(1, id);

            var resultSet = statement.executeQuery();
            if (resultSet.next()) {
                return Optional.of(mapRowToJob(resultSet));
            } else {
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Error finding job by id", e);
        }
    }

    private static final String EXISTS_SQL = """
            SELECT 1 FROM jobs WHERE id = ?;
            """;

    @Override
    public boolean exists(UUID id) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(EXISTS_SQL)) {

            statement.setObject(1, id);
            return statement.executeQuery().next();
        } catch (SQLException e) {
            throw new StoreException("Error checking whether job exists", e);
        }
    }

    @Override
    public List<Job> list(JobFilter filter, int limit, int offset) {
        JobFilter effective = filter == null ? JobFilter.all() : filter;
        var sql = new StringBuilder("SELECT ").append(JOB_COLUMNS).append(" FROM jobs WHERE TRUE");
        if (effective.status() != null) {
            sql.append(" AND status = ?");
        }
        if (effective.type() != null) {
            sql.append(" AND type = ?");
        }
        sql.append(" ORDER BY created_at ASC, id ASC LIMIT ? OFFSET ?;");

        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(sql.toString())) {

            int index = 1;
            if (effective.status() != null) {
                statement.setString(index++, effective.status().name());
            }
            if (effective.type() != null) {
                statement.setString(index++, effective.type().name());
            }
            statement.setInt(index++, limit);
            statement.setInt(index, offset);

            var resultSet = statement.executeQuery();
            List<Job> jobs = new ArrayList<>();
            while (resultSet.next()) {
                jobs.add(mapRowToJob(resultSet));
            }
            return jobs;
        } catch (SQLException e) {
            throw new StoreException("Error listing jobs", e);
        }
    }

    private static final String CANCEL_SQL = """
            UPDATE jobs
            SET status = 'CANCELLED', updated_at = ?
            WHERE id = ? AND status <> 'COMPLETED'
            RETURNING %s;
            """.formatted(JOB_COLUMNS);

    @Override
    public boolean cancel(UUID id, OffsetDateTime now) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(CANCEL_SQL)) {

            setTimestamp(statement, 1, now);
            statement.setObject(2, id);

            var resultSet = statement.executeQuery();
            if (resultSet.next()) {
                Job cancelledJob = mapRowToJob(resultSet);
                hookRegistry.executeOnCancel(cancelledJob);
                log.info("Cancelled job: {}", id);
                return true;
            }
            return false;
        } catch (SQLException e) {
            throw new StoreException("Error cancelling job", e);
        }
    }

    private static final String CLAIM_DUE_SQL = """
            UPDATE jobs
            SET locked_by = ?, locked_at = ?
            WHERE id IN (
                SELECT id
                FROM jobs
                WHERE status = 'ACTIVE'
                  AND next_run_time <= ?
                  AND (locked_by IS NULL OR locked_at < ?)
                ORDER BY next_run_time ASC
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            RETURNING %s;
            """.formatted(JOB_COLUMNS);

    @Override
    public List<Job> claimDue(UUID claimantId, OffsetDateTime now, Duration lease, int limit) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(CLAIM_DUE_SQL)) {

            statement.setObject(1, claimantId);
            setTimestamp(statement, 2, now);
            setTimestamp(statement, 3, now);
            setTimestamp(statement, 4, now.minus(lease));
            statement.setInt(5, limit);

            var resultSet = statement.executeQuery();
            List<Job> claimed = new ArrayList<>();
            while (resultSet.next()) {
                Job job = mapRowToJob(resultSet);
                hookRegistry.executeOnClaim(job);
                claimed.add(job);
            }
            claimed.sort((a, b) -> a.nextRunTime().compareTo(b.nextRunTime()));
            return claimed;
        } catch (SQLException e) {
            throw new StoreException("Error claiming due jobs", e);
        }
    }

    private static final String FINISH_RUN_SQL = """
            UPDATE jobs
            SET last_run_at = ?,
                updated_at = ?,
                next_run_time = CASE WHEN status = 'ACTIVE' THEN ? ELSE next_run_time END,
                status = CASE WHEN status = 'ACTIVE' THEN ? ELSE status END,
                failure_count = ?,
                locked_by = NULL,
                locked_at = NULL
            WHERE id = ?
            RETURNING %s;
            """.formatted(JOB_COLUMNS);

    @Override
    public Optional<Job> finishRun(UUID jobId, RunOutcome outcome) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(FINISH_RUN_SQL)) {

            setTimestamp(statement, 1, outcome.startedAt());
            setTimestamp(statement, 2, outcome.finishedAt());
            setTimestamp(statement, 3, outcome.nextRunTime());
            statement.setString(4, outcome.status().name());
            statement.setInt(5, outcome.failureCount());
            statement.setObject(6, jobId);

            var resultSet = statement.executeQuery();
            if (resultSet.next()) {
                return Optional.of(mapRowToJob(resultSet));
            }
            log.warn("Job {} not found after its run, outcome not recorded.", jobId);
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Error recording run outcome for job " + jobId, e);
        }
    }

    private static final String RELEASE_CLAIM_SQL = """
            UPDATE jobs
            SET locked_by = NULL, locked_at = NULL
            WHERE id = ? AND locked_by = ?;
            """;

    @Override
    public void releaseClaim(UUID jobId, UUID claimantId) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(RELEASE_CLAIM_SQL)) {

            statement.setObject(1, jobId);
            statement.setObject(2, claimantId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Error releasing claim on job " + jobId, e);
        }
    }

    private static final String APPEND_EXECUTION_SQL = """
            INSERT INTO job_executions (job_id, status, started_at, completed_at, error, result)
            VALUES (?, ?, ?, ?, ?, CAST(? AS JSONB))
            RETURNING %s;
            """.formatted(EXECUTION_COLUMNS);

    @Override
    public Execution appendExecution(Execution execution) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(APPEND_EXECUTION_SQL)) {

            statement.setObject(1, execution.jobId());
            statement.setString(2, execution.status().name());
            setTimestamp(statement, 3, execution.startedAt());
            setTimestamp(statement, 4, execution.completedAt());
            statement.setString(5, execution.error());
            String result = codec.writeResult(execution.result());
            if (result == null) {
                statement.setNull(6, Types.VARCHAR);
            } else {
                statement.setString(6, result);
            }

            var resultSet = statement.executeQuery();
            if (resultSet.next()) {
                return mapRowToExecution(resultSet);
            } else {
                throw new StoreException("Failed to record execution, no rows returned.");
            }
        } catch (SQLException e) {
            throw new StoreException("Error recording execution for job " + execution.jobId(), e);
        }
    }

    private static final String LIST_EXECUTIONS_SQL = """
            SELECT %s
            FROM job_executions
            WHERE job_id = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ? OFFSET ?;
            """.formatted(EXECUTION_COLUMNS);

    @Override
    public List<Execution> listExecutions(UUID jobId, int limit, int offset) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(LIST_EXECUTIONS_SQL)) {

            statement.setObject(1, jobId);
            statement.setInt(2, limit);
            statement.setInt(3, offset);

            var resultSet = statement.executeQuery();
            List<Execution> executions = new ArrayList<>();
            while (resultSet.next()) {
                executions.add(mapRowToExecution(resultSet));
            }
            return executions;
        } catch (SQLException e) {
            throw new StoreException("Error listing executions for job " + jobId, e);
        }
    }

    private static void setTimestamp(PreparedStatement statement, int index, OffsetDateTime value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            statement.setObject(index, value);
        }
    }

    private Job mapRowToJob(ResultSet rs) throws SQLException {
        UUID id = rs.getObject("id", UUID.class);
        try {
            Job.JobType type = Job.JobType.valueOf(rs.getString("type"));
            return Job.builder()
                    .id(id)
                    .name(rs.getString("name"))
                    .type(type)
                    .status(Job.JobStatus.valueOf(rs.getString("status")))
                    .schedule(codec.readSchedule(type, rs.getString("schedule")))
                    .parameters(codec.readParameters(rs.getString("parameters")))
                    .nextRunTime(rs.getObject("next_run_time", OffsetDateTime.class))
                    .lastRunAt(rs.getObject("last_run_at", OffsetDateTime.class))
                    .failureCount(rs.getInt("failure_count"))
                    .createdAt(rs.getObject("created_at", OffsetDateTime.class))
                    .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
                    .build();
        } catch (JobValidationException | IllegalArgumentException e) {
            throw new StoreException("Stored job " + id + " is invalid: " + e.getMessage(), e);
        }
    }

    private Execution mapRowToExecution(ResultSet rs) throws SQLException {
        return new Execution(
                rs.getObject("id", UUID.class),
                rs.getObject("job_id", UUID.class),
                Execution.ExecutionStatus.valueOf(rs.getString("status")),
                rs.getObject("started_at", OffsetDateTime.class),
                rs.getObject("completed_at", OffsetDateTime.class),
                rs.getString("error"),
                codec.readResult(rs.getString("result")),
                rs.getObject("created_at", OffsetDateTime.class)
        );
    }
}
