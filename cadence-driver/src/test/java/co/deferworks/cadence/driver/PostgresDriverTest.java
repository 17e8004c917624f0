package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Execution;
import co.deferworks.cadence.core.Job;
import co.deferworks.cadence.core.JobParameters;
import co.deferworks.cadence.core.Schedule;
import co.deferworks.cadence.db.DatabaseMigrations;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PostgresDriverTest {
    private static final PostgreSQLContainer<?> pgContainer = new PostgreSQLContainer<>("postgres:16.9")
            .withDatabaseName("cadence-tests-db")
            .withUsername("cadence-driver-user")
            .withPassword("cadence-driver-secret");

    @BeforeAll
    static void beforeAll() {
        pgContainer.start();
        DatabaseMigrations.runMigrations(pgContainer.getJdbcUrl(), pgContainer.getUsername(), pgContainer.getPassword());
    }

    @AfterAll
    static void afterAll() {
        pgContainer.stop();
    }

    private PostgresDriver newDriver(HookRegistry hookRegistry) {
        SchedulerConfig config = SchedulerConfig.builder()
                .withPollInterval(Duration.ofMillis(100))
                .withStopTimeout(Duration.ofSeconds(5))
                .build();
        return new PostgresDriver(pgContainer.getJdbcUrl(), pgContainer.getUsername(), pgContainer.getPassword(), config, hookRegistry);
    }

    @Test
    void shouldRunAnEchoJobEndToEnd() throws Exception {
        CountDownLatch completed = new CountDownLatch(1);
        HookRegistry hookRegistry = new HookRegistry();
        hookRegistry.registerOnComplete("echo", (job, execution) -> completed.countDown());

        PostgresDriver driver = newDriver(hookRegistry);
        driver.registerHandler("echo", params -> params);
        try {
            driver.start();
            assertTrue(driver.getEngine().isRunning());

            Job job = driver.getScheduler().createJob(Job.builder()
                    .name("echo once")
                    .schedule(Schedule.oneTime(OffsetDateTime.now(ZoneOffset.UTC).minusSeconds(1)))
                    .parameters(JobParameters.of("echo", Map.of("x", 1)))
                    .build());

            assertTrue(completed.await(10, TimeUnit.SECONDS));

            Job finished = driver.getScheduler().getJob(job.id()).orElseThrow();
            assertEquals(Job.JobStatus.COMPLETED, finished.status());
            assertNull(finished.nextRunTime());

            List<Execution> executions = driver.getScheduler().getJobExecutions(job.id());
            assertEquals(1, executions.size());
            assertEquals(Execution.ExecutionStatus.COMPLETED, executions.get(0).status());
            assertEquals(Map.of("x", 1), executions.get(0).result());
        } finally {
            driver.shutdown();
        }

        assertEquals(SchedulerEngine.EngineState.STOPPED, driver.getEngine().state());
        assertThrows(SQLException.class, driver::getConnection);
    }

    @Test
    void shouldCreateJobsInsideACallerTransaction() throws Exception {
        PostgresDriver driver = newDriver(new HookRegistry());
        driver.registerHandler("echo", params -> params);
        try (Connection connection = driver.getConnection()) {
            connection.setAutoCommit(false);
            Job job = driver.getScheduler().createJob(Job.builder()
                    .name("rolled back")
                    .schedule(Schedule.cron("0 0 * * *"))
                    .parameters(JobParameters.of("echo"))
                    .build(), connection);
            connection.rollback();

            assertTrue(driver.getScheduler().getJob(job.id()).isEmpty());
        } finally {
            driver.shutdown();
        }
    }
}
