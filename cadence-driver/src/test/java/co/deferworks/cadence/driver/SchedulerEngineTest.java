package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Execution;
import co.deferworks.cadence.core.Job;
import co.deferworks.cadence.core.Job.JobStatus;
import co.deferworks.cadence.core.JobParameters;
import co.deferworks.cadence.core.Schedule;
import co.deferworks.cadence.db.DatabaseMigrations;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@Testcontainers
public class SchedulerEngineTest {

    @Container
    private static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16.9")
            .withDatabaseName("cadence-test")
            .withUsername("test")
            .withPassword("test");

    private HikariDataSource dataSource;
    private PostgresJobRepository jobRepository;
    private HandlerRegistry handlerRegistry;
    private HookRegistry hookRegistry;
    private SchedulerEngine engine;

    @BeforeAll
    static void beforeAll() {
        postgres.start();
        DatabaseMigrations.runMigrations(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    }

    @AfterAll
    static void afterAll() {
        postgres.stop();
    }

    @BeforeEach
    void setUp() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(postgres.getJdbcUrl());
        config.setUsername(postgres.getUsername());
        config.setPassword(postgres.getPassword());
        dataSource = new HikariDataSource(config);
        hookRegistry = new HookRegistry();
        jobRepository = new PostgresJobRepository(dataSource, hookRegistry);
        handlerRegistry = new HandlerRegistry();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (engine != null) {
            engine.stop();
        }
        handlerRegistry.close();
        if (dataSource != null) {
            try (var connection = dataSource.getConnection();
                 var statement = connection.createStatement()) {
                statement.executeUpdate("TRUNCATE TABLE jobs CASCADE");
            }
            dataSource.close();
        }
    }

    private SchedulerEngine newEngine(SchedulerConfig.Builder config) {
        engine = new SchedulerEngine(jobRepository, handlerRegistry, hookRegistry,
                config.withPollInterval(Duration.ofMillis(100)).withStopTimeout(Duration.ofSeconds(5)).build());
        return engine;
    }

    private SchedulerEngine newEngine() {
        return newEngine(SchedulerConfig.builder());
    }

    private Job createJob(String name, Schedule schedule, String action) {
        PostgresScheduler scheduler = new PostgresScheduler(jobRepository, handlerRegistry, Clock.systemUTC());
        return scheduler.createJob(Job.builder()
                .name(name)
                .schedule(schedule)
                .parameters(JobParameters.of(action, Map.of("x", 1)))
                .build());
    }

    private List<Execution> executionsOf(Job job) {
        return jobRepository.listExecutions(job.id(), 100, 0);
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(Clock.systemUTC());
    }

    @Test
    void testOneTimeJobRunsExactlyOnce() throws InterruptedException {
        CountDownLatch completed = new CountDownLatch(1);
        hookRegistry.registerOnComplete("echo", (job, execution) -> completed.countDown());
        handlerRegistry.register("echo", params -> params);

        newEngine().start();
        Job job = createJob("echo once", Schedule.oneTime(now().minusSeconds(5)), "echo");

        assertTrue(completed.await(10, TimeUnit.SECONDS));
        // Give the loop a few more ticks to prove the job is not picked up again.
        TimeUnit.MILLISECONDS.sleep(500);

        List<Execution> executions = executionsOf(job);
        assertEquals(1, executions.size());
        Execution execution = executions.get(0);
        assertEquals(Execution.ExecutionStatus.COMPLETED, execution.status());
        assertEquals(Map.of("x", 1), execution.result());
        assertNull(execution.error());
        assertFalse(execution.completedAt().isBefore(execution.startedAt()));

        Job finished = jobRepository.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, finished.status());
        assertNull(finished.nextRunTime());
        assertNotNull(finished.lastRunAt());
    }

    @Test
    void testIntervalJobRepeats() {
        handlerRegistry.register("echo", params -> Map.of());

        newEngine().start();
        Job job = createJob("every two seconds", Schedule.interval(2, now()), "echo");

        await().atMost(Duration.ofSeconds(6)).until(() -> executionsOf(job).size() >= 2);

        Job current = jobRepository.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.ACTIVE, current.status());
        assertNotNull(current.nextRunTime());
        assertTrue(current.nextRunTime().isAfter(current.lastRunAt()));
    }

    @Test
    void testCancelledJobIsNotClaimedAgain() throws InterruptedException {
        handlerRegistry.register("echo", params -> Map.of());

        newEngine().start();
        Job job = createJob("cancel me", Schedule.interval(1, now()), "echo");
        await().atMost(Duration.ofSeconds(5)).until(() -> !executionsOf(job).isEmpty());

        assertTrue(new PostgresScheduler(jobRepository, handlerRegistry, Clock.systemUTC()).cancelJob(job.id()));
        // Let an execution that was already in flight settle.
        await().atMost(Duration.ofSeconds(5)).until(() -> engine.runningJobIds().isEmpty());
        int executionsAtCancel = executionsOf(job).size();

        TimeUnit.MILLISECONDS.sleep(2500);

        assertEquals(executionsAtCancel, executionsOf(job).size());
        assertEquals(JobStatus.CANCELLED, jobRepository.findById(job.id()).orElseThrow().status());
    }

    @Test
    void testSlowHandlerNeverOverlaps() {
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        handlerRegistry.register("slow", params -> {
            int active = concurrent.incrementAndGet();
            maxConcurrent.accumulateAndGet(active, Math::max);
            try {
                TimeUnit.MILLISECONDS.sleep(1500);
            } finally {
                concurrent.decrementAndGet();
            }
            return Map.of();
        });

        newEngine().start();
        Job job = createJob("slow", Schedule.interval(1, now()), "slow");

        await().atMost(Duration.ofSeconds(10)).until(() -> executionsOf(job).size() >= 2);
        assertEquals(1, maxConcurrent.get());
    }

    @Test
    void testRunningJobIsNotClaimedAgainByItsOwnEngine() throws InterruptedException {
        AtomicInteger claims = new AtomicInteger();
        AtomicInteger runs = new AtomicInteger();
        // A slow claim lets the first run finish between a second claim and its dispatch.
        hookRegistry.registerOnClaim("report", job -> {
            if (claims.incrementAndGet() > 1) {
                try {
                    TimeUnit.MILLISECONDS.sleep(800);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        handlerRegistry.register("report", params -> {
            runs.incrementAndGet();
            TimeUnit.MILLISECONDS.sleep(400);
            return Map.of();
        });

        newEngine().start();
        Job job = createJob("report once", Schedule.oneTime(now().minusSeconds(1)), "report");

        await().atMost(Duration.ofSeconds(10))
                .until(() -> jobRepository.findById(job.id()).orElseThrow().status() == JobStatus.COMPLETED);
        TimeUnit.MILLISECONDS.sleep(1500);

        assertEquals(1, claims.get());
        assertEquals(1, runs.get());
        assertEquals(1, executionsOf(job).size());
    }

    @Test
    void testHandlerTimeoutRecordsFailureAndKeepsJobActive() {
        handlerRegistry.register("sleepy", params -> {
            TimeUnit.SECONDS.sleep(10);
            return Map.of();
        }, Duration.ofMillis(500));

        newEngine().start();
        Job job = createJob("sleepy", Schedule.interval(60, now()), "sleepy");

        await().atMost(Duration.ofSeconds(5)).until(() -> !executionsOf(job).isEmpty());

        Execution execution = executionsOf(job).get(0);
        assertEquals(Execution.ExecutionStatus.FAILED, execution.status());
        assertTrue(execution.error().contains("timed out"), execution.error());
        assertNull(execution.result());

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
            Job current = jobRepository.findById(job.id()).orElseThrow();
            assertEquals(JobStatus.ACTIVE, current.status());
            assertEquals(1, current.failureCount());
            assertNotNull(current.nextRunTime());
        });
    }

    @Test
    void testFailingOneTimeJobStillCompletes() throws InterruptedException {
        CountDownLatch failed = new CountDownLatch(1);
        hookRegistry.registerOnFail("broken", (job, execution) -> failed.countDown());
        handlerRegistry.register("broken", params -> {
            throw new IllegalStateException("boom");
        });

        newEngine().start();
        Job job = createJob("broken once", Schedule.oneTime(now()), "broken");

        assertTrue(failed.await(10, TimeUnit.SECONDS));

        Execution execution = executionsOf(job).get(0);
        assertEquals(Execution.ExecutionStatus.FAILED, execution.status());
        assertEquals("boom", execution.error());
        assertEquals(JobStatus.COMPLETED, jobRepository.findById(job.id()).orElseThrow().status());
    }

    @Test
    void testConsecutiveFailureLimitMarksJobFailed() throws InterruptedException {
        handlerRegistry.register("broken", params -> {
            throw new IllegalStateException("boom");
        });

        newEngine(SchedulerConfig.builder().withMaxConsecutiveFailures(2)).start();
        Job job = createJob("keeps failing", Schedule.interval(1, now()), "broken");

        await().atMost(Duration.ofSeconds(10))
                .until(() -> jobRepository.findById(job.id()).orElseThrow().status() == JobStatus.FAILED);

        Job failed = jobRepository.findById(job.id()).orElseThrow();
        assertNull(failed.nextRunTime());
        assertEquals(2, failed.failureCount());

        TimeUnit.MILLISECONDS.sleep(1500);
        assertEquals(2, executionsOf(job).size());
    }

    @Test
    void testJobWithoutHandlerIsSkipped() throws Exception {
        handlerRegistry.register("echo", params -> params);
        Job job = createJob("orphan", Schedule.oneTime(now()), "echo");
        handlerRegistry.unregister("echo");

        newEngine().start();
        TimeUnit.MILLISECONDS.sleep(1000);

        assertTrue(executionsOf(job).isEmpty());
        assertEquals(JobStatus.ACTIVE, jobRepository.findById(job.id()).orElseThrow().status());

        // Once a handler shows up the job runs.
        handlerRegistry.register("echo", params -> params);
        await().atMost(Duration.ofSeconds(5)).until(() -> executionsOf(job).size() == 1);
    }

    @Test
    void testStopInterruptsRunningHandlerWithoutRecording() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean(false);
        handlerRegistry.register("blocking", params -> {
            started.countDown();
            try {
                TimeUnit.SECONDS.sleep(30);
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            }
            return Map.of();
        });

        newEngine().start();
        Job job = createJob("blocking", Schedule.oneTime(now()), "blocking");
        assertTrue(started.await(10, TimeUnit.SECONDS));
        assertEquals(java.util.Set.of(job.id()), engine.runningJobIds());

        engine.stop();

        assertEquals(SchedulerEngine.EngineState.STOPPED, engine.state());
        assertTrue(engine.runningJobIds().isEmpty());
        await().atMost(Duration.ofSeconds(2)).untilTrue(interrupted);
        assertTrue(executionsOf(job).isEmpty());
        assertEquals(JobStatus.ACTIVE, jobRepository.findById(job.id()).orElseThrow().status());
    }

    @Test
    void testStartAndStopAreIdempotent() {
        SchedulerEngine engine = newEngine();
        assertEquals(SchedulerEngine.EngineState.STOPPED, engine.state());

        engine.start();
        engine.start();
        assertTrue(engine.isRunning());

        engine.stop();
        engine.stop();
        assertEquals(SchedulerEngine.EngineState.STOPPED, engine.state());

        // A stopped engine can be started again.
        engine.start();
        assertTrue(engine.isRunning());
    }
}
