package co.deferworks.cadence;

import co.deferworks.cadence.core.Job;
import co.deferworks.cadence.core.JobParameters;
import co.deferworks.cadence.core.Schedule;
import co.deferworks.cadence.db.DatabaseMigrations;
import co.deferworks.cadence.driver.HookRegistry;
import co.deferworks.cadence.driver.PostgresDriver;
import co.deferworks.cadence.driver.PostgresScheduler;
import co.deferworks.cadence.driver.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        String jdbcUrl = System.getenv("JDBC_URL");
        String username = System.getenv("DB_USER");
        String password = System.getenv("DB_PASSWORD");

        // Run Flyway migrations
        DatabaseMigrations.runMigrations(jdbcUrl, username, password);

        PostgresDriver driver = getPostgresDriver(jdbcUrl, username, password);

        try {
            driver.start();
            PostgresScheduler scheduler = driver.getScheduler();
            OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);

            Job echoJob = scheduler.createJob(Job.builder()
                    .name("echo once")
                    .schedule(Schedule.oneTime(now))
                    .parameters(JobParameters.of("echo", Map.of("x", 1)))
                    .build());
            log.info("Created one-time job with ID: {}", echoJob.id());

            Job heartbeat = scheduler.createJob(Job.builder()
                    .name("heartbeat")
                    .schedule(Schedule.interval(2, now))
                    .parameters(JobParameters.of("echo", Map.of("beat", true)))
                    .build());
            log.info("Created interval job with ID: {}", heartbeat.id());

            Job everyMinute = scheduler.createJob(Job.builder()
                    .name("every minute")
                    .schedule(Schedule.cron("* * * * *"))
                    .parameters(JobParameters.of("failing"))
                    .build());
            log.info("Created cron job with ID: {}, next run at {}", everyMinute.id(), everyMinute.nextRunTime());

            // Create a job inside an application transaction
            try (Connection connection = driver.getConnection()) {
                connection.setAutoCommit(false);
                Job transactionalJob = scheduler.createJob(Job.builder()
                        .name("transactional echo")
                        .schedule(Schedule.oneTime(now))
                        .parameters(JobParameters.of("echo", Map.of("source", "transaction")))
                        .build(), connection);
                connection.commit();
                log.info("Transaction committed for job: {}", transactionalJob.id());
            } catch (Exception e) {
                log.error("Transactional job creation failed: ", e);
            }

            // Keep the application running for a bit so the engine picks the jobs up
            TimeUnit.SECONDS.sleep(10);

            scheduler.cancelJob(heartbeat.id());
            scheduler.getJobExecutions(heartbeat.id())
                    .forEach(execution -> log.info("Heartbeat execution: {}", execution));

        } catch (Exception e) {
            log.error("Application error: ", e);
        } finally {
            driver.shutdown();
        }
    }

    private static PostgresDriver getPostgresDriver(String jdbcUrl, String username, String password) {
        PostgresDriver driver = new PostgresDriver(jdbcUrl, username, password, SchedulerConfig.fromEnvironment(), getHookRegistry());

        driver.registerHandler("echo", params -> {
            log.info("Echoing params: {}", params);
            return params;
        });
        driver.registerHandler("failing", params -> {
            throw new IllegalStateException("Simulated job failure");
        }, Duration.ofSeconds(30));

        return driver;
    }

    private static HookRegistry getHookRegistry() {
        HookRegistry hookRegistry = new HookRegistry();

        // Register some sample hooks
        hookRegistry.registerOnCreate("echo", job -> log.info("Hook: Job {} created.", job.id()));
        hookRegistry.registerOnClaim("echo", job -> log.info("Hook: Job {} claimed.", job.id()));
        hookRegistry.registerOnComplete("echo", (job, execution) -> log.info("Hook: Job {} completed with {}.", job.id(), execution.result()));
        hookRegistry.registerOnCancel("echo", job -> log.info("Hook: Job {} cancelled.", job.id()));

        hookRegistry.registerOnFail("failing", (job, execution) -> log.warn("Hook: Job {} failed: {}", job.id(), execution.error()));

        return hookRegistry;
    }
}
