package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.JobHandler;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Wires the scheduler together on top of a HikariCP pool: handler registry, job repository,
 * management interface and the polling engine.
 */
public class PostgresDriver {

    private static final Logger log = LoggerFactory.getLogger(PostgresDriver.class);

    private final HikariDataSource dataSource;
    private final HandlerRegistry handlerRegistry;
    private final HookRegistry hookRegistry;
    private final PostgresScheduler scheduler;
    private final SchedulerEngine engine;

    public PostgresDriver(String jdbcUrl, String username, String password) {
        this(jdbcUrl, username, password, SchedulerConfig.defaults(), new HookRegistry());
    }

    public PostgresDriver(String jdbcUrl, String username, String password, SchedulerConfig schedulerConfig, HookRegistry hookRegistry) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        // Execution threads plus the poller and one spare for management calls.
        config.setMaximumPoolSize(schedulerConfig.getExecutionThreads() + 2);
        config.setMinimumIdle(2);
        config.setPoolName("cadence-pool");

        this.dataSource = new HikariDataSource(config);
        this.hookRegistry = hookRegistry;
        this.handlerRegistry = new HandlerRegistry(schedulerConfig.getDefaultHandlerTimeout());
        JobRepository jobRepository = new PostgresJobRepository(dataSource, hookRegistry);
        this.scheduler = new PostgresScheduler(jobRepository, handlerRegistry, schedulerConfig.getClock());
        this.engine = new SchedulerEngine(jobRepository, handlerRegistry, hookRegistry, schedulerConfig);
    }

    public void registerHandler(String action, JobHandler handler) {
        handlerRegistry.register(action, handler);
    }

    public void registerHandler(String action, JobHandler handler, Duration timeout) {
        handlerRegistry.register(action, handler, timeout);
    }

    /**
     * Creates and returns a handle to a Postgres connection, e.g. to create jobs inside an
     * application transaction with {@link PostgresScheduler#createJob(co.deferworks.cadence.core.Job, Connection)}.
     *
     * @return Connection
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public void start() {
        log.info("Starting PostgresDriver...");
        engine.start();
        log.info("PostgresDriver started.");
    }

    public void shutdown() {
        log.info("Shutting down PostgresDriver...");
        try {
            engine.stop();
        } finally {
            handlerRegistry.close();
            dataSource.close();
        }
        log.info("PostgresDriver shut down.");
    }

    public PostgresScheduler getScheduler() {
        return scheduler;
    }

    public SchedulerEngine getEngine() {
        return engine;
    }

    public HandlerRegistry getHandlerRegistry() {
        return handlerRegistry;
    }

    public HookRegistry getHookRegistry() {
        return hookRegistry;
    }
}
