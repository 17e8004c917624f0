package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Job;
import co.deferworks.cadence.core.exception.SchedulerLifecycleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The SchedulerEngine runs the polling loop: on every tick it claims the jobs that are due and hands
 * each one to the execution pool.
 * <p>
 * A job is never executed twice at the same time. The claim lease taken in
 * {@link JobRepository#claimDue} keeps it away from every engine, this one included, until its run
 * is finished or the claim released. The running-set additionally skips a job that is still running
 * here after its lease expired.
 * <p>
 * States: {@code STOPPED -> RUNNING -> STOPPING -> STOPPED}. Both {@link #start()} and {@link #stop()}
 * are idempotent.
 */
public class SchedulerEngine {

    private static final Logger log = LoggerFactory.getLogger(SchedulerEngine.class);

    public enum EngineState {
        STOPPED,
        RUNNING,
        STOPPING,
    }

    private final UUID instanceId = UUID.randomUUID();
    private final JobRepository jobRepository;
    private final JobExecutor jobExecutor;
    private final SchedulerConfig config;
    private final Map<UUID, ExecutionTask> running = new ConcurrentHashMap<>();
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private volatile EngineState state = EngineState.STOPPED;
    private ScheduledExecutorService poller;
    private ExecutorService executionPool;

    public SchedulerEngine(JobRepository jobRepository, HandlerRegistry handlerRegistry, HookRegistry hookRegistry, SchedulerConfig config) {
        this.jobRepository = jobRepository;
        this.config = config;
        this.jobExecutor = new JobExecutor(instanceId, jobRepository, handlerRegistry, hookRegistry, config);
    }

    public void start() {
        lifecycleLock.lock();
        try {
            if (state != EngineState.STOPPED) {
                log.warn("Scheduler engine {} is already {}, ignoring start.", instanceId, state);
                return;
            }
            log.info("Starting scheduler engine {} with {}", instanceId, config);
            poller = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("cadence-poller"));
            executionPool = Executors.newFixedThreadPool(config.getExecutionThreads(), new NamedThreadFactory("cadence-executor"));
            state = EngineState.RUNNING;

            CountDownLatch pollerStarted = new CountDownLatch(1);
            poller.execute(pollerStarted::countDown);
            poller.scheduleWithFixedDelay(this::pollOnce, 0, config.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);

            boolean started;
            try {
                started = pollerStarted.await(config.getStartTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                teardown();
                throw new SchedulerLifecycleException("Interrupted while starting scheduler engine", e);
            }
            if (!started) {
                teardown();
                throw new SchedulerLifecycleException("Scheduler engine did not start within " + config.getStartTimeout().toSeconds() + " seconds");
            }
            log.info("Scheduler engine {} started.", instanceId);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stops polling, interrupts running executions and waits for them to finish, at most
     * {@link SchedulerConfig#getStopTimeout()} in total.
     *
     * @throws SchedulerLifecycleException if the threads did not terminate in time. The engine is
     *                                     STOPPED regardless.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            if (state != EngineState.RUNNING) {
                log.warn("Scheduler engine {} is {}, ignoring stop.", instanceId, state);
                return;
            }
            log.info("Stopping scheduler engine {}...", instanceId);
            state = EngineState.STOPPING;
            long deadline = System.nanoTime() + config.getStopTimeout().toNanos();
            boolean terminated = true;
            try {
                poller.shutdown();
                terminated &= poller.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS);

                // Interrupts each busy worker once and drops queued tasks.
                executionPool.shutdownNow();
                terminated &= executionPool.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                terminated = false;
                log.warn("Interrupted while stopping scheduler engine {}.", instanceId, e);
            }

            running.values().stream()
                    .filter(task -> !task.hasStarted())
                    .forEach(task -> jobExecutor.releaseClaim(task.job()));
            running.clear();
            state = EngineState.STOPPED;

            if (!terminated) {
                poller.shutdownNow();
                throw new SchedulerLifecycleException("Scheduler engine did not stop within " + config.getStopTimeout().toSeconds() + " seconds");
            }
            log.info("Scheduler engine {} stopped.", instanceId);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * One tick of the polling loop. Never throws, an exception would cancel the periodic task.
     */
    void pollOnce() {
        if (state != EngineState.RUNNING) {
            return;
        }
        try {
            List<Job> due = jobRepository.claimDue(instanceId, OffsetDateTime.now(config.getClock()), config.getClaimLease(), config.getClaimBatchSize());
            if (!due.isEmpty()) {
                log.debug("Claimed {} due jobs.", due.size());
            }
            for (Job job : due) {
                dispatch(job);
            }
        } catch (Exception e) {
            log.error("Polling cycle failed: {}", e.getMessage(), e);
        }
    }

    private void dispatch(Job job) {
        ExecutionTask task = new ExecutionTask(job, jobExecutor, this::taskFinished);
        if (running.putIfAbsent(job.id(), task) != null) {
            log.debug("Job {} is still running, skipping.", job.id());
            return;
        }
        try {
            executionPool.execute(task);
        } catch (RejectedExecutionException e) {
            running.remove(job.id(), task);
            log.warn("Execution pool rejected job {}, releasing its claim.", job.id());
            jobExecutor.releaseClaim(job);
        }
    }

    private void taskFinished(ExecutionTask task) {
        running.remove(task.job().id(), task);
    }

    private void teardown() {
        state = EngineState.STOPPED;
        poller.shutdownNow();
        executionPool.shutdownNow();
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    public EngineState state() {
        return state;
    }

    public boolean isRunning() {
        return state == EngineState.RUNNING;
    }

    public Set<UUID> runningJobIds() {
        return Set.copyOf(running.keySet());
    }
}
