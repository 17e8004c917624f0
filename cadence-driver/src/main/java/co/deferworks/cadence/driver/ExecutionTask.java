package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A single run of a claimed job, as tracked in the engine's running-set.
 */
final class ExecutionTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTask.class);

    private final Job job;
    private final JobExecutor executor;
    private final Consumer<ExecutionTask> onDone;
    private final AtomicBoolean started = new AtomicBoolean(false);

    ExecutionTask(Job job, JobExecutor executor, Consumer<ExecutionTask> onDone) {
        this.job = job;
        this.executor = executor;
        this.onDone = onDone;
    }

    Job job() {
        return job;
    }

    boolean hasStarted() {
        return started.get();
    }

    @Override
    public void run() {
        started.set(true);
        try {
            executor.execute(job);
        } catch (InterruptedException e) {
            log.info("Execution of job {} interrupted, no execution recorded.", job.id());
            // The pool refuses connections to an interrupted thread, so release before restoring the flag.
            Thread.interrupted();
            executor.releaseClaim(job);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Unexpected error executing job {}: {}", job.id(), e.getMessage(), e);
        } finally {
            onDone.accept(this);
        }
    }
}
