package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Execution;
import co.deferworks.cadence.core.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Per-action callbacks fired as jobs move through their lifecycle. Hooks run on the thread that
 * triggered them; a hook that throws is logged and otherwise ignored.
 */
public class HookRegistry {

    private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

    private final Map<String, Consumer<Job>> onCreateHooks = new ConcurrentHashMap<>();
    private final Map<String, Consumer<Job>> onClaimHooks = new ConcurrentHashMap<>();
    private final Map<String, Consumer<Job>> onCancelHooks = new ConcurrentHashMap<>();
    private final Map<String, BiConsumer<Job, Execution>> onCompleteHooks = new ConcurrentHashMap<>();
    private final Map<String, BiConsumer<Job, Execution>> onFailHooks = new ConcurrentHashMap<>();

    public void registerOnCreate(String action, Consumer<Job> hook) {
        onCreateHooks.put(action, hook);
    }

    public void registerOnClaim(String action, Consumer<Job> hook) {
        onClaimHooks.put(action, hook);
    }

    public void registerOnCancel(String action, Consumer<Job> hook) {
        onCancelHooks.put(action, hook);
    }

    public void registerOnComplete(String action, BiConsumer<Job, Execution> hook) {
        onCompleteHooks.put(action, hook);
    }

    public void registerOnFail(String action, BiConsumer<Job, Execution> hook) {
        onFailHooks.put(action, hook);
    }

    public void executeOnCreate(Job job) {
        run("onCreate", job, onCreateHooks.get(job.parameters().action()));
    }

    public void executeOnClaim(Job job) {
        run("onClaim", job, onClaimHooks.get(job.parameters().action()));
    }

    public void executeOnCancel(Job job) {
        run("onCancel", job, onCancelHooks.get(job.parameters().action()));
    }

    public void executeOnComplete(Job job, Execution execution) {
        run("onComplete", job, execution, onCompleteHooks.get(job.parameters().action()));
    }

    public void executeOnFail(Job job, Execution execution) {
        run("onFail", job, execution, onFailHooks.get(job.parameters().action()));
    }

    private static void run(String name, Job job, Consumer<Job> hook) {
        if (hook == null) {
            return;
        }
        try {
            hook.accept(job);
        } catch (RuntimeException e) {
            log.warn("{} hook failed for job {}: {}", name, job.id(), e.getMessage(), e);
        }
    }

    private static void run(String name, Job job, Execution execution, BiConsumer<Job, Execution> hook) {
        if (hook == null) {
            return;
        }
        try {
            hook.accept(job, execution);
        } catch (RuntimeException e) {
            log.warn("{} hook failed for job {}: {}", name, job.id(), e.getMessage(), e);
        }
    }
}
