package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.JobHandler;
import co.deferworks.cadence.core.exception.HandlerExecutionException;
import co.deferworks.cadence.core.exception.HandlerTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps action names to the handlers that implement them, each with its own execution timeout.
 * <p>
 * Handlers are invoked on a pool owned by the registry so that a handler exceeding its timeout can be
 * abandoned and interrupted without tying up the caller. Close the registry to release that pool.
 */
public class HandlerRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, RegisteredHandler> handlers = new ConcurrentHashMap<>();
    private final Duration defaultTimeout;
    private final ExecutorService invoker;

    public HandlerRegistry() {
        this(SchedulerConfig.DEFAULT_HANDLER_TIMEOUT);
    }

    public HandlerRegistry(Duration defaultTimeout) {
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        this.invoker = Executors.newCachedThreadPool(new NamedThreadFactory("cadence-handler"));
    }

    /**
     * Registers a handler with the default timeout. A previous registration for the same action is
     * replaced.
     */
    public void register(String action, JobHandler handler) {
        register(action, handler, defaultTimeout);
    }

    /**
     * Registers a handler with its own timeout. A previous registration for the same action is
     * replaced.
     */
    public void register(String action, JobHandler handler, Duration timeout) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action is required");
        }
        Objects.requireNonNull(handler, "handler");
        Duration effective = timeout == null ? defaultTimeout : timeout;
        if (effective.isZero() || effective.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, got " + effective);
        }
        RegisteredHandler previous = handlers.put(action, new RegisteredHandler(action, handler, effective));
        if (previous != null) {
            log.info("Replaced handler for action '{}' with timeout {} seconds", action, effective.toSeconds());
        } else {
            log.info("Registered handler for action '{}' with timeout {} seconds", action, effective.toSeconds());
        }
    }

    public boolean unregister(String action) {
        return handlers.remove(action) != null;
    }

    public boolean isRegistered(String action) {
        return action != null && handlers.containsKey(action);
    }

    public Optional<RegisteredHandler> find(String action) {
        return action == null ? Optional.empty() : Optional.ofNullable(handlers.get(action));
    }

    public Set<String> actions() {
        return new TreeSet<>(handlers.keySet());
    }

    /**
     * Runs the handler with the given params and waits at most its timeout for the result.
     *
     * @throws HandlerTimeoutException   if the handler did not finish in time, it is interrupted.
     * @throws HandlerExecutionException if the handler threw.
     * @throws InterruptedException      if the calling thread was interrupted while waiting, the
     *                                   handler is interrupted as well.
     */
    public Map<String, Object> invoke(RegisteredHandler registered, Map<String, Object> params) throws InterruptedException {
        Future<Map<String, Object>> future;
        try {
            future = invoker.submit(() -> registered.handler().handle(params));
        } catch (RejectedExecutionException e) {
            throw new HandlerExecutionException(registered.action(), "Handler registry is closed", e);
        }

        try {
            return future.get(registered.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Handler for action '{}' timed out after {} seconds", registered.action(), registered.timeout().toSeconds());
            throw new HandlerTimeoutException(registered.action(), registered.timeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
            throw new HandlerExecutionException(registered.action(), message, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    @Override
    public void close() {
        invoker.shutdownNow();
        try {
            if (!invoker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Handler pool did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Handler pool shutdown interrupted.", e);
        }
    }

    /**
     * A handler bound to its action and timeout.
     */
    public record RegisteredHandler(String action, JobHandler handler, Duration timeout) {
    }
}
