package co.deferworks.cadence.driver;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Tuning knobs for the scheduler engine. Instances are immutable, use {@link #builder()} or
 * {@link #fromEnvironment()}.
 */
public final class SchedulerConfig {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_HANDLER_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_START_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CLAIM_LEASE = Duration.ofHours(1);
    public static final int DEFAULT_EXECUTION_THREADS = 10;
    public static final int DEFAULT_CLAIM_BATCH_SIZE = 100;

    private final Duration pollInterval;
    private final Duration defaultHandlerTimeout;
    private final Duration startTimeout;
    private final Duration stopTimeout;
    private final Duration claimLease;
    private final int executionThreads;
    private final int claimBatchSize;
    private final int maxConsecutiveFailures;
    private final Clock clock;

    private SchedulerConfig(Builder builder) {
        this.pollInterval = builder.pollInterval;
        this.defaultHandlerTimeout = builder.defaultHandlerTimeout;
        this.startTimeout = builder.startTimeout;
        this.stopTimeout = builder.stopTimeout;
        this.claimLease = builder.claimLease;
        this.executionThreads = builder.executionThreads;
        this.claimBatchSize = builder.claimBatchSize;
        this.maxConsecutiveFailures = builder.maxConsecutiveFailures;
        this.clock = builder.clock;
    }

    public Duration getPollInterval() { return pollInterval; }
    public Duration getDefaultHandlerTimeout() { return defaultHandlerTimeout; }
    public Duration getStartTimeout() { return startTimeout; }
    public Duration getStopTimeout() { return stopTimeout; }
    public Duration getClaimLease() { return claimLease; }
    public int getExecutionThreads() { return executionThreads; }
    public int getClaimBatchSize() { return claimBatchSize; }
    public int getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
    public Clock getClock() { return clock; }

    public static SchedulerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration from {@code CADENCE_*} environment variables, falling back to the
     * defaults for anything unset.
     */
    public static SchedulerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static SchedulerConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        readLong(env, "CADENCE_POLL_INTERVAL_MS", v -> builder.withPollInterval(Duration.ofMillis(v)));
        readLong(env, "CADENCE_HANDLER_TIMEOUT_SECONDS", v -> builder.withDefaultHandlerTimeout(Duration.ofSeconds(v)));
        readLong(env, "CADENCE_START_TIMEOUT_SECONDS", v -> builder.withStartTimeout(Duration.ofSeconds(v)));
        readLong(env, "CADENCE_STOP_TIMEOUT_SECONDS", v -> builder.withStopTimeout(Duration.ofSeconds(v)));
        readLong(env, "CADENCE_CLAIM_LEASE_SECONDS", v -> builder.withClaimLease(Duration.ofSeconds(v)));
        readLong(env, "CADENCE_EXECUTION_THREADS", v -> builder.withExecutionThreads(Math.toIntExact(v)));
        readLong(env, "CADENCE_CLAIM_BATCH_SIZE", v -> builder.withClaimBatchSize(Math.toIntExact(v)));
        readLong(env, "CADENCE_MAX_CONSECUTIVE_FAILURES", v -> builder.withMaxConsecutiveFailures(Math.toIntExact(v)));
        return builder.build();
    }

    private static void readLong(Map<String, String> env, String key, java.util.function.LongConsumer setter) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            setter.accept(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number, got: " + value, e);
        }
    }

    public static class Builder {
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration defaultHandlerTimeout = DEFAULT_HANDLER_TIMEOUT;
        private Duration startTimeout = DEFAULT_START_TIMEOUT;
        private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;
        private Duration claimLease = DEFAULT_CLAIM_LEASE;
        private int executionThreads = DEFAULT_EXECUTION_THREADS;
        private int claimBatchSize = DEFAULT_CLAIM_BATCH_SIZE;
        private int maxConsecutiveFailures = 0;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * Delay between two polls of the job store.
         * Default: 1 second
         */
        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = positive(pollInterval, "pollInterval");
            return this;
        }

        /**
         * Timeout applied to handlers registered without an explicit one.
         * Default: 300 seconds
         */
        public Builder withDefaultHandlerTimeout(Duration timeout) {
            this.defaultHandlerTimeout = positive(timeout, "defaultHandlerTimeout");
            return this;
        }

        /**
         * How long {@code start()} waits for the polling loop to come up.
         * Default: 5 seconds
         */
        public Builder withStartTimeout(Duration timeout) {
            this.startTimeout = positive(timeout, "startTimeout");
            return this;
        }

        /**
         * How long {@code stop()} waits for the polling loop and in-flight executions to wind down.
         * Default: 30 seconds
         */
        public Builder withStopTimeout(Duration timeout) {
            this.stopTimeout = positive(timeout, "stopTimeout");
            return this;
        }

        /**
         * How long a claim made by one scheduler instance keeps other instances away from a job. It
         * should comfortably exceed the longest handler timeout.
         * Default: 1 hour
         */
        public Builder withClaimLease(Duration lease) {
            this.claimLease = positive(lease, "claimLease");
            return this;
        }

        /**
         * Size of the pool running execution tasks.
         * Default: 10
         */
        public Builder withExecutionThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("executionThreads must be at least 1, got " + threads);
            }
            this.executionThreads = threads;
            return this;
        }

        /**
         * Maximum number of due jobs claimed in a single poll.
         * Default: 100
         */
        public Builder withClaimBatchSize(int size) {
            if (size < 1) {
                throw new IllegalArgumentException("claimBatchSize must be at least 1, got " + size);
            }
            this.claimBatchSize = size;
            return this;
        }

        /**
         * Number of consecutive failed executions after which a recurring job is marked FAILED and no
         * longer scheduled. Zero disables the limit, failed jobs then simply run again at their next
         * scheduled time.
         * Default: 0
         */
        public Builder withMaxConsecutiveFailures(int max) {
            if (max < 0) {
                throw new IllegalArgumentException("maxConsecutiveFailures cannot be negative, got " + max);
            }
            this.maxConsecutiveFailures = max;
            return this;
        }

        /**
         * Clock used for every "now" comparison.
         * Default: system UTC clock
         */
        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "pollInterval=" + pollInterval +
                " defaultHandlerTimeout=" + defaultHandlerTimeout +
                " startTimeout=" + startTimeout +
                " stopTimeout=" + stopTimeout +
                " claimLease=" + claimLease +
                " executionThreads=" + executionThreads +
                " claimBatchSize=" + claimBatchSize +
                " maxConsecutiveFailures=" + maxConsecutiveFailures
                ;
    }
}
