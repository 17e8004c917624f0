package co.deferworks.cadence.core;

import co.deferworks.cadence.core.exception.JobValidationException;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Schedule describes when a job fires. There is exactly one variant per {@link Job.JobType}, and every
 * variant validates itself on construction, so an instance that exists is always usable for next run
 * computation.
 */
public sealed interface Schedule permits Schedule.OneTime, Schedule.Interval, Schedule.Cron {

    ZoneId DEFAULT_TIMEZONE = ZoneOffset.UTC;

    /**
     * The job type this schedule belongs to.
     */
    Job.JobType type();

    ZoneId timezone();

    static OneTime oneTime(OffsetDateTime runAt) {
        return new OneTime(runAt, DEFAULT_TIMEZONE);
    }

    static Interval interval(long intervalSeconds, OffsetDateTime startAt) {
        return new Interval(intervalSeconds, startAt, null, DEFAULT_TIMEZONE);
    }

    static Interval interval(long intervalSeconds, OffsetDateTime startAt, OffsetDateTime endAt) {
        return new Interval(intervalSeconds, startAt, endAt, DEFAULT_TIMEZONE);
    }

    static Cron cron(String expression) {
        return new Cron(expression, DEFAULT_TIMEZONE);
    }

    static Cron cron(String expression, ZoneId timezone) {
        return new Cron(expression, timezone);
    }

    /**
     * Fires once at {@code runAt}.
     */
    record OneTime(OffsetDateTime runAt, ZoneId timezone) implements Schedule {
        public OneTime {
            if (runAt == null) {
                throw new JobValidationException("One-time schedule requires run_at");
            }
            timezone = timezone == null ? DEFAULT_TIMEZONE : timezone;
        }

        @Override
        public Job.JobType type() {
            return Job.JobType.ONE_TIME;
        }
    }

    /**
     * Fires every {@code intervalSeconds}, starting at {@code startAt}. When {@code endAt} is set the
     * schedule stops producing run times past it.
     */
    record Interval(long intervalSeconds, OffsetDateTime startAt, OffsetDateTime endAt, ZoneId timezone) implements Schedule {
        public Interval {
            if (intervalSeconds <= 0) {
                throw new JobValidationException("interval_seconds must be greater than 0, got " + intervalSeconds);
            }
            if (startAt == null) {
                throw new JobValidationException("Interval schedule requires start_at");
            }
            if (endAt != null && !endAt.isAfter(startAt)) {
                throw new JobValidationException("end_at must be after start_at");
            }
            timezone = timezone == null ? DEFAULT_TIMEZONE : timezone;
        }

        @Override
        public Job.JobType type() {
            return Job.JobType.INTERVAL;
        }
    }

    /**
     * Fires whenever the cron expression matches, evaluated in {@code timezone}.
     */
    record Cron(String expression, ZoneId timezone) implements Schedule {
        public Cron {
            CronExpressions.validate(expression);
            expression = expression.trim();
            timezone = timezone == null ? DEFAULT_TIMEZONE : timezone;
        }

        @Override
        public Job.JobType type() {
            return Job.JobType.CRON;
        }
    }
}
