package co.deferworks.cadence.core;

import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Derives due timestamps from a job's schedule. Pure: the caller supplies "now".
 */
public final class NextRunCalculator {

    private NextRunCalculator() {
    }

    /**
     * The first time a freshly created job becomes due.
     * <ul>
     *     <li>one-time: its {@code run_at}</li>
     *     <li>interval: its {@code start_at}, or nothing if {@code end_at} has already passed</li>
     *     <li>cron: the first match strictly after {@code now}</li>
     * </ul>
     */
    public static Optional<OffsetDateTime> firstRun(Schedule schedule, OffsetDateTime now) {
        if (schedule instanceof Schedule.OneTime oneTime) {
            return Optional.of(oneTime.runAt());
        }
        if (schedule instanceof Schedule.Interval interval) {
            if (interval.endAt() != null && interval.endAt().isBefore(now)) {
                return Optional.empty();
            }
            return Optional.of(interval.startAt());
        }
        if (schedule instanceof Schedule.Cron cron) {
            return nextCronRun(cron, now);
        }
        throw new IllegalArgumentException("Unknown schedule variant: " + schedule);
    }

    /**
     * The next time a job becomes due after an execution that finished at {@code now}. Empty means the
     * job never fires again: always the case for one-time jobs, and for interval jobs once the next
     * slot falls past {@code end_at}.
     */
    public static Optional<OffsetDateTime> nextRun(Job job, OffsetDateTime now) {
        Schedule schedule = job.schedule();
        if (schedule instanceof Schedule.OneTime) {
            return Optional.empty();
        }
        if (schedule instanceof Schedule.Interval interval) {
            OffsetDateTime next = now.plusSeconds(interval.intervalSeconds());
            if (interval.endAt() != null && next.isAfter(interval.endAt())) {
                return Optional.empty();
            }
            return Optional.of(next);
        }
        if (schedule instanceof Schedule.Cron cron) {
            return nextCronRun(cron, now);
        }
        throw new IllegalArgumentException("Unknown schedule variant: " + schedule);
    }

    private static Optional<OffsetDateTime> nextCronRun(Schedule.Cron cron, OffsetDateTime now) {
        return CronExpressions.nextExecution(cron.expression(), cron.timezone(), now.toZonedDateTime())
                .map(ZonedDateTime::toOffsetDateTime);
    }
}
