package co.deferworks.cadence.core;

import co.deferworks.cadence.core.exception.JobValidationException;
import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parses and evaluates cron expressions.
 * <p>
 * Two shapes are accepted: the classic five field form {@code min hour dom mon dow}, and a six field
 * form with a trailing seconds field {@code min hour dom mon dow sec}. Every field other than seconds
 * follows the classic crontab ranges.
 * <p>
 * Expressions evaluated by {@link #nextExecution} are kept in a small LRU cache, so a recurring job
 * does not re-parse its schedule on every run. Validation alone never populates the cache.
 */
public final class CronExpressions {

    static final int CACHE_SIZE = 256;

    private static final CronParser UNIX_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser SECONDS_PARSER = new CronParser(unixWithSeconds());

    private static final Map<String, ExecutionTime> CACHE = Collections.synchronizedMap(
            new LinkedHashMap<>(CACHE_SIZE, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, ExecutionTime> eldest) {
                    return size() > CACHE_SIZE;
                }
            });

    private CronExpressions() {
    }

    /**
     * Parses the expression and throws {@link JobValidationException} when it does not describe a
     * valid schedule.
     */
    public static void validate(String expression) {
        parse(normalize(expression));
    }

    /**
     * Returns the first instant strictly after {@code after} that matches the expression, evaluated
     * in {@code zone}. Empty when the expression never fires again.
     */
    public static Optional<ZonedDateTime> nextExecution(String expression, ZoneId zone, ZonedDateTime after) {
        return executionTime(expression).nextExecution(after.withZoneSameInstant(zone));
    }

    static int cachedExpressions() {
        return CACHE.size();
    }

    private static ExecutionTime executionTime(String expression) {
        String normalized = normalize(expression);
        ExecutionTime cached = CACHE.get(normalized);
        if (cached != null) {
            return cached;
        }
        ExecutionTime parsed = ExecutionTime.forCron(parse(normalized));
        CACHE.put(normalized, parsed);
        return parsed;
    }

    private static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new JobValidationException("Cron expression is required");
        }
        return expression.trim().replaceAll("\\s+", " ");
    }

    private static Cron parse(String expression) {
        String[] fields = expression.split(" ");
        CronParser parser;
        String toParse;
        if (fields.length == 5) {
            parser = UNIX_PARSER;
            toParse = expression;
        } else if (fields.length == 6) {
            // cron-utils always reads seconds first.
            parser = SECONDS_PARSER;
            toParse = fields[5] + " " + String.join(" ", Arrays.copyOf(fields, 5));
        } else {
            throw new JobValidationException("Invalid cron expression '" + expression + "': expected 5 or 6 fields, got " + fields.length);
        }
        try {
            return parser.parse(toParse).validate();
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    /**
     * The crontab definition with a seconds field in front.
     */
    private static CronDefinition unixWithSeconds() {
        return CronDefinitionBuilder.defineCron()
                .withSeconds().withValidRange(0, 59).withStrictRange().and()
                .withMinutes().withValidRange(0, 59).withStrictRange().and()
                .withHours().withValidRange(0, 23).withStrictRange().and()
                .withDayOfMonth().withValidRange(1, 31).withStrictRange().and()
                .withMonth().withValidRange(1, 12).withStrictRange().and()
                .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1).withIntMapping(7, 0).withStrictRange().and()
                .matchDayOfWeekAndDayOfMonth()
                .instance();
    }
}
