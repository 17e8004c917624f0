package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Job.JobType;
import co.deferworks.cadence.core.JobParameters;
import co.deferworks.cadence.core.Schedule;
import co.deferworks.cadence.core.exception.JobValidationException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobJsonCodecTest {

    private final JobJsonCodec codec = new JobJsonCodec();

    @Test
    void testCronScheduleUsesSnakeCaseKeys() {
        String json = codec.writeSchedule(Schedule.cron("0 * * * *", ZoneId.of("Asia/Tokyo")));

        assertEquals("{\"expression\":\"0 * * * *\",\"timezone\":\"Asia/Tokyo\"}", json);
    }

    @Test
    void testIntervalScheduleOmitsMissingEnd() {
        String json = codec.writeSchedule(Schedule.interval(30, OffsetDateTime.parse("2025-01-01T00:00:00Z")));

        assertEquals("{\"interval_seconds\":30,\"start_at\":\"2025-01-01T00:00Z\",\"timezone\":\"Z\"}", json);
        Schedule.Interval read = (Schedule.Interval) codec.readSchedule(JobType.INTERVAL, json);
        assertNull(read.endAt());
        assertEquals(30, read.intervalSeconds());
    }

    @Test
    void testTimestampWithoutOffsetUsesScheduleTimezone() {
        Schedule schedule = codec.readSchedule(JobType.ONE_TIME,
                "{\"run_at\": \"2025-07-01T09:00:00\", \"timezone\": \"America/New_York\"}");

        Schedule.OneTime oneTime = (Schedule.OneTime) schedule;
        assertEquals(OffsetDateTime.parse("2025-07-01T09:00:00-04:00"), oneTime.runAt());
        assertEquals(ZoneId.of("America/New_York"), oneTime.timezone());
    }

    @Test
    void testMissingTimezoneDefaultsToUtc() {
        Schedule schedule = codec.readSchedule(JobType.CRON, "{\"expression\": \"*/5 * * * *\"}");

        assertEquals(Schedule.DEFAULT_TIMEZONE, schedule.timezone());
    }

    @Test
    void testInvalidPayloadsAreRejected() {
        assertThrows(JobValidationException.class, () -> codec.readSchedule(JobType.CRON, "{\"expression\": \"61 * * * *\"}"));
        assertThrows(JobValidationException.class, () -> codec.readSchedule(JobType.CRON, "{}"));
        assertThrows(JobValidationException.class, () -> codec.readSchedule(JobType.INTERVAL, "{\"interval_seconds\": \"often\", \"start_at\": \"2025-01-01T00:00:00Z\"}"));
        assertThrows(JobValidationException.class, () -> codec.readSchedule(JobType.INTERVAL, "{\"interval_seconds\": 0, \"start_at\": \"2025-01-01T00:00:00Z\"}"));
        assertThrows(JobValidationException.class, () -> codec.readSchedule(JobType.ONE_TIME, "{\"run_at\": \"yesterday\"}"));
        assertThrows(JobValidationException.class, () -> codec.readSchedule(JobType.ONE_TIME, "{\"run_at\": \"2025-01-01T00:00:00Z\", \"timezone\": \"Mars/Olympus\"}"));
        assertThrows(JobValidationException.class, () -> codec.readSchedule(JobType.ONE_TIME, "[]"));
        assertThrows(JobValidationException.class, () -> codec.readSchedule(JobType.ONE_TIME, "not json"));
    }

    @Test
    void testParametersKeepNestedValuesAndNulls() {
        Map<String, Object> params = new HashMap<>();
        params.put("list", List.of(1, 2));
        params.put("nested", Map.of("k", "v"));
        params.put("nothing", null);

        JobParameters read = codec.readParameters(codec.writeParameters(JobParameters.of("echo", params)));

        assertEquals("echo", read.action());
        assertEquals(List.of(1, 2), read.params().get("list"));
        assertEquals(Map.of("k", "v"), read.params().get("nested"));
        assertTrue(read.params().containsKey("nothing"));
        assertNull(read.params().get("nothing"));
    }

    @Test
    void testParametersWithoutParamsDefaultToEmpty() {
        JobParameters read = codec.readParameters("{\"action\": \"echo\"}");

        assertTrue(read.params().isEmpty());
        assertThrows(JobValidationException.class, () -> codec.readParameters("{\"params\": {}}"));
    }

    @Test
    void testResults() {
        assertNull(codec.writeResult(null));
        assertNull(codec.readResult(null));
        assertEquals(Map.of("x", 1), codec.readResult(codec.writeResult(Map.of("x", 1))));
    }
}
