package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Job.JobType;
import co.deferworks.cadence.core.JobParameters;
import co.deferworks.cadence.core.Schedule;
import co.deferworks.cadence.core.exception.JobValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Converts schedules, job parameters and execution results to and from the JSON stored in the
 * {@code jsonb} columns.
 * <p>
 * Schedules are stored with snake_case keys, e.g. a cron schedule is
 * {@code {"expression": "0 * * * *", "timezone": "UTC"}}. Reading a schedule back builds the typed
 * {@link Schedule} variant for the job type, so a stored payload goes through the same validation as a
 * new one.
 */
public class JobJsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public JobJsonCodec() {
        this(createDefaultMapper());
    }

    public JobJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String writeSchedule(Schedule schedule) {
        ObjectNode node = mapper.createObjectNode();
        if (schedule instanceof Schedule.OneTime oneTime) {
            node.put("run_at", oneTime.runAt().toString());
        } else if (schedule instanceof Schedule.Interval interval) {
            node.put("interval_seconds", interval.intervalSeconds());
            node.put("start_at", interval.startAt().toString());
            if (interval.endAt() != null) {
                node.put("end_at", interval.endAt().toString());
            }
        } else if (schedule instanceof Schedule.Cron cron) {
            node.put("expression", cron.expression());
        } else {
            throw new IllegalArgumentException("Unknown schedule variant: " + schedule);
        }
        node.put("timezone", schedule.timezone().getId());
        return write(node);
    }

    /**
     * Builds the schedule variant for {@code type} from its JSON form.
     *
     * @throws JobValidationException if the payload does not describe a valid schedule of that type.
     */
    public Schedule readSchedule(JobType type, String json) {
        JsonNode node = readTree(json, "schedule");
        try {
            ZoneId zone = node.hasNonNull("timezone") ? ZoneId.of(node.get("timezone").asText()) : Schedule.DEFAULT_TIMEZONE;
            return switch (type) {
                case ONE_TIME -> new Schedule.OneTime(timestamp(node, "run_at", zone), zone);
                case INTERVAL -> new Schedule.Interval(
                        requiredLong(node, "interval_seconds"),
                        timestamp(node, "start_at", zone),
                        timestamp(node, "end_at", zone),
                        zone);
                case CRON -> new Schedule.Cron(node.hasNonNull("expression") ? node.get("expression").asText() : null, zone);
            };
        } catch (DateTimeException e) {
            throw new JobValidationException("Invalid schedule for job type " + type + ": " + e.getMessage(), e);
        }
    }

    public String writeParameters(JobParameters parameters) {
        ObjectNode node = mapper.createObjectNode();
        node.put("action", parameters.action());
        node.set("params", mapper.valueToTree(parameters.params()));
        return write(node);
    }

    public JobParameters readParameters(String json) {
        JsonNode node = readTree(json, "parameters");
        String action = node.hasNonNull("action") ? node.get("action").asText() : null;
        Map<String, Object> params = node.hasNonNull("params") ? mapper.convertValue(node.get("params"), MAP_TYPE) : Map.of();
        return new JobParameters(action, params);
    }

    public String writeResult(Map<String, Object> result) {
        return result == null ? null : write(result);
    }

    public Map<String, Object> readResult(String json) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new JobValidationException("Failed to deserialize execution result from JSON", e);
        }
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JobValidationException("Failed to serialize to JSON: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode readTree(String json, String what) {
        if (json == null) {
            throw new JobValidationException("Missing " + what);
        }
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new JobValidationException("Invalid " + what + ": expected a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new JobValidationException("Invalid " + what + " JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static long requiredLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong()) {
            throw new JobValidationException("Schedule field '" + field + "' must be an integer");
        }
        return value.asLong();
    }

    /**
     * ISO-8601 timestamp, a value without an offset is taken to be in the schedule's timezone.
     */
    private static OffsetDateTime timestamp(JsonNode node, String field, ZoneId zone) {
        if (!node.hasNonNull(field)) {
            return null;
        }
        String text = node.get(field).asText();
        try {
            return OffsetDateTime.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).atZone(zone).toOffsetDateTime();
            } catch (DateTimeParseException nested) {
                throw new JobValidationException("Schedule field '" + field + "' is not an ISO-8601 timestamp: " + text, nested);
            }
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return mapper;
    }
}
