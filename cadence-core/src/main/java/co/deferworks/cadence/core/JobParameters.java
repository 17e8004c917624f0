package co.deferworks.cadence.core;

import co.deferworks.cadence.core.exception.JobValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The action a job invokes and the arguments handed to its handler.
 */
public record JobParameters(String action, Map<String, Object> params) {

    public JobParameters {
        if (action == null || action.isBlank()) {
            throw new JobValidationException("Job action is required");
        }
        // JSON params may carry null values, which Map.copyOf rejects.
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static JobParameters of(String action) {
        return new JobParameters(action, Map.of());
    }

    public static JobParameters of(String action, Map<String, Object> params) {
        return new JobParameters(action, params);
    }
}
