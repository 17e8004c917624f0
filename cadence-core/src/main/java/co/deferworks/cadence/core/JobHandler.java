package co.deferworks.cadence.core;

import java.util.Map;

/**
 * JobHandler is the logic bound to an action name. It receives the job's parameters and may return a
 * structured result, which is stored on the execution record. Returning null is allowed.
 * <p>
 * Handlers run on a pooled thread and are interrupted when they exceed their timeout or when the
 * scheduler stops, long running handlers should respond to interruption.
 */
@FunctionalInterface
public interface JobHandler {
    Map<String, Object> handle(Map<String, Object> params) throws Exception;
}
