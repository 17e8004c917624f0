package co.deferworks.cadence.core.exception;

/**
 * Raised when the engine cannot start or stop within its bounded timeout. Unlike the other
 * scheduler errors this one is meant to reach the operator.
 */
public class SchedulerLifecycleException extends SchedulerException {

    public SchedulerLifecycleException(String message) {
        super(message);
    }

    public SchedulerLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
