package co.deferworks.cadence.core.exception;

/**
 * Raised when a job definition is malformed: an invalid schedule, a missing field, or an action
 * nobody registered a handler for. A job that fails validation is never persisted.
 */
public class JobValidationException extends SchedulerException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
