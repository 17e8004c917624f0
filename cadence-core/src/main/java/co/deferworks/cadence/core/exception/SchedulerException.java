package co.deferworks.cadence.core.exception;

/**
 * Base type for every error raised by the scheduler. All scheduler errors are unchecked, callers
 * decide which ones they want to handle.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
