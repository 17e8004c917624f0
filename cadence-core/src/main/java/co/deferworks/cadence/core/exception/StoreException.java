package co.deferworks.cadence.core.exception;

/**
 * Connectivity or query failure in the job store.
 */
public class StoreException extends SchedulerException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
