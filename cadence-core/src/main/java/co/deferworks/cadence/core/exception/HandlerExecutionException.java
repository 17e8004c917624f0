package co.deferworks.cadence.core.exception;

/**
 * Wraps any failure raised while a handler runs. It is confined to a single execution attempt and
 * ends up recorded as a failed execution, it never reaches the polling loop.
 */
public class HandlerExecutionException extends SchedulerException {

    private final String action;

    public HandlerExecutionException(String action, String message, Throwable cause) {
        super(message, cause);
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
