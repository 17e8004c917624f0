package co.deferworks.cadence.core.exception;

import java.time.Duration;

public class HandlerTimeoutException extends HandlerExecutionException {

    private final Duration timeout;

    public HandlerTimeoutException(String action, Duration timeout) {
        super(action, "Handler for action '" + action + "' timed out after " + timeout.toSeconds() + " seconds", null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
