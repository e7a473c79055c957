package io.github.byzatic.jobs.base_exceptions;

/**
 * Raised by a host that cannot serve a request, e.g. when the scheduler context is unavailable.
 */
public class SchedulerException extends Exception {
    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(Throwable cause) {
        super(cause);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }

    public SchedulerException(Throwable cause, String message) {
        super(message, cause);
    }
}
