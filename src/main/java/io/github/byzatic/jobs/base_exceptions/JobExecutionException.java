package io.github.byzatic.jobs.base_exceptions;

/**
 * The only exception a job hands back to its host.
 * The host decides whether to re-run the job from {@link #refireImmediately()}, never from the subtype.
 */
public class JobExecutionException extends Exception {
    private final boolean refireImmediately;

    public JobExecutionException(String message) {
        this(message, null, false);
    }

    public JobExecutionException(Throwable cause) {
        super(cause);
        this.refireImmediately = false;
    }

    public JobExecutionException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public JobExecutionException(Throwable cause, String message) {
        this(message, cause, false);
    }

    public JobExecutionException(String message, Throwable cause, boolean refireImmediately) {
        super(message, cause);
        this.refireImmediately = refireImmediately;
    }

    public boolean refireImmediately() {
        return refireImmediately;
    }
}
