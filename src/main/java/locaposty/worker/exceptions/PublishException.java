package locaposty.worker.exceptions;

import locaposty.worker.jobs.RetryAware;
import locaposty.worker.jobs.RetryPolicy;

/**
 * Base class for failures of a publish attempt.
 *
 * <p>
 * Each failure carries the {@link FailureReason} logged and counted if the post ends up FAILED, and the
 * {@link RetryPolicy} the job queue applies to the attempt.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public abstract class PublishException extends RuntimeException implements RetryAware {

    private final FailureReason reason;
    private final RetryPolicy retryPolicy;

    protected PublishException(String message, FailureReason reason, RetryPolicy retryPolicy) {
        super(message);
        this.reason = reason;
        this.retryPolicy = retryPolicy;
    }

    protected PublishException(String message, Throwable cause, FailureReason reason, RetryPolicy retryPolicy) {
        super(message, cause);
        this.reason = reason;
        this.retryPolicy = retryPolicy;
    }

    public FailureReason getReason() {
        return reason;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }
}
