package locaposty.worker.exceptions;

import locaposty.worker.jobs.RetryPolicy;

/**
 * Exception thrown when a post or location is missing, either in the database or on the provider side.
 *
 * <p>
 * Never retried.
 */
public class ResourceNotFoundException extends PublishException {

    public ResourceNotFoundException(String message) {
        super(message, FailureReason.NOT_FOUND, RetryPolicy.NEVER);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause, FailureReason.NOT_FOUND, RetryPolicy.NEVER);
    }
}
