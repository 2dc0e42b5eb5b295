package locaposty.worker.exceptions;

import locaposty.worker.jobs.RetryPolicy;

/**
 * Exception thrown when a location cannot authenticate against the provider.
 *
 * <p>
 * Missing or revoked refresh tokens are final ({@link RetryPolicy#NEVER}). A 401/403 from the publish endpoint is
 * retried once ({@link RetryPolicy#ONCE}) after the cached access token has been dropped.
 */
public class LocationAuthException extends PublishException {

    public LocationAuthException(String message) {
        super(message, FailureReason.AUTH, RetryPolicy.NEVER);
    }

    public LocationAuthException(String message, Throwable cause) {
        super(message, cause, FailureReason.AUTH, RetryPolicy.NEVER);
    }

    public LocationAuthException(String message, RetryPolicy retryPolicy) {
        super(message, FailureReason.AUTH, retryPolicy);
    }
}
