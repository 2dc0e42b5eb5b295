package locaposty.worker.exceptions;

import locaposty.worker.jobs.RetryPolicy;

/**
 * Exception thrown when the provider could not be reached (connect failure, timeout, malformed response). Retried
 * with backoff.
 */
public class ProviderNetworkException extends PublishException {

    public ProviderNetworkException(String message) {
        super(message, FailureReason.NETWORK, RetryPolicy.BACKOFF);
    }

    public ProviderNetworkException(String message, Throwable cause) {
        super(message, cause, FailureReason.NETWORK, RetryPolicy.BACKOFF);
    }
}
