package locaposty.worker.exceptions;

import locaposty.worker.jobs.RetryPolicy;

/**
 * Exception thrown when the provider answers with a transient error (5xx or 429). Retried with backoff.
 */
public class ProviderServerException extends PublishException {

    private final int statusCode;

    public ProviderServerException(String message, int statusCode) {
        super(message, FailureReason.PROVIDER_ERROR, RetryPolicy.BACKOFF);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
