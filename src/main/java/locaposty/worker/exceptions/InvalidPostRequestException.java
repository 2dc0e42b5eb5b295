package locaposty.worker.exceptions;

import locaposty.worker.jobs.RetryPolicy;

/**
 * Exception thrown when the provider rejects the post payload (HTTP 400 and other non-retryable 4xx).
 */
public class InvalidPostRequestException extends PublishException {

    private final int statusCode;

    public InvalidPostRequestException(String message, int statusCode) {
        super(message, FailureReason.INVALID_REQUEST, RetryPolicy.NEVER);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
