package locaposty.worker.exceptions;

import locaposty.worker.jobs.RetryPolicy;

/**
 * Exception thrown when the token endpoint rejects the refresh request for a reason other than the refresh token
 * itself, such as {@code invalid_client} or {@code invalid_request}.
 *
 * <p>
 * The location's credentials stay as they are; the worker's client configuration is what needs fixing. Retried with
 * backoff.
 */
public class OAuthClientRejectedException extends PublishException {

    private final int status;
    private final String error;

    public OAuthClientRejectedException(int status, String error) {
        super("OAuth token endpoint rejected the client request (" + status + " " + error + ")",
                FailureReason.CONFIGURATION, RetryPolicy.BACKOFF);
        this.status = status;
        this.error = error;
    }

    public int getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }
}
