package locaposty.worker.integration.gbp;

/**
 * Outcome of one publish request against the Business Profile API.
 *
 * <p>
 * Every HTTP outcome maps to exactly one {@link Outcome}; callers switch over it exhaustively.
 *
 * @param outcome
 *            classification of the response
 * @param statusCode
 *            HTTP status, 0 when no response was received
 * @param message
 *            provider error message or transport failure description; provider post name on success
 */
public record PublishResult(Outcome outcome, int statusCode, String message) {

    public enum Outcome {
        /**
         * 2xx, the post is live or being processed by the provider.
         */
        SUCCESS,

        /**
         * 401/403, the access token was rejected.
         */
        AUTH_FAILURE,

        /**
         * 400 and other non-retryable 4xx, the payload was rejected.
         */
        INVALID_REQUEST,

        /**
         * 404, the account or location is unknown to the provider.
         */
        NOT_FOUND,

        /**
         * 5xx or 429, worth retrying later.
         */
        SERVER_ERROR,

        /**
         * No response received (connect failure, timeout, interrupted).
         */
        NETWORK_FAILURE
    }

    public static PublishResult success(int statusCode, String postName) {
        return new PublishResult(Outcome.SUCCESS, statusCode, postName);
    }

    public static PublishResult networkFailure(String message) {
        return new PublishResult(Outcome.NETWORK_FAILURE, 0, message);
    }

    /**
     * Classifies a non-2xx status code.
     */
    public static PublishResult failure(int statusCode, String message) {
        Outcome outcome;
        if (statusCode == 401 || statusCode == 403) {
            outcome = Outcome.AUTH_FAILURE;
        } else if (statusCode == 404) {
            outcome = Outcome.NOT_FOUND;
        } else if (statusCode == 429 || statusCode >= 500) {
            outcome = Outcome.SERVER_ERROR;
        } else {
            outcome = Outcome.INVALID_REQUEST;
        }
        return new PublishResult(outcome, statusCode, message);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
