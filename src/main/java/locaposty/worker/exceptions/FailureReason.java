package locaposty.worker.exceptions;

/**
 * Why a publish ended in FAILED. Logged with the failure and used as the {@code reason} tag of
 * {@code locaposty.posts.failed.total}; the post row itself only carries the FAILED status.
 */
public enum FailureReason {
    /**
     * Credentials missing, revoked, or rejected by the provider.
     */
    AUTH,

    /**
     * The location lacks provider identifiers, or the worker's own OAuth client was rejected.
     */
    CONFIGURATION,

    /**
     * The provider rejected the post content.
     */
    INVALID_REQUEST,

    /**
     * The provider does not know the account or location.
     */
    NOT_FOUND,

    /**
     * Provider-side errors that outlasted every retry.
     */
    PROVIDER_ERROR,

    /**
     * The provider could not be reached on any attempt.
     */
    NETWORK
}
