package locaposty.worker.jobs;

/**
 * How the queue treats a failed attempt.
 *
 * <p>
 * Failures that do not declare a policy are treated as {@link #BACKOFF}.
 */
public enum RetryPolicy {

    /**
     * Retrying cannot help. The job is dead after this attempt.
     */
    NEVER,

    /**
     * Allow one more attempt with backoff, then give up.
     */
    ONCE,

    /**
     * Retry with exponential backoff until max attempts are used up.
     */
    BACKOFF;

    /**
     * Total attempts this policy permits for a job configured with {@code maxAttempts}.
     */
    public int attemptLimit(int maxAttempts) {
        return switch (this) {
            case NEVER -> 1;
            case ONCE -> Math.min(2, maxAttempts);
            case BACKOFF -> maxAttempts;
        };
    }

    /**
     * Resolves the policy a failure asks for.
     */
    public static RetryPolicy of(Throwable failure) {
        if (failure instanceof RetryAware aware) {
            return aware.retryPolicy();
        }
        return BACKOFF;
    }
}
