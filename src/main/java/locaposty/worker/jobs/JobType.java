package locaposty.worker.jobs;

/**
 * Enumeration of async job types handled by the worker.
 *
 * <p>
 * Each type is served by exactly one {@link JobHandler}; {@link locaposty.worker.services.DelayedJobService} refuses to
 * start when two handlers claim the same type.
 */
public enum JobType {

    /**
     * Publishes one scheduled post to Google Business Profile.
     * <p>
     * <b>Key:</b> {@code post-{postId}}
     * <p>
     * <b>Handler:</b> PostPublishJobHandler
     */
    POST_PUBLISH("post-", "Scheduled post publication");

    private final String keyPrefix;
    private final String description;

    JobType(String keyPrefix, String description) {
        this.keyPrefix = keyPrefix;
        this.description = description;
    }

    /**
     * Returns the deterministic job key for the given subject id.
     *
     * @param subjectId
     *            id of the entity the job acts on
     * @return key unique among live jobs of this type
     */
    public String keyFor(String subjectId) {
        return keyPrefix + subjectId;
    }

    public String getDescription() {
        return description;
    }
}
