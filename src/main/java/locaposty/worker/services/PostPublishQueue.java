package locaposty.worker.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import locaposty.worker.data.models.DelayedJob;
import locaposty.worker.data.models.DelayedJob.JobStatus;
import locaposty.worker.exceptions.DuplicateJobException;
import locaposty.worker.exceptions.JobActiveException;
import locaposty.worker.jobs.JobHandle;
import locaposty.worker.jobs.JobType;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable queue of publish jobs, one per post, keyed {@code post-{postId}}.
 *
 * <p>
 * A run time in the past (or now) means "run as soon as a worker slot is free"; immediate publishing is the same
 * operation with zero delay.
 *
 * <p>
 * <b>Cancellation:</b> only jobs that have not started can be cancelled or replaced. An attempt that is already
 * executing runs to completion; the publish executor's status check keeps it from publishing a post that was deleted
 * or moved back to draft in the meantime.
 */
@ApplicationScoped
public class PostPublishQueue {

    private static final Logger LOG = Logger.getLogger(PostPublishQueue.class);

    @Inject
    DelayedJobService jobService;

    @Inject
    Clock clock;

    /**
     * Enqueues the publish job of a post.
     *
     * @param postId
     *            the post to publish
     * @param runAt
     *            when to publish; null or past means now
     * @param requestedBy
     *            audit identity of the requester, may be null
     * @return the queued job
     * @throws DuplicateJobException
     *             if the post already has a live job; use {@link #reschedule} instead
     */
    public JobHandle schedule(String postId, Instant runAt, String requestedBy) {
        DelayedJob job = jobService.enqueue(JobType.POST_PUBLISH, postId, requestedBy, clamp(runAt));
        LOG.infof("Scheduled post %s for %s (job %d)", postId, job.scheduledAt, job.id);
        return JobHandle.of(job);
    }

    /**
     * Removes the pending publish job of a post. Does nothing when the post has no job.
     */
    public void cancel(String postId) {
        if (jobService.removePending(JobType.POST_PUBLISH, postId)) {
            LOG.infof("Cancelled publish job for post %s", postId);
            return;
        }
        Optional<DelayedJob> live = jobService.findLive(JobType.POST_PUBLISH, postId);
        if (live.isPresent() && live.get().status == JobStatus.PROCESSING) {
            LOG.warnf("Publish job %d for post %s is already executing and cannot be cancelled", live.get().id, postId);
        } else {
            LOG.debugf("No pending publish job for post %s", postId);
        }
    }

    /**
     * Moves the publish job of a post to a new time. Remove and insert happen in one transaction, so there is never a
     * moment with two jobs for the post. Behaves like {@link #schedule} when the post has no job.
     *
     * @throws JobActiveException
     *             if the current job is executing
     */
    public JobHandle reschedule(String postId, Instant newRunAt, String requestedBy) {
        DelayedJob job = jobService.replace(JobType.POST_PUBLISH, postId, requestedBy, clamp(newRunAt));
        LOG.infof("Rescheduled post %s for %s (job %d)", postId, job.scheduledAt, job.id);
        return JobHandle.of(job);
    }

    public Optional<JobHandle> findJob(String postId) {
        return jobService.findLive(JobType.POST_PUBLISH, postId).map(JobHandle::of);
    }

    private Instant clamp(Instant runAt) {
        Instant now = clock.instant();
        return runAt == null || runAt.isBefore(now) ? now : runAt;
    }
}
