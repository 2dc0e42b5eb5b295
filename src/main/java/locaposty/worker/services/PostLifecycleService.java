package locaposty.worker.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import locaposty.worker.data.models.Post;
import locaposty.worker.data.models.Post.PostStatus;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Keeps the publish queue in step with post edits made by the API layer.
 *
 * <p>
 * The API writes the post row first and then calls the matching hook here.
 */
@ApplicationScoped
public class PostLifecycleService {

    private static final Logger LOG = Logger.getLogger(PostLifecycleService.class);

    @Inject
    PostPublishQueue publishQueue;

    @Inject
    PostRecordStore postStore;

    @Inject
    Clock clock;

    /**
     * A new post was stored. SCHEDULED posts get a job at {@code scheduledAt}, or right away when it is missing or
     * already past (publish now). Drafts get nothing.
     */
    public void onCreated(Post post, String requestedBy) {
        if (post.status != PostStatus.SCHEDULED) {
            LOG.debugf("Post %s created as %s, nothing to schedule", post.id, post.status);
            return;
        }
        publishQueue.schedule(post.id, post.scheduledAt, requestedBy);
    }

    /**
     * A post was edited.
     *
     * @param previousStatus
     *            status before the edit
     * @param previousScheduledAt
     *            scheduled time before the edit
     * @param post
     *            the post as stored after the edit
     * @param requestedBy
     *            audit identity of the editor
     */
    public void onUpdated(PostStatus previousStatus, Instant previousScheduledAt, Post post, String requestedBy) {
        switch (post.status) {
            case DRAFT, DELETED -> publishQueue.cancel(post.id);
            case SCHEDULED -> {
                if (previousStatus != PostStatus.SCHEDULED
                        || !Objects.equals(previousScheduledAt, post.scheduledAt)) {
                    // reschedule inserts when there is no job, so it also covers DRAFT/FAILED -> SCHEDULED
                    publishQueue.reschedule(post.id, post.scheduledAt, requestedBy);
                } else {
                    LOG.debugf("Post %s edited without schedule change", post.id);
                }
            }
            case PUBLISHED, FAILED -> LOG.debugf("Post %s updated in terminal status %s", post.id, post.status);
        }
    }

    /**
     * A post was deleted: mark it DELETED and drop its pending job.
     */
    public void onDeleted(String postId) {
        postStore.markDeleted(postId, clock.instant());
        publishQueue.cancel(postId);
    }
}
