package locaposty.worker.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import locaposty.worker.data.models.Post;
import locaposty.worker.data.models.Post.PostStatus;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link PostRecordStore} backed by the web application's {@code "Post"} table.
 */
@ApplicationScoped
public class PanachePostRecordStore implements PostRecordStore {

    private static final Logger LOG = Logger.getLogger(PanachePostRecordStore.class);

    private static final List<PostStatus> OPEN_STATUSES = List.of(PostStatus.DRAFT, PostStatus.SCHEDULED);

    @Override
    @Transactional
    public Optional<Post> findById(String postId) {
        return Post.findByIdOptional(postId);
    }

    @Override
    @Transactional
    public boolean markPublished(String postId, Instant publishedAt) {
        int updated = Post.update("status = ?1, publishedAt = ?2, updatedAt = ?2 where id = ?3 and status in ?4",
                PostStatus.PUBLISHED, publishedAt, postId, OPEN_STATUSES);
        if (updated == 0) {
            LOG.warnf("Post %s was not open, PUBLISHED not written", postId);
        }
        return updated > 0;
    }

    @Override
    @Transactional
    public boolean markFailed(String postId, Instant failedAt) {
        int updated = Post.update("status = ?1, updatedAt = ?2 where id = ?3 and status in ?4", PostStatus.FAILED,
                failedAt, postId, OPEN_STATUSES);
        if (updated == 0) {
            LOG.debugf("Post %s was not open, FAILED not written", postId);
        }
        return updated > 0;
    }

    @Override
    @Transactional
    public boolean markDeleted(String postId, Instant deletedAt) {
        return Post.update("status = ?1, updatedAt = ?2 where id = ?3 and status <> ?1", PostStatus.DELETED, deletedAt,
                postId) > 0;
    }
}
