package locaposty.worker.services;

import locaposty.worker.data.models.Post;

import java.time.Instant;
import java.util.Optional;

/**
 * The worker's view of the post table.
 *
 * <p>
 * Every status write is conditional on the row still being open ({@code DRAFT} or {@code SCHEDULED}); the boolean
 * result tells the caller whether it won. {@code PUBLISHED} and {@code DELETED} rows are never overwritten.
 */
public interface PostRecordStore {

    /**
     * Loads a post together with its location.
     */
    Optional<Post> findById(String postId);

    /**
     * Moves an open post to PUBLISHED and stamps {@code publishedAt}.
     *
     * @return true if the row was updated
     */
    boolean markPublished(String postId, Instant publishedAt);

    /**
     * Moves an open post to FAILED. The reason is the caller's to log; the row has no place for it.
     *
     * @return true if the row was updated
     */
    boolean markFailed(String postId, Instant failedAt);

    /**
     * Moves a post to DELETED from any other status.
     *
     * @return true if the row was updated
     */
    boolean markDeleted(String postId, Instant deletedAt);
}
