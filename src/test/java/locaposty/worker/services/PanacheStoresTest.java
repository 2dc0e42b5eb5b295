package locaposty.worker.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import locaposty.worker.data.models.Location;
import locaposty.worker.data.models.Post;
import locaposty.worker.data.models.Post.PostStatus;
import locaposty.worker.testing.H2TestResource;
import locaposty.worker.testing.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Database tests for the post and location stores: conditional status writes and credential triple updates.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class PanacheStoresTest {

    private static final Instant NOW = TestFixtures.START;

    @Inject
    PostRecordStore postStore;

    @Inject
    LocationCredentialStore locationStore;

    @BeforeEach
    void setUp() {
        QuarkusTransaction.requiringNew().run(() -> {
            Post.<Post> listAll().forEach(Post::delete);
            Location.<Location> listAll().forEach(Location::delete);
        });
        QuarkusTransaction.requiringNew().run(() -> {
            Location location = TestFixtures.connectedLocation("loc-1", NOW);
            location.persist();
            Post post = TestFixtures.scheduledPost("post-1", location, NOW);
            post.mediaUrls = new ArrayList<>(
                    List.of("https://cdn.example.com/1.jpg", "https://cdn.example.com/2.mp4"));
            post.persist();
        });
    }

    @Test
    void testFindById_loadsLocationAndOrderedMedia() {
        Post post = postStore.findById("post-1").orElseThrow();

        assertEquals("loc-1", post.location.id);
        assertEquals("accounts/111", post.location.gmbAccountId);
        assertEquals(List.of("https://cdn.example.com/1.jpg", "https://cdn.example.com/2.mp4"), post.mediaUrls);
        assertTrue(postStore.findById("missing").isEmpty());
    }

    @Test
    void testMarkPublished_onlyOnce() {
        assertTrue(postStore.markPublished("post-1", NOW));
        assertFalse(postStore.markPublished("post-1", NOW.plusSeconds(5)));

        Post post = postStore.findById("post-1").orElseThrow();
        assertEquals(PostStatus.PUBLISHED, post.status);
        assertEquals(NOW, post.publishedAt);
    }

    @Test
    void testMarkFailed_publishedPostNotOverwritten() {
        postStore.markPublished("post-1", NOW);

        assertFalse(postStore.markFailed("post-1", NOW.plusSeconds(5)));
        assertEquals(PostStatus.PUBLISHED, postStore.findById("post-1").orElseThrow().status);
    }

    @Test
    void testMarkFailed_writesFailedStatusAndLeavesMediaAlone() {
        Instant failedAt = NOW.plusSeconds(30);

        assertTrue(postStore.markFailed("post-1", failedAt));
        assertFalse(postStore.markFailed("post-1", failedAt), "already terminal");

        Post post = postStore.findById("post-1").orElseThrow();
        assertEquals(PostStatus.FAILED, post.status);
        assertEquals(failedAt, post.updatedAt);
        assertNull(post.publishedAt);
        assertEquals(2, post.mediaUrls.size());
    }

    @Test
    void testMarkDeleted_blocksLaterPublish() {
        assertTrue(postStore.markDeleted("post-1", NOW));
        assertFalse(postStore.markDeleted("post-1", NOW));

        assertFalse(postStore.markPublished("post-1", NOW));
        assertEquals(PostStatus.DELETED, postStore.findById("post-1").orElseThrow().status);
    }

    @Test
    void testUpdateTokens_writesWholeTriple() {
        Instant expiresAt = NOW.plusSeconds(3599);

        assertTrue(locationStore.updateTokens("loc-1", new LocationTokens("ya29.new", "1//new", expiresAt), NOW));

        Location location = locationStore.findById("loc-1").orElseThrow();
        assertEquals("ya29.new", location.accessToken);
        assertEquals("1//new", location.refreshToken);
        assertEquals(expiresAt, location.tokenExpiresAt);
    }

    @Test
    void testUpdateTokens_clearedTriple() {
        assertTrue(locationStore.updateTokens("loc-1", LocationTokens.cleared(), NOW));

        Location location = locationStore.findById("loc-1").orElseThrow();
        assertNull(location.accessToken);
        assertNull(location.refreshToken);
        assertNull(location.tokenExpiresAt);
        assertFalse(locationStore.updateTokens("missing", LocationTokens.cleared(), NOW));
    }
}
