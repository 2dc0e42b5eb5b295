package locaposty.worker.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import locaposty.worker.api.types.LocalPostRequestType;
import locaposty.worker.data.models.Location;
import locaposty.worker.data.models.Post;
import locaposty.worker.data.models.Post.PostStatus;
import locaposty.worker.exceptions.FailureReason;
import locaposty.worker.exceptions.InvalidPostRequestException;
import locaposty.worker.exceptions.LocationAuthException;
import locaposty.worker.exceptions.LocationConfigurationException;
import locaposty.worker.exceptions.ProviderNetworkException;
import locaposty.worker.exceptions.ProviderServerException;
import locaposty.worker.exceptions.PublishException;
import locaposty.worker.exceptions.ResourceNotFoundException;
import locaposty.worker.integration.gbp.BusinessProfileClient;
import locaposty.worker.integration.gbp.LocalPostMapper;
import locaposty.worker.integration.gbp.PublishResult;
import locaposty.worker.jobs.RetryPolicy;
import locaposty.worker.observability.LoggingConfig;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes one post to Google Business Profile.
 *
 * <p>
 * <b>Status policy:</b> failures that retrying cannot fix (missing post or location, missing provider ids, missing or
 * revoked credentials, provider 400/404) write {@code FAILED} and count the {@link FailureReason} before the exception
 * propagates. Transient failures (5xx, 429, network, 401/403) leave the post {@code SCHEDULED}; the job queue decides
 * whether to try again and the publish job handler writes {@code FAILED} once retries are exhausted.
 *
 * <p>
 * A post that is already being published by another worker slot, or that is no longer {@code SCHEDULED} when its row
 * is read, is skipped without any provider call. The slot is claimed before the row is read, so a slot that follows
 * a finished attempt always sees that attempt's status write.
 */
@ApplicationScoped
public class PublishExecutor {

    private static final Logger LOG = Logger.getLogger(PublishExecutor.class);

    @Inject
    PostRecordStore postStore;

    @Inject
    CredentialRefresher credentialRefresher;

    @Inject
    BusinessProfileClient profileClient;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public enum Outcome {
        PUBLISHED, SKIPPED
    }

    /**
     * Runs one publish attempt.
     *
     * @param postId
     *            the post to publish
     * @return {@link Outcome#PUBLISHED} or {@link Outcome#SKIPPED}
     * @throws PublishException
     *             on any failure; its {@link RetryPolicy} tells the queue whether to retry
     */
    public Outcome publish(String postId) {
        LoggingConfig.setPostId(postId);

        // claim before reading: a read taken while another slot is mid-call would still see SCHEDULED
        if (!inFlight.add(postId)) {
            LOG.warnf("Skipping post %s: already being published by another worker slot", postId);
            countOutcome("skipped");
            return Outcome.SKIPPED;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Post post = postStore.findById(postId)
                    .orElseThrow(() -> new ResourceNotFoundException("Post " + postId + " not found"));

            if (post.status != PostStatus.SCHEDULED) {
                LOG.infof("Skipping post %s: status is %s", postId, post.status);
                countOutcome("skipped");
                return Outcome.SKIPPED;
            }

            publishScheduled(post);
            countOutcome("published");
            return Outcome.PUBLISHED;
        } catch (PublishException e) {
            countOutcome(e.retryPolicy() == RetryPolicy.NEVER ? "failed" : "retryable");
            throw e;
        } finally {
            inFlight.remove(postId);
            sample.stop(Timer.builder("locaposty.posts.publish.duration").register(meterRegistry));
        }
    }

    private void publishScheduled(Post post) {
        Location location = post.location;
        if (location == null) {
            throw failNow(post, new ResourceNotFoundException("Post " + post.id + " has no location"));
        }
        LoggingConfig.setLocationId(location.id);

        if (!location.hasProviderIdentifiers()) {
            throw failNow(post, new LocationConfigurationException(
                    "Location " + location.id + " is missing its Google Business Profile account or location id"));
        }
        if (location.refreshToken == null || location.refreshToken.isBlank()) {
            throw failNow(post, new LocationAuthException(
                    "Location " + location.id + " has no refresh token, reconnect it to Google Business Profile"));
        }

        String accessToken;
        try {
            accessToken = credentialRefresher.getValidToken(location.id);
        } catch (LocationAuthException | ResourceNotFoundException e) {
            throw failNow(post, e);
        }

        LocalPostRequestType payload = LocalPostMapper.toRequest(post);
        PublishResult result = profileClient.createLocalPost(location.gmbAccountId, location.gmbLocationId,
                accessToken, payload);

        switch (result.outcome()) {
            case SUCCESS -> {
                if (postStore.markPublished(post.id, clock.instant())) {
                    LOG.infof("Post %s published to Google Business Profile (%s)", post.id, result.message());
                } else {
                    LOG.warnf("Post %s published but its status changed meanwhile, PUBLISHED not written", post.id);
                }
            }
            case AUTH_FAILURE -> {
                // the cached token may have raced with a refresh elsewhere; force a new one for the retry
                credentialRefresher.invalidateAccessToken(location.id);
                throw new LocationAuthException(result.message(), RetryPolicy.ONCE);
            }
            case INVALID_REQUEST -> throw failNow(post,
                    new InvalidPostRequestException(result.message(), result.statusCode()));
            case NOT_FOUND -> throw failNow(post, new ResourceNotFoundException(result.message()));
            case SERVER_ERROR -> throw new ProviderServerException(result.message(), result.statusCode());
            case NETWORK_FAILURE -> throw new ProviderNetworkException(result.message());
        }
    }

    /**
     * Writes FAILED for a failure that will not be retried and returns it for throwing.
     */
    private PublishException failNow(Post post, PublishException failure) {
        if (postStore.markFailed(post.id, clock.instant())) {
            Counter.builder("locaposty.posts.failed.total").tag("reason", failure.getReason().name())
                    .register(meterRegistry).increment();
            LOG.errorf("Post %s failed (%s): %s", post.id, failure.getReason(), failure.getMessage());
        }
        return failure;
    }

    private void countOutcome(String outcome) {
        Counter.builder("locaposty.posts.publish.total").tag("outcome", outcome).register(meterRegistry).increment();
    }
}
