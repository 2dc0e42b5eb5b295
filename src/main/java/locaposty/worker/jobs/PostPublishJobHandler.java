package locaposty.worker.jobs;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import locaposty.worker.data.models.DelayedJob;
import locaposty.worker.exceptions.FailureReason;
import locaposty.worker.exceptions.PublishException;
import locaposty.worker.services.PostRecordStore;
import locaposty.worker.services.PublishExecutor;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.Map;

/**
 * Job handler that publishes one scheduled post.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "subjectId": "post id",
 *   "requestedBy": "owner@example.com"   // optional
 * }
 * </pre>
 *
 * <p>
 * When the last attempt fails, {@link #onExhausted} writes {@code FAILED}, then logs and counts the reason of the final
 * failure. Posts that already received their terminal status during an attempt are left untouched because the store
 * only updates open posts.
 */
@ApplicationScoped
public class PostPublishJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(PostPublishJobHandler.class);

    @Inject
    PublishExecutor publishExecutor;

    @Inject
    PostRecordStore postStore;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Clock clock;

    @Override
    public JobType handlesType() {
        return JobType.POST_PUBLISH;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        String postId = postId(payload);

        Span span = tracer.spanBuilder("post.publish").setAttribute("job.id", jobId).setAttribute("post.id", postId)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            PublishExecutor.Outcome outcome = publishExecutor.publish(postId);
            span.setAttribute("publish.outcome", outcome.name());
        } catch (PublishException e) {
            span.recordException(e);
            span.setAttribute("publish.failure_reason", e.getReason().name());
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public void onExhausted(Long jobId, Map<String, Object> payload, Throwable lastFailure) {
        String postId = postId(payload);
        FailureReason reason = lastFailure instanceof PublishException publishFailure
                ? publishFailure.getReason()
                : FailureReason.PROVIDER_ERROR;

        if (postStore.markFailed(postId, clock.instant())) {
            Counter.builder("locaposty.posts.failed.total").tag("reason", reason.name()).register(meterRegistry)
                    .increment();
            LOG.errorf("Post %s marked FAILED after job %d exhausted its attempts (%s): %s", postId, jobId, reason,
                    lastFailure.getMessage());
        }
    }

    private static String postId(Map<String, Object> payload) {
        Object postId = payload.get(DelayedJob.PAYLOAD_SUBJECT_ID);
        if (postId == null) {
            throw new IllegalArgumentException("Publish job payload has no post id");
        }
        return postId.toString();
    }
}
