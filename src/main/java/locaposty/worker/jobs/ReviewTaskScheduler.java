package locaposty.worker.jobs;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import locaposty.worker.api.types.ReviewTaskResultType;
import locaposty.worker.integration.reviews.ReviewTasksClient;
import locaposty.worker.observability.LoggingConfig;
import org.jboss.logging.Logger;

import java.util.function.Supplier;

/**
 * Fixed-interval review maintenance tasks.
 *
 * <p>
 * Independent of the publish queue: the tasks only call the web application, share no state with the publish
 * pipeline, and a failing run is logged and counted without affecting the next run or the worker.
 * <ul>
 * <li>Review polling every {@code locaposty.reviews.fetch-interval} (15m)</li>
 * <li>Auto-reply processing every {@code locaposty.reviews.auto-reply-interval} (30m)</li>
 * </ul>
 */
@ApplicationScoped
public class ReviewTaskScheduler {

    private static final Logger LOG = Logger.getLogger(ReviewTaskScheduler.class);

    @Inject
    ReviewTasksClient reviewTasksClient;

    @Inject
    MeterRegistry meterRegistry;

    @Scheduled(
            every = "${locaposty.reviews.fetch-interval}",
            identity = ReviewTasksClient.FETCH_LATEST_REVIEWS,
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void fetchLatestReviews() {
        runTask(ReviewTasksClient.FETCH_LATEST_REVIEWS, reviewTasksClient::fetchLatestReviews);
    }

    @Scheduled(
            every = "${locaposty.reviews.auto-reply-interval}",
            identity = ReviewTasksClient.PROCESS_AUTO_REPLIES,
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void processAutoReplies() {
        runTask(ReviewTasksClient.PROCESS_AUTO_REPLIES, reviewTasksClient::processAutoReplies);
    }

    /**
     * Runs one task, never letting its failure escape.
     *
     * @return true if the task succeeded
     */
    boolean runTask(String task, Supplier<ReviewTaskResultType> call) {
        LoggingConfig.setRequestOrigin("task." + task);
        try {
            ReviewTaskResultType result = call.get();
            LOG.infof("Task %s finished (status %d): %s", task, result.statusCode(), result.results());
            count(task, "success");
            return true;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Task %s failed", task);
            count(task, "failure");
            return false;
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private void count(String task, String status) {
        Counter.builder("locaposty.reviews.task.total").tag("task", task).tag("status", status)
                .register(meterRegistry).increment();
    }
}
