package locaposty.worker.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import locaposty.worker.data.models.DelayedJob.JobStatus;
import locaposty.worker.jobs.JobStore;
import locaposty.worker.jobs.JobWorker;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Registers the worker's gauges at startup.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauges:</b> {@code locaposty.jobs.depth{status}} - Job rows per live status</li>
 * <li><b>Gauges:</b> {@code locaposty.worker.slots.available} - Free worker slots</li>
 * <li><b>Counters:</b> {@code locaposty.jobs.total{type,status}} - Attempt outcomes, see DelayedJobService</li>
 * <li><b>Counters/Timers:</b> {@code locaposty.posts.publish.*} - Publish outcomes and latency</li>
 * <li><b>Counters:</b> {@code locaposty.token.refresh.total{status}} - OAuth refresh outcomes</li>
 * <li><b>Counters:</b> {@code locaposty.reviews.task.total{task,status}} - Periodic task outcomes</li>
 * </ul>
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    JobStore jobStore;

    @Inject
    JobWorker jobWorker;

    void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        for (JobStatus status : List.of(JobStatus.PENDING, JobStatus.PROCESSING)) {
            Gauge.builder("locaposty.jobs.depth", jobStore, store -> store.countByStatus(status))
                    .description("Number of " + status.name() + " jobs").tags(List.of(Tag.of("status", status.name())))
                    .register(registry);
        }

        Gauge.builder("locaposty.worker.slots.available", jobWorker, JobWorker::getAvailableSlots)
                .description("Worker slots free to take a job").register(registry);

        LOG.info("Observability metrics registration complete. Access metrics at /q/metrics");
    }
}
