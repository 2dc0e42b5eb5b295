package locaposty.worker.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import locaposty.worker.data.models.DelayedJob;
import locaposty.worker.jobs.JobHandler;
import locaposty.worker.jobs.JobStore;
import locaposty.worker.jobs.JobType;
import locaposty.worker.jobs.NewJob;
import locaposty.worker.jobs.RetryPolicy;
import locaposty.worker.observability.LoggingConfig;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Central orchestrator for database-backed async job processing.
 *
 * <p>
 * Handles:
 * <ul>
 * <li>Job enqueuing, replacement and removal by deterministic key</li>
 * <li>Claiming ready jobs via {@code locked_at}/{@code locked_by}, including jobs whose worker stalled</li>
 * <li>Retry logic with exponential backoff, driven by the failure's {@link RetryPolicy}</li>
 * <li>OpenTelemetry spans and Micrometer counters for every attempt</li>
 * </ul>
 *
 * <p>
 * <b>Retry Strategy:</b> Failed jobs retry up to {@code max_attempts} (default 3) with exponential backoff:
 * {@code delay = 2^(attempt-1) * base_delay_seconds} with random jitter (±25%). The jitter range never lets a later
 * delay undercut an earlier one. After the last permitted attempt the job is FAILED (dead), is never run again, and its
 * handler's {@link JobHandler#onExhausted} runs once.
 *
 * @see JobHandler for handler contract
 * @see locaposty.worker.jobs.JobWorker for the polling loop
 */
@ApplicationScoped
public class DelayedJobService {

    private static final Logger LOG = Logger.getLogger(DelayedJobService.class);

    /**
     * Registry mapping JobType to JobHandler, populated at construction from CDI.
     */
    private final Map<JobType, JobHandler> handlerRegistry;

    private final String workerId = resolveWorkerId();

    @Inject
    JobStore jobStore;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "locaposty.jobs.max-attempts",
            defaultValue = "3")
    int maxAttempts;

    @ConfigProperty(
            name = "locaposty.jobs.backoff-base-seconds",
            defaultValue = "10")
    long backoffBaseSeconds;

    @ConfigProperty(
            name = "locaposty.jobs.stale-lock-minutes",
            defaultValue = "5")
    long staleLockMinutes;

    @Inject
    public DelayedJobService(Instance<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        LOG.infof("Initialized DelayedJobService with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Builds the type to handler map.
     *
     * @throws IllegalStateException
     *             if two handlers register for the same JobType
     */
    private static Map<JobType, JobHandler> buildHandlerRegistry(Iterable<JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s", handler.getClass().getSimpleName(), type);
        }
        return registry;
    }

    /**
     * Enqueues a job that becomes ready at {@code runAt}.
     *
     * @throws locaposty.worker.exceptions.DuplicateJobException
     *             if a live job already exists for the subject
     */
    public DelayedJob enqueue(JobType type, String subjectId, String requestedBy, Instant runAt) {
        return jobStore.insert(new NewJob(type, subjectId, requestedBy, runAt, maxAttempts), clock.instant());
    }

    /**
     * Replaces the pending job of a subject (or enqueues one if there is none).
     *
     * @throws locaposty.worker.exceptions.JobActiveException
     *             if the subject's job is executing
     */
    public DelayedJob replace(JobType type, String subjectId, String requestedBy, Instant runAt) {
        return jobStore.replacePending(new NewJob(type, subjectId, requestedBy, runAt, maxAttempts),
                clock.instant());
    }

    /**
     * Deletes the subject's job if it has not started yet.
     *
     * @return true if a pending job was removed
     */
    public boolean removePending(JobType type, String subjectId) {
        return jobStore.removePending(type.keyFor(subjectId));
    }

    public Optional<DelayedJob> findLive(JobType type, String subjectId) {
        return jobStore.findLive(type.keyFor(subjectId));
    }

    /**
     * Claims up to {@code limit} ready jobs for this worker.
     */
    public List<DelayedJob> claimReadyJobs(int limit) {
        Instant now = clock.instant();
        Instant staleBefore = now.minus(Duration.ofMinutes(staleLockMinutes));
        List<DelayedJob> claimed = jobStore.claimReady(now, staleBefore, workerId, limit);
        for (DelayedJob job : claimed) {
            LOG.debugf("Claimed job %d (type: %s, key: %s, attempt %d/%d)", job.id, job.jobType, job.jobKey,
                    job.attempts, job.maxAttempts);
        }
        return claimed;
    }

    /**
     * Executes one claimed attempt of a job and records the outcome.
     *
     * @param job
     *            a job previously returned by {@link #claimReadyJobs}
     */
    public void executeJob(DelayedJob job) {
        Map<String, Object> payload = job.payload();
        JobHandler handler = handlerRegistry.get(job.jobType);
        if (handler == null) {
            String error = "No handler registered for JobType." + job.jobType;
            jobStore.fail(job.id, workerId, error, clock.instant());
            LOG.errorf("Job %d marked FAILED: %s", job.id, error);
            return;
        }

        if (job.attempts > job.maxAttempts) {
            // reclaimed after a stall with no attempts left
            LOG.warnf("Job %d (key: %s) stalled on its final attempt", job.id, job.jobKey);
            countJob(job.jobType, "stalled");
            markDead(job, handler, payload, new IllegalStateException("Job stalled on its final attempt"));
            return;
        }

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.id)
                .setAttribute("job.type", job.jobType.name()).setAttribute("job.key", job.jobKey)
                .setAttribute("job.attempt", job.attempts).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(job.id);
            LoggingConfig.setRequestOrigin("JobType." + job.jobType.name());
            LOG.infof("Job %d (type: %s) active, attempt %d/%d", job.id, job.jobType, job.attempts, job.maxAttempts);

            handler.execute(job.id, payload);

            span.addEvent("job.completed");
            if (jobStore.complete(job.id, workerId, clock.instant())) {
                countJob(job.jobType, "completed");
                LOG.infof("Job %d (type: %s) completed successfully on attempt %d", job.id, job.jobType,
                        job.attempts);
            } else {
                LOG.warnf("Job %d finished but its claim was taken over, completion not recorded", job.id);
            }

        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            span.recordException(e);
            span.addEvent("job.failed");
            handleFailure(job, handler, payload, e);

        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private void handleFailure(DelayedJob job, JobHandler handler, Map<String, Object> payload, Exception failure) {
        RetryPolicy policy = RetryPolicy.of(failure);
        int attemptLimit = policy.attemptLimit(job.maxAttempts);

        if (job.attempts < attemptLimit) {
            long delaySeconds = calculateBackoffDelay(job.attempts);
            Instant now = clock.instant();
            if (jobStore.retry(job.id, workerId, now.plusSeconds(delaySeconds), describe(failure), now)) {
                countJob(job.jobType, "retry");
                LOG.warnf("Job %d (type: %s) failed on attempt %d/%d, retrying in %d seconds: %s", job.id,
                        job.jobType, job.attempts, attemptLimit, delaySeconds, describe(failure));
            }
            return;
        }

        markDead(job, handler, payload, failure);
    }

    private void markDead(DelayedJob job, JobHandler handler, Map<String, Object> payload, Exception failure) {
        if (!jobStore.fail(job.id, workerId, describe(failure), clock.instant())) {
            LOG.warnf("Job %d failed but its claim was taken over, failure not recorded", job.id);
            return;
        }
        countJob(job.jobType, "dead");
        LOG.errorf(failure, "Job %d (type: %s) marked FAILED after %d attempt(s)", job.id, job.jobType, job.attempts);

        try {
            handler.onExhausted(job.id, payload, failure);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Exhaustion callback for job %d failed", job.id);
        }
    }

    /**
     * Calculates the next retry delay using exponential backoff with jitter.
     *
     * <p>
     * <b>Formula:</b> {@code delay = 2^(attempt-1) * base * (1.0 ± 0.25)}
     *
     * @param attempt
     *            the attempt that just failed (1-indexed)
     * @return delay in seconds before the next attempt
     */
    public long calculateBackoffDelay(int attempt) {
        double baseDelay = Math.pow(2, Math.max(0, attempt - 1)) * backoffBaseSeconds;
        double jitter = 0.75 + (Math.random() * 0.5); // Random multiplier in [0.75, 1.25]
        return Math.max(1L, Math.round(baseDelay * jitter));
    }

    public String getWorkerId() {
        return workerId;
    }

    private void countJob(JobType type, String status) {
        Counter.builder("locaposty.jobs.total").tag("type", type.name()).tag("status", status).register(meterRegistry)
                .increment();
    }

    private static String describe(Throwable failure) {
        return failure.getClass().getSimpleName() + ": " + failure.getMessage();
    }

    private static String resolveWorkerId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        return host + ":" + ManagementFactory.getRuntimeMXBean().getPid();
    }
}
