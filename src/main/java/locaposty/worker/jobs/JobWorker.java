package locaposty.worker.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import locaposty.worker.data.models.DelayedJob;
import locaposty.worker.services.DelayedJobService;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the job table and runs claimed jobs on a fixed pool of worker slots.
 *
 * <p>
 * The semaphore holds one permit per slot; a poll never claims more jobs than there are free permits, so a claimed job
 * always starts immediately and its lock never ages while it waits for a thread.
 */
@ApplicationScoped
public class JobWorker {

    private static final Logger LOG = Logger.getLogger(JobWorker.class);

    @Inject
    DelayedJobService jobService;

    @ConfigProperty(
            name = "locaposty.worker.concurrency",
            defaultValue = "5")
    int concurrency;

    private Semaphore slots;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @PostConstruct
    void init() {
        this.slots = new Semaphore(concurrency);
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable, "publish-worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            LOG.infof("Job worker %s started with %d slots", jobService.getWorkerId(), concurrency);
        }
    }

    @Scheduled(
            every = "${locaposty.worker.poll-interval}",
            identity = "job-worker-poll",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        if (!running.get()) {
            return;
        }
        int free = slots.availablePermits();
        if (free == 0) {
            LOG.trace("All worker slots busy, skipping poll");
            return;
        }

        List<DelayedJob> jobs = jobService.claimReadyJobs(free);
        for (DelayedJob job : jobs) {
            dispatch(job);
        }
    }

    private void dispatch(DelayedJob job) {
        slots.acquireUninterruptibly();
        try {
            executor.execute(() -> {
                try {
                    jobService.executeJob(job);
                } finally {
                    slots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            slots.release();
            // shutting down; the claim goes stale and another worker reclaims the job
            LOG.warnf("Worker shutting down, job %d left for stale-lock recovery", job.id);
        }
    }

    /**
     * Stops polling and waits for running attempts to finish.
     *
     * @param graceSeconds
     *            how long to wait before giving up on in-flight attempts
     * @return true if every in-flight attempt finished in time
     */
    public boolean stop(long graceSeconds) {
        running.set(false);
        executor.shutdown();
        try {
            boolean drained = executor.awaitTermination(graceSeconds, TimeUnit.SECONDS);
            if (!drained) {
                LOG.warnf("%d job(s) still running after %d seconds of shutdown grace",
                        concurrency - slots.availablePermits(), graceSeconds);
            }
            return drained;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getAvailableSlots() {
        return slots.availablePermits();
    }
}
