package locaposty.worker.testing;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import jakarta.enterprise.inject.Instance;
import locaposty.worker.data.models.DelayedJob;
import locaposty.worker.integration.gbp.BusinessProfileClient;
import locaposty.worker.integration.gbp.GbpOAuthClient;
import locaposty.worker.jobs.JobHandler;
import locaposty.worker.jobs.PostPublishJobHandler;
import locaposty.worker.services.CredentialRefresher;
import locaposty.worker.services.DelayedJobService;
import locaposty.worker.services.PostLifecycleService;
import locaposty.worker.services.PostPublishQueue;
import locaposty.worker.services.PublishExecutor;

import java.time.Duration;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The publish pipeline wired by hand: real services and HTTP clients over in-memory stores and a {@link MutableClock}.
 * Jobs run on the calling thread through {@link #runDueJobs()}.
 */
public class PublishPipeline {

    public static final int MAX_ATTEMPTS = 3;
    public static final long BACKOFF_BASE_SECONDS = 10;

    public final MutableClock clock = new MutableClock(TestFixtures.START);
    public final InMemoryPostRecordStore posts = new InMemoryPostRecordStore();
    public final InMemoryLocationCredentialStore locations = new InMemoryLocationCredentialStore();
    public final InMemoryJobStore jobs = new InMemoryJobStore();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    public final GbpOAuthClient oauthClient;
    public final BusinessProfileClient profileClient;
    public final CredentialRefresher credentialRefresher = new CredentialRefresher();
    public final PublishExecutor publishExecutor = new PublishExecutor();
    public final PostPublishJobHandler jobHandler = new PostPublishJobHandler();
    public final DelayedJobService jobService;
    public final PostPublishQueue queue = new PostPublishQueue();
    public final PostLifecycleService lifecycle = new PostLifecycleService();

    public PublishPipeline(String gbpApiUrl, String tokenUrl) {
        Tracer tracer = TracerProvider.noop().get("test");
        oauthClient = TestClients.oauthClient(tokenUrl);
        profileClient = TestClients.profileClient(gbpApiUrl);

        TestInjection.inject(credentialRefresher, "locationStore", locations);
        TestInjection.inject(credentialRefresher, "oauthClient", oauthClient);
        TestInjection.inject(credentialRefresher, "meterRegistry", meterRegistry);
        TestInjection.inject(credentialRefresher, "clock", clock);
        TestInjection.inject(credentialRefresher, "expiryMarginSeconds", 300L);
        TestInjection.inject(credentialRefresher, "defaultLifetimeSeconds", 3600L);

        TestInjection.inject(publishExecutor, "postStore", posts);
        TestInjection.inject(publishExecutor, "credentialRefresher", credentialRefresher);
        TestInjection.inject(publishExecutor, "profileClient", profileClient);
        TestInjection.inject(publishExecutor, "meterRegistry", meterRegistry);
        TestInjection.inject(publishExecutor, "clock", clock);

        TestInjection.inject(jobHandler, "publishExecutor", publishExecutor);
        TestInjection.inject(jobHandler, "postStore", posts);
        TestInjection.inject(jobHandler, "tracer", tracer);
        TestInjection.inject(jobHandler, "meterRegistry", meterRegistry);
        TestInjection.inject(jobHandler, "clock", clock);

        jobService = new DelayedJobService(handlers(jobHandler));
        TestInjection.inject(jobService, "jobStore", jobs);
        TestInjection.inject(jobService, "tracer", tracer);
        TestInjection.inject(jobService, "meterRegistry", meterRegistry);
        TestInjection.inject(jobService, "clock", clock);
        TestInjection.inject(jobService, "maxAttempts", MAX_ATTEMPTS);
        TestInjection.inject(jobService, "backoffBaseSeconds", BACKOFF_BASE_SECONDS);
        TestInjection.inject(jobService, "staleLockMinutes", 5L);

        TestInjection.inject(queue, "jobService", jobService);
        TestInjection.inject(queue, "clock", clock);

        TestInjection.inject(lifecycle, "publishQueue", queue);
        TestInjection.inject(lifecycle, "postStore", posts);
        TestInjection.inject(lifecycle, "clock", clock);
    }

    /**
     * CDI {@link Instance} yielding the given handlers, for constructing a {@link DelayedJobService}.
     */
    @SuppressWarnings("unchecked")
    public static Instance<JobHandler> handlers(JobHandler... handlers) {
        Instance<JobHandler> instance = mock(Instance.class);
        when(instance.iterator()).thenAnswer(invocation -> List.of(handlers).iterator());
        return instance;
    }

    /**
     * Claims every job due at the current clock time and runs each attempt to its end.
     *
     * @return number of attempts executed
     */
    public int runDueJobs() {
        List<DelayedJob> claimed = jobService.claimReadyJobs(10);
        claimed.forEach(jobService::executeJob);
        return claimed.size();
    }

    /**
     * Alternates {@link #runDueJobs()} and advancing the clock by {@code step} until no live job is left.
     *
     * @return total attempts executed
     */
    public int runUntilIdle(Duration step, int maxRounds) {
        int executed = 0;
        for (int round = 0; round < maxRounds; round++) {
            executed += runDueJobs();
            if (jobs.countLive() == 0) {
                return executed;
            }
            clock.advance(step);
        }
        return executed;
    }

    public double counter(String name, String tagKey, String tagValue) {
        Counter counter = meterRegistry.find(name).tag(tagKey, tagValue).counter();
        return counter == null ? 0 : counter.count();
    }
}
