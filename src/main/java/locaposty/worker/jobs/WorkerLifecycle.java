package locaposty.worker.jobs;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Starts the job worker with the application and drains it on SIGTERM/SIGINT before the datasource closes.
 */
@ApplicationScoped
public class WorkerLifecycle {

    private static final Logger LOG = Logger.getLogger(WorkerLifecycle.class);

    @Inject
    JobWorker jobWorker;

    @ConfigProperty(
            name = "locaposty.worker.enabled",
            defaultValue = "true")
    boolean enabled;

    @ConfigProperty(
            name = "locaposty.worker.shutdown-grace-seconds",
            defaultValue = "30")
    long shutdownGraceSeconds;

    void onStart(@Observes StartupEvent event) {
        if (!enabled) {
            LOG.info("Job worker disabled by configuration");
            return;
        }
        jobWorker.start();
    }

    void onStop(@Observes ShutdownEvent event) {
        LOG.infof("Shutting down job worker (grace: %d seconds)", shutdownGraceSeconds);
        if (jobWorker.stop(shutdownGraceSeconds)) {
            LOG.info("Job worker stopped cleanly");
        }
    }
}
