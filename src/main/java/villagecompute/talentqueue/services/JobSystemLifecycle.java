package villagecompute.talentqueue.services;

import org.jboss.logging.Logger;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import villagecompute.talentqueue.jobs.JobHandlerRegistry;

/**
 * Starts the job system with the application and shuts it down on SIGTERM/SIGINT.
 */
@ApplicationScoped
public class JobSystemLifecycle {

    private static final Logger LOG = Logger.getLogger(JobSystemLifecycle.class);

    @Inject
    BackgroundJobService jobService;

    @Inject
    JobHandlerRegistry handlers;

    void onStartup(@Observes StartupEvent event) {
        LOG.infof("Starting job system (%d handlers registered)", handlers.size());
        jobService.start();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.infof("Received shutdown signal (standard: %s)", event.isStandardShutdown());
        jobService.shutdown();
    }
}
