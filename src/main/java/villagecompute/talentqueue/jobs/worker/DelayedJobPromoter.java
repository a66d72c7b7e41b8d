package villagecompute.talentqueue.jobs.worker;

import java.time.Instant;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.exceptions.BrokerUnavailableException;
import villagecompute.talentqueue.jobs.JobQueue;

/**
 * Moves DELAYED jobs (requested delays and retry backoffs) back to WAITING once due.
 *
 * <p>
 * <b>Schedule:</b> every {@code talentqueue.jobs.promote-interval} (default 1s). Promotion is a single conditional
 * update, so running it on several instances at once is harmless.
 */
@ApplicationScoped
public class DelayedJobPromoter {

    private static final Logger LOG = Logger.getLogger(DelayedJobPromoter.class);

    @Inject
    QueueBroker broker;

    @Inject
    WorkerPoolManager pools;

    @Scheduled(
            every = "${talentqueue.jobs.promote-interval:1s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void promoteDueJobs() {
        promote(Instant.now());
    }

    /**
     * Promotes every job due at {@code now} and wakes the local dispatchers when anything moved.
     *
     * @return number of promoted jobs, or -1 if the broker could not be reached
     */
    public int promote(Instant now) {
        int promoted;
        try {
            promoted = broker.promoteDelayed(now);
        } catch (BrokerUnavailableException e) {
            LOG.warnf("Delayed job promotion skipped: %s", e.getMessage());
            return -1;
        }
        if (promoted > 0) {
            LOG.debugf("Promoted %d delayed jobs to waiting", promoted);
            for (JobQueue queue : JobQueue.values()) {
                pools.wakeUp(queue);
            }
        }
        return promoted;
    }
}
