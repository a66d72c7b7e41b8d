package villagecompute.talentqueue.jobs.worker;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.broker.StalledRecovery;
import villagecompute.talentqueue.config.JobsConfig;
import villagecompute.talentqueue.exceptions.BrokerUnavailableException;
import villagecompute.talentqueue.jobs.JobQueue;

/**
 * Detects ACTIVE jobs whose worker stopped sending heartbeats (crash, kill, lost connection).
 *
 * <p>
 * A job silent for longer than {@code talentqueue.jobs.stall-interval} goes back to WAITING without consuming an
 * attempt. After more than {@code talentqueue.jobs.max-stalled-count} stalls it is failed with
 * {@link QueueBroker#STALLED_REASON}. A late ack from the original worker is rejected by the lock token.
 */
@ApplicationScoped
public class StalledJobDetector {

    private static final Logger LOG = Logger.getLogger(StalledJobDetector.class);

    @Inject
    QueueBroker broker;

    @Inject
    JobsConfig config;

    @Inject
    WorkerPoolManager pools;

    @Scheduled(
            every = "${talentqueue.jobs.stall-interval:30s}",
            delayed = "${talentqueue.jobs.stall-interval:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void checkStalledJobs() {
        for (JobQueue queue : JobQueue.values()) {
            recover(queue);
        }
    }

    /**
     * Runs one stall check for {@code queue}.
     */
    public StalledRecovery recover(JobQueue queue) {
        StalledRecovery recovery;
        try {
            recovery = broker.recoverStalled(queue, config.stallInterval(), config.maxStalledCount());
        } catch (BrokerUnavailableException e) {
            LOG.warnf("Stall check for queue %s skipped: %s", queue.getName(), e.getMessage());
            return StalledRecovery.none();
        }
        if (!recovery.requeued().isEmpty()) {
            LOG.warnf("Requeued %d stalled jobs in queue %s: %s", recovery.requeued().size(), queue.getName(),
                    recovery.requeued());
            pools.wakeUp(queue);
        }
        if (!recovery.failed().isEmpty()) {
            LOG.errorf("Failed %d jobs in queue %s after exceeding the stall limit: %s", recovery.failed().size(),
                    queue.getName(), recovery.failed());
        }
        return recovery;
    }
}
