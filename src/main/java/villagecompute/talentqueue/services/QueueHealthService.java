package villagecompute.talentqueue.services;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.talentqueue.api.types.HealthCheckType;
import villagecompute.talentqueue.api.types.HealthStatus;
import villagecompute.talentqueue.api.types.JobCountsType;
import villagecompute.talentqueue.api.types.QueueStatsSummaryType;
import villagecompute.talentqueue.api.types.QueueStatsType;
import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.config.JobsConfig;
import villagecompute.talentqueue.exceptions.BrokerUnavailableException;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.worker.WorkerPoolManager;

/**
 * Queue statistics, wait estimates and the health verdict of the job system.
 *
 * <p>
 * <b>Verdict:</b>
 * <ul>
 * <li>{@code UNHEALTHY} - statistics could not be read from the broker</li>
 * <li>{@code DEGRADED} - statistics were read but the broker ping failed</li>
 * <li>{@code HEALTHY} - both succeeded</li>
 * </ul>
 *
 * <p>
 * Counts come straight from the broker on every call and cover all instances; slot and pause information is local
 * to this process.
 */
@ApplicationScoped
public class QueueHealthService {

    private static final Logger LOG = Logger.getLogger(QueueHealthService.class);

    @Inject
    QueueBroker broker;

    @Inject
    JobsConfig config;

    @Inject
    WorkerPoolManager pools;

    /**
     * Counts of one queue.
     *
     * @throws BrokerUnavailableException
     *             if the broker cannot be reached
     */
    public JobCountsType queueCounts(JobQueue queue) {
        return JobCountsType.from(broker.countByState(queue));
    }

    /**
     * Statistics of one queue.
     *
     * @throws BrokerUnavailableException
     *             if the broker cannot be reached
     */
    public QueueStatsType queueStats(JobQueue queue) {
        return new QueueStatsType(queue.getName(), queueCounts(queue), config.queue(queue).concurrency(),
                pools.availableSlots(queue), pools.isPaused(queue));
    }

    /**
     * Statistics of every queue plus totals.
     *
     * @throws BrokerUnavailableException
     *             if the broker cannot be reached
     */
    public QueueStatsSummaryType allQueueStats() {
        List<QueueStatsType> queues = new ArrayList<>();
        JobCountsType totals = JobCountsType.EMPTY;
        for (JobQueue queue : JobQueue.values()) {
            QueueStatsType stats = queueStats(queue);
            queues.add(stats);
            totals = totals.plus(stats.counts());
        }
        return new QueueStatsSummaryType(queues, totals, Instant.now());
    }

    /**
     * Estimates how long a job added now would wait for a worker. Never throws: returns the configured fallback when
     * the broker cannot be reached.
     */
    public Duration estimateWait(JobQueue queue) {
        JobsConfig.WaitEstimate settings = config.waitEstimate();
        try {
            JobCountsType counts = queueCounts(queue);
            return estimateWait(counts.waiting(), counts.active(), config.queue(queue).concurrency(),
                    settings.averageProcessingTime(), settings.max(), settings.fallback());
        } catch (BrokerUnavailableException e) {
            LOG.debugf("Wait estimate for queue %s fell back to %s: %s", queue.getName(), settings.fallback(),
                    e.getMessage());
            return settings.fallback();
        }
    }

    /**
     * {@code min(cap, ceil((waiting + active) / concurrency) * average)}; {@code fallback} when concurrency is not
     * positive or a count is negative. Non-decreasing in {@code waiting}.
     */
    public static Duration estimateWait(long waiting, long active, int concurrency, Duration average, Duration cap,
            Duration fallback) {
        if (concurrency <= 0 || waiting < 0 || active < 0) {
            return fallback;
        }
        long rounds = (waiting + active + concurrency - 1) / concurrency;
        long capMillis = cap.toMillis();
        long averageMillis = average.toMillis();
        if (averageMillis > 0 && rounds > capMillis / averageMillis) {
            return cap;
        }
        return Duration.ofMillis(Math.min(capMillis, rounds * averageMillis));
    }

    /**
     * Builds the health report. Never throws.
     */
    public HealthCheckType healthCheck() {
        Instant now = Instant.now();
        QueueStatsSummaryType summary;
        try {
            summary = allQueueStats();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Job system health check could not read queue statistics");
            return new HealthCheckType(HealthStatus.UNHEALTHY, false, List.of(), HealthCheckType.Details.EMPTY,
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), now);
        }

        boolean reachable = broker.ping();
        JobCountsType totals = summary.totals();
        HealthCheckType.Details details = new HealthCheckType.Details(totals.total(), totals.active(),
                totals.failed());
        HealthStatus status = reachable ? HealthStatus.HEALTHY : HealthStatus.DEGRADED;
        if (!reachable) {
            LOG.warn("Job system degraded: broker ping failed after statistics were read");
        }
        return new HealthCheckType(status, reachable, summary.queues(), details, null, now);
    }
}
