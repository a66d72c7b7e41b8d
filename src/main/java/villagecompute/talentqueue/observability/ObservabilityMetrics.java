package villagecompute.talentqueue.observability;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.exceptions.BrokerUnavailableException;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.JobState;
import villagecompute.talentqueue.jobs.worker.WorkerPoolManager;

/**
 * Registers the job system gauges.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauges:</b> {@code talentqueue_jobs_depth{queue,state}} - jobs per queue and state. The counts of a queue are
 * read from the broker once and shared by its five state gauges for {@value #DEPTH_SNAPSHOT_MILLIS} ms, so a scrape
 * costs one count query per queue</li>
 * <li><b>Gauges:</b> {@code talentqueue_worker_slots_available{queue}} - free worker slots in this instance</li>
 * <li><b>Counters:</b> {@code talentqueue_jobs_total{queue,outcome}} - attempts by outcome (see
 * {@link villagecompute.talentqueue.jobs.worker.JobExecutor})</li>
 * <li><b>Timers:</b> {@code talentqueue_job_duration{queue}} - attempt wall-clock time</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    static final long DEPTH_SNAPSHOT_MILLIS = 1000;

    private final Map<JobQueue, DepthSnapshot> depthSnapshots = new ConcurrentHashMap<>();

    @Inject
    MeterRegistry registry;

    @Inject
    QueueBroker broker;

    @Inject
    WorkerPoolManager pools;

    void registerMetrics(@Observes StartupEvent event) {
        LOG.info("Registering job system metrics");

        for (JobQueue queue : JobQueue.values()) {
            for (JobState state : JobState.values()) {
                Gauge.builder("talentqueue_jobs_depth", this, m -> m.getJobDepth(queue, state))
                        .description("Jobs in state " + state.getLabel() + " of the " + queue.getName() + " queue")
                        .tags(List.of(Tag.of("queue", queue.getName()), Tag.of("state", state.getLabel())))
                        .register(registry);
            }

            Gauge.builder("talentqueue_worker_slots_available", pools, p -> p.availableSlots(queue))
                    .description("Free worker slots of the " + queue.getName() + " queue in this instance")
                    .tags(List.of(Tag.of("queue", queue.getName()))).register(registry);
            LOG.debugf("Registered gauges for queue %s", queue.getName());
        }
    }

    /**
     * Jobs of {@code queue} in {@code state}; NaN when the broker cannot be reached.
     */
    double getJobDepth(JobQueue queue, JobState state) {
        DepthSnapshot snapshot = depthSnapshots.compute(queue,
                (q, current) -> current != null && current.isFresh() ? current : readDepth(q));
        Map<JobState, Long> counts = snapshot.counts();
        return counts == null ? Double.NaN : counts.getOrDefault(state, 0L);
    }

    private DepthSnapshot readDepth(JobQueue queue) {
        try {
            return new DepthSnapshot(broker.countByState(queue), System.nanoTime());
        } catch (BrokerUnavailableException e) {
            LOG.debugf("Depth gauges for queue %s unavailable: %s", queue.getName(), e.getMessage());
            return new DepthSnapshot(null, System.nanoTime());
        }
    }

    /**
     * Counts of one queue as read at {@code readAtNanos}; null counts when the broker could not be reached.
     */
    private record DepthSnapshot(Map<JobState, Long> counts, long readAtNanos) {

        boolean isFresh() {
            return System.nanoTime() - readAtNanos < TimeUnit.MILLISECONDS.toNanos(DEPTH_SNAPSHOT_MILLIS);
        }
    }
}
