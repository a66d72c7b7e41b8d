package villagecompute.talentqueue.jobs.worker;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.config.JobsConfig;
import villagecompute.talentqueue.jobs.JobHandlerRegistry;
import villagecompute.talentqueue.jobs.JobQueue;

/**
 * Owns the {@link QueueWorkerPool}s of this process, one per queue with a registered handler.
 *
 * <p>
 * Pause state is kept per queue even when no pool runs here (API-only pods), so a pool started later honours it.
 */
@ApplicationScoped
public class WorkerPoolManager {

    private static final Logger LOG = Logger.getLogger(WorkerPoolManager.class);

    @Inject
    JobsConfig config;

    @Inject
    QueueBroker broker;

    @Inject
    JobExecutor executor;

    @Inject
    JobHandlerRegistry handlers;

    private final Map<JobQueue, QueueWorkerPool> pools = Collections.synchronizedMap(new EnumMap<>(JobQueue.class));
    private final Set<JobQueue> pausedQueues = Collections.synchronizedSet(EnumSet.noneOf(JobQueue.class));
    private final String instanceId = ManagementFactory.getRuntimeMXBean().getName() + "/"
            + UUID.randomUUID().toString().substring(0, 8);

    /**
     * Starts a pool for every queue that has a handler. Calling it again is a no-op for queues already running.
     */
    public synchronized void startAll() {
        Duration heartbeatInterval = config.stallInterval().dividedBy(2);
        for (JobQueue queue : handlers.registeredQueues()) {
            if (pools.containsKey(queue)) {
                continue;
            }
            int concurrency = config.queue(queue).concurrency();
            QueueWorkerPool pool = new QueueWorkerPool(queue, concurrency, broker, executor, config.pollInterval(),
                    heartbeatInterval, queue.getName() + "@" + instanceId);
            if (pausedQueues.contains(queue)) {
                pool.pause();
            }
            pools.put(queue, pool);
            pool.start();
        }
        LOG.infof("Worker pools running for queues %s (instance: %s)", pools.keySet(), instanceId);
    }

    /**
     * Stops every pool: dispatchers first, then waits up to {@code gracePeriod} for running jobs, then interrupts
     * what is left.
     *
     * @return ids of jobs interrupted because they outlived the grace period
     */
    public synchronized List<Long> shutdownAll(Duration gracePeriod) {
        List<QueueWorkerPool> running;
        synchronized (pools) {
            running = new ArrayList<>(pools.values());
        }
        if (running.isEmpty()) {
            return List.of();
        }

        running.forEach(QueueWorkerPool::stopDispatching);

        Instant deadline = Instant.now().plus(gracePeriod);
        List<Long> abandoned = new ArrayList<>();
        for (QueueWorkerPool pool : running) {
            Duration remaining = Duration.between(Instant.now(), deadline);
            try {
                if (!pool.awaitTermination(remaining.isNegative() ? Duration.ZERO : remaining)) {
                    LOG.warnf("Queue %s did not drain within %s", pool.getQueue().getName(), gracePeriod);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warnf("Interrupted while draining queue %s", pool.getQueue().getName());
            }
            abandoned.addAll(pool.shutdownNow());
        }
        pools.clear();
        return abandoned;
    }

    public void pause(JobQueue queue) {
        pausedQueues.add(queue);
        pool(queue).ifPresent(QueueWorkerPool::pause);
    }

    public void resume(JobQueue queue) {
        pausedQueues.remove(queue);
        pool(queue).ifPresent(QueueWorkerPool::resume);
    }

    public boolean isPaused(JobQueue queue) {
        return pausedQueues.contains(queue);
    }

    /**
     * Prompts the queue's dispatcher to poll now instead of at the end of its idle wait.
     */
    public void wakeUp(JobQueue queue) {
        pool(queue).ifPresent(QueueWorkerPool::wakeUp);
    }

    public Optional<QueueWorkerPool> pool(JobQueue queue) {
        return Optional.ofNullable(pools.get(queue));
    }

    /**
     * Free execution slots of the queue's pool in this process; 0 when no pool runs here.
     */
    public int availableSlots(JobQueue queue) {
        return pool(queue).map(QueueWorkerPool::availableSlots).orElse(0);
    }
}
