package villagecompute.talentqueue.jobs.worker;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.jboss.logging.Logger;

import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.exceptions.BrokerUnavailableException;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.JobRecord;

/**
 * Worker pool for one queue with exactly {@code concurrency} execution slots.
 *
 * <p>
 * A single dispatcher thread acquires a slot, claims the next job from the broker and hands it to a fixed pool of
 * {@code concurrency} worker threads; the slot is released when the job finishes. When nothing is ready the
 * dispatcher sleeps for the poll interval or until {@link #wakeUp()} is called after an enqueue.
 *
 * <p>
 * While jobs run, their heartbeats are refreshed every {@code heartbeatInterval} so the stall detector does not
 * reclaim them. Running claims are tracked by job id; an attempt only ever removes its own claim, so a job requeued
 * and claimed again while its previous attempt is still finishing keeps its heartbeat.
 *
 * <p>
 * <b>Lifecycle:</b> {@link #start()} → ({@link #pause()} / {@link #resume()})* → {@link #stopDispatching()} →
 * {@link #awaitTermination(Duration)} → {@link #shutdownNow()}. Jobs still running at {@code shutdownNow} are
 * interrupted; they stay ACTIVE in the broker and are requeued by the stall detector.
 */
public class QueueWorkerPool {

    private static final Logger LOG = Logger.getLogger(QueueWorkerPool.class);

    private final JobQueue queue;
    private final int concurrency;
    private final QueueBroker broker;
    private final JobExecutor executor;
    private final long pollMillis;
    private final long heartbeatMillis;
    private final String workerId;

    private final Semaphore slots;
    private final ExecutorService workers;
    private final ScheduledExecutorService heartbeats;
    private final Thread dispatcher;

    private final Map<Long, JobRecord> activeJobs = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean paused;

    private final Object signal = new Object();
    private boolean signalled;

    /**
     * Creates a pool; nothing runs until {@link #start()}.
     *
     * @param queue
     *            queue served by this pool
     * @param concurrency
     *            execution slots, at least 1
     * @param broker
     *            job store
     * @param executor
     *            per-attempt transition logic
     * @param pollInterval
     *            idle sleep between claims
     * @param heartbeatInterval
     *            heartbeat period for running jobs
     * @param workerId
     *            identity recorded as the claim owner
     */
    public QueueWorkerPool(JobQueue queue, int concurrency, QueueBroker broker, JobExecutor executor,
            Duration pollInterval, Duration heartbeatInterval, String workerId) {
        if (concurrency < 1) {
            throw new IllegalArgumentException(
                    "Concurrency for queue " + queue.getName() + " must be at least 1, was " + concurrency);
        }
        this.queue = queue;
        this.concurrency = concurrency;
        this.broker = broker;
        this.executor = executor;
        this.pollMillis = Math.max(1L, pollInterval.toMillis());
        this.heartbeatMillis = Math.max(1L, heartbeatInterval.toMillis());
        this.workerId = workerId;
        this.slots = new Semaphore(concurrency);
        this.workers = Executors.newFixedThreadPool(concurrency, namedThreads("talentqueue-" + queue.getName() + "-"));
        this.heartbeats = Executors
                .newSingleThreadScheduledExecutor(namedThreads("talentqueue-" + queue.getName() + "-heartbeat-"));
        this.dispatcher = namedThreads("talentqueue-" + queue.getName() + "-dispatcher-").newThread(this::dispatchLoop);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        running.set(true);
        heartbeats.scheduleAtFixedRate(this::sendHeartbeats, heartbeatMillis, heartbeatMillis, TimeUnit.MILLISECONDS);
        dispatcher.start();
        LOG.infof("Started worker pool for queue %s - %s (concurrency: %d, worker: %s%s)", queue.getName(),
                queue.getDescription(), concurrency, workerId, paused ? ", paused" : "");
    }

    /**
     * Stops claiming new jobs. Running jobs finish normally.
     */
    public void pause() {
        paused = true;
        LOG.infof("Paused worker pool for queue %s (active jobs: %d)", queue.getName(), activeJobs.size());
    }

    public void resume() {
        paused = false;
        LOG.infof("Resumed worker pool for queue %s", queue.getName());
        wakeUp();
    }

    /**
     * Ends the current idle wait so the dispatcher polls immediately.
     */
    public void wakeUp() {
        synchronized (signal) {
            signalled = true;
            signal.notifyAll();
        }
    }

    /**
     * Stops the dispatcher; no job is claimed after this returns. Running jobs keep their slots.
     */
    public void stopDispatching() {
        if (running.compareAndSet(true, false)) {
            wakeUp();
            try {
                dispatcher.join(pollMillis + 1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warnf("Interrupted while stopping dispatcher of queue %s", queue.getName());
            }
            workers.shutdown();
            LOG.infof("Stopped dispatching for queue %s (active jobs: %d)", queue.getName(), activeJobs.size());
        }
    }

    /**
     * Waits for running jobs to finish.
     *
     * @return true if every job finished within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (!started.get()) {
            return true;
        }
        return workers.awaitTermination(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    /**
     * Interrupts jobs still running and stops heartbeats.
     *
     * @return ids of jobs that were still running
     */
    public List<Long> shutdownNow() {
        stopDispatching();
        List<Long> abandoned = List.copyOf(activeJobs.keySet());
        workers.shutdownNow();
        heartbeats.shutdownNow();
        if (!abandoned.isEmpty()) {
            LOG.warnf("Interrupted %d running jobs of queue %s on shutdown: %s", abandoned.size(), queue.getName(),
                    abandoned);
        }
        return abandoned;
    }

    private void dispatchLoop() {
        while (running.get()) {
            try {
                if (paused) {
                    awaitSignal();
                    continue;
                }
                if (!slots.tryAcquire(pollMillis, TimeUnit.MILLISECONDS)) {
                    continue;
                }
                Optional<JobRecord> claimed = claim();
                if (claimed.isEmpty()) {
                    slots.release();
                    awaitSignal();
                    continue;
                }
                dispatch(claimed.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.debugf("Dispatcher for queue %s interrupted", queue.getName());
                return;
            } catch (RuntimeException e) {
                LOG.errorf(e, "Dispatcher for queue %s failed, continuing after %d ms", queue.getName(), pollMillis);
                pauseAfterFailure();
            }
        }
    }

    private void pauseAfterFailure() {
        try {
            awaitSignal();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Optional<JobRecord> claim() {
        if (!running.get()) {
            return Optional.empty();
        }
        try {
            return broker.claimNext(queue, workerId);
        } catch (BrokerUnavailableException e) {
            LOG.warnf("Could not claim from queue %s, retrying after %d ms: %s", queue.getName(), pollMillis,
                    e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Claim from queue %s failed, retrying after %d ms", queue.getName(), pollMillis);
            return Optional.empty();
        }
    }

    private void dispatch(JobRecord job) {
        activeJobs.put(job.id(), job);
        try {
            workers.execute(() -> {
                try {
                    executor.execute(job);
                } finally {
                    activeJobs.remove(job.id(), job);
                    slots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            activeJobs.remove(job.id(), job);
            slots.release();
            LOG.warnf("Job %d claimed during shutdown of queue %s; left active for stall recovery", job.id(),
                    queue.getName());
        }
    }

    private void awaitSignal() throws InterruptedException {
        synchronized (signal) {
            if (!signalled) {
                signal.wait(pollMillis);
            }
            signalled = false;
        }
    }

    private void sendHeartbeats() {
        if (activeJobs.isEmpty()) {
            return;
        }
        List<JobRecord> claims = List.copyOf(activeJobs.values());
        try {
            int refreshed = broker.heartbeat(claims);
            if (refreshed < claims.size()) {
                LOG.debugf("Heartbeat refreshed %d of %d jobs of queue %s; the rest were reclaimed", refreshed,
                        claims.size(), queue.getName());
            }
        } catch (BrokerUnavailableException e) {
            LOG.warnf("Heartbeat for %d jobs of queue %s failed: %s", claims.size(), queue.getName(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Heartbeat for %d jobs of queue %s failed", claims.size(), queue.getName());
        }
    }

    public JobQueue getQueue() {
        return queue;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public int activeJobCount() {
        return activeJobs.size();
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isRunning() {
        return running.get();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
