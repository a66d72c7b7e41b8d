package villagecompute.talentqueue.services;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import villagecompute.talentqueue.api.types.HealthCheckType;
import villagecompute.talentqueue.api.types.JobQueuedType;
import villagecompute.talentqueue.api.types.JobStatusType;
import villagecompute.talentqueue.api.types.QueueStatsSummaryType;
import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.config.JobsConfig;
import villagecompute.talentqueue.exceptions.JobSystemShutdownException;
import villagecompute.talentqueue.exceptions.ResourceNotFoundException;
import villagecompute.talentqueue.exceptions.ValidationException;
import villagecompute.talentqueue.jobs.AddJobOptions;
import villagecompute.talentqueue.jobs.JobOptions;
import villagecompute.talentqueue.jobs.JobPayloadCodec;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.JobRecord;
import villagecompute.talentqueue.jobs.JobState;
import villagecompute.talentqueue.jobs.payload.AiProcessingPayload;
import villagecompute.talentqueue.jobs.payload.DocumentProcessingPayload;
import villagecompute.talentqueue.jobs.payload.JobPayload;
import villagecompute.talentqueue.jobs.payload.VideoProcessingPayload;
import villagecompute.talentqueue.jobs.worker.WorkerPoolManager;

/**
 * Entry point of the job system: producer, status and operational API.
 *
 * <p>
 * <b>Producer contract:</b>
 * <ul>
 * <li>{@code addJob} returns only after the broker has durably recorded the job</li>
 * <li>Every call creates a new job; identical payloads are not deduplicated</li>
 * <li>Invalid payloads or options fail with {@link ValidationException} and never reach the broker</li>
 * <li>An unreachable broker fails with {@link villagecompute.talentqueue.exceptions.BrokerUnavailableException}; the
 * job is neither buffered locally nor dropped</li>
 * <li>After {@link #shutdown()} has begun, {@code addJob} fails with {@link JobSystemShutdownException}</li>
 * </ul>
 *
 * <p>
 * <b>Typed producers</b> apply the per-workload defaults from {@code talentqueue.jobs.queues.*}: video jobs priority 10
 * with a 100ms delay, document jobs priority 8 with 50ms, AI embeddings priority 6 without delay and other AI jobs
 * priority 4 with 200ms. Lower priorities are dispatched first.
 *
 * @see WorkerPoolManager for the consumer side
 * @see QueueHealthService for statistics and health
 */
@ApplicationScoped
public class BackgroundJobService {

    private static final Logger LOG = Logger.getLogger(BackgroundJobService.class);

    @Inject
    QueueBroker broker;

    @Inject
    JobPayloadCodec codec;

    @Inject
    JobsConfig config;

    @Inject
    Validator validator;

    @Inject
    WorkerPoolManager pools;

    @Inject
    QueueHealthService healthService;

    @Inject
    JobStatusService statusService;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    /**
     * Adds a job to {@code queue}.
     *
     * @param queue
     *            target queue
     * @param payload
     *            payload; its type must be the queue's payload type
     * @param options
     *            enqueue options; null fields take the queue defaults
     * @return the new job's id, its initial state and an estimated wait
     * @throws ValidationException
     *             if payload or options are invalid
     * @throws JobSystemShutdownException
     *             if shutdown has begun
     */
    public JobQueuedType addJob(JobQueue queue, JobPayload payload, AddJobOptions options) {
        if (shuttingDown.get()) {
            throw new JobSystemShutdownException("Job system is shutting down; not accepting new jobs");
        }
        if (queue == null) {
            throw new ValidationException("Queue is required");
        }
        validatePayload(queue, payload);
        JobOptions resolved = resolveOptions(queue, options == null ? AddJobOptions.defaults() : options);

        JobRecord job = broker.enqueue(queue, codec.encodePayload(payload), resolved);
        if (job.state() == JobState.WAITING) {
            pools.wakeUp(queue);
        }
        Duration estimatedWait = healthService.estimateWait(queue);

        LOG.infof("Queued job %d in queue %s for user %s (priority: %d, delay: %d ms, state: %s)", job.id(),
                queue.getName(), payload.userId(), resolved.priority(), resolved.delay().toMillis(),
                job.state().getLabel());
        return new JobQueuedType(String.valueOf(job.id()), queue.getName(), JobQueuedType.QUEUED,
                job.state().getLabel(), estimatedWait.toMillis());
    }

    /**
     * Adds a job from loosely typed data, as posted to the REST API.
     *
     * @throws ResourceNotFoundException
     *             if the queue name is unknown
     * @throws ValidationException
     *             if the data does not fit the queue's payload
     */
    public JobQueuedType addJob(String queueName, Map<String, Object> payload, AddJobOptions options) {
        JobQueue queue = resolveQueue(queueName);
        return addJob(queue, codec.convertPayload(queue, payload), options);
    }

    public JobQueuedType addVideoProcessingJob(VideoProcessingPayload payload) {
        JobsConfig.VideoQueue settings = config.queues().video();
        return addJob(JobQueue.VIDEO, payload, AddJobOptions.withPriority(settings.priority(), settings.delay()));
    }

    public JobQueuedType addDocumentProcessingJob(DocumentProcessingPayload payload) {
        JobsConfig.DocumentQueue settings = config.queues().document();
        return addJob(JobQueue.DOCUMENT, payload, AddJobOptions.withPriority(settings.priority(), settings.delay()));
    }

    /**
     * Adds an AI job. Embeddings are background work; analysis and matching back interactive screens and get the
     * lower (sooner) priority.
     */
    public JobQueuedType addAiProcessingJob(AiProcessingPayload payload) {
        JobsConfig.AiQueue settings = config.queues().ai();
        AddJobOptions options = payload != null && payload.type() == AiProcessingPayload.Type.EMBEDDING
                ? AddJobOptions.withPriority(settings.embeddingPriority(), settings.embeddingDelay())
                : AddJobOptions.withPriority(settings.priority(), settings.delay());
        return addJob(JobQueue.AI, payload, options);
    }

    /**
     * Status of a job, empty when unknown, evicted or not in {@code queueName}.
     *
     * @throws ResourceNotFoundException
     *             if the queue name is unknown
     */
    public Optional<JobStatusType> getJobStatus(String jobId, String queueName) {
        return statusService.getStatus(jobId, resolveQueue(queueName));
    }

    public List<JobStatusType> listJobs(String queueName, JobState state, int limit) {
        return statusService.listJobs(resolveQueue(queueName), state, limit);
    }

    public QueueStatsSummaryType getQueueStats() {
        return healthService.allQueueStats();
    }

    public HealthCheckType healthCheck() {
        return healthService.healthCheck();
    }

    public void pauseQueue(String queueName) {
        JobQueue queue = resolveQueue(queueName);
        pools.pause(queue);
        LOG.infof("Queue %s paused", queue.getName());
    }

    public void resumeQueue(String queueName) {
        JobQueue queue = resolveQueue(queueName);
        pools.resume(queue);
        LOG.infof("Queue %s resumed", queue.getName());
    }

    /**
     * Starts the worker pools unless {@code talentqueue.jobs.workers-enabled} is false.
     */
    public void start() {
        if (!config.workersEnabled()) {
            LOG.info("Worker pools disabled (talentqueue.jobs.workers-enabled=false); this instance only enqueues");
            return;
        }
        pools.startAll();
    }

    /**
     * Stops accepting jobs, drains the pools for the configured grace period and closes the broker. Safe to call more
     * than once.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        Duration grace = config.shutdownGracePeriod();
        LOG.infof("Shutting down job system (grace period: %s)", grace);
        List<Long> interrupted = pools.shutdownAll(grace);
        if (!interrupted.isEmpty()) {
            LOG.warnf("%d jobs outlived the grace period and stay active until stall recovery: %s",
                    interrupted.size(), interrupted);
        }
        broker.close();
        LOG.info("Job system shut down");
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    private void validatePayload(JobQueue queue, JobPayload payload) {
        if (payload == null) {
            throw new ValidationException("Payload is required for queue " + queue.getName());
        }
        if (!queue.getPayloadType().isInstance(payload)) {
            throw new ValidationException("Queue " + queue.getName() + " accepts "
                    + queue.getPayloadType().getSimpleName() + ", got " + payload.getClass().getSimpleName());
        }
        Set<ConstraintViolation<JobPayload>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            String details = violations.stream().map(v -> v.getPropertyPath() + " " + v.getMessage()).sorted()
                    .collect(Collectors.joining(", "));
            throw new ValidationException("Invalid payload for queue " + queue.getName() + ": " + details);
        }
    }

    private JobOptions resolveOptions(JobQueue queue, AddJobOptions options) {
        JobsConfig.QueueSettings defaults = config.queue(queue);
        try {
            return new JobOptions(options.priority() != null ? options.priority() : defaults.priority(),
                    options.delay() != null ? options.delay() : defaults.delay(),
                    options.maxAttempts() != null ? options.maxAttempts() : config.defaultAttempts(),
                    options.backoff() != null ? options.backoff() : config.backoffPolicy());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid options for queue " + queue.getName() + ": " + e.getMessage(), e);
        }
    }

    private static JobQueue resolveQueue(String queueName) {
        return JobQueue.fromName(queueName)
                .orElseThrow(() -> new ResourceNotFoundException("Unknown queue: " + queueName));
    }
}
