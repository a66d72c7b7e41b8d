package villagecompute.talentqueue.jobs;

import java.util.Map;

import villagecompute.talentqueue.jobs.payload.JobPayload;

/**
 * Contract for background job processors.
 *
 * <p>
 * Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped}. {@link JobHandlerRegistry} collects
 * them at startup into a queue → handler map; each queue has at most one handler and the handler's
 * {@link #payloadType()} must match {@link JobQueue#getPayloadType()}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Handlers run on the queue's worker pool threads; a worker slot stays occupied for the whole call</li>
 * <li>Delivery is at-least-once: the same job may run twice after a stall recovery, so side effects must be
 * idempotent</li>
 * <li>Throwing {@link villagecompute.talentqueue.exceptions.NonRetryableJobException} fails the job immediately; any
 * other exception is retried with the job's backoff policy until {@code maxAttempts} is reached</li>
 * </ul>
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>{@code
 * @ApplicationScoped
 * public class AiProcessingJobHandler implements JobHandler<AiProcessingPayload> {
 *     public JobQueue handlesQueue() {
 *         return JobQueue.AI;
 *     }
 *
 *     public Class<AiProcessingPayload> payloadType() {
 *         return AiProcessingPayload.class;
 *     }
 *
 *     public Map<String, Object> execute(Long jobId, AiProcessingPayload payload, JobProgress progress) {
 *         // call the model...
 *     }
 * }
 * }</pre>
 *
 * @param <P>
 *            payload variant handled
 */
public interface JobHandler<P extends JobPayload> {

    /**
     * Returns the queue this handler processes.
     */
    JobQueue handlesQueue();

    /**
     * Returns the payload record type; must equal {@code handlesQueue().getPayloadType()}.
     */
    Class<P> payloadType();

    /**
     * Executes one attempt of a job.
     *
     * <p>
     * <b>Thread Safety:</b> called concurrently by up to {@code concurrency} worker threads.
     *
     * @param jobId
     *            broker identifier of the job
     * @param payload
     *            decoded payload
     * @param progress
     *            progress callback for the running attempt
     * @return result stored on the job when it completes; may be empty but not null
     * @throws Exception
     *             any error; triggers retry or terminal failure
     */
    Map<String, Object> execute(Long jobId, P payload, JobProgress progress) throws Exception;
}
