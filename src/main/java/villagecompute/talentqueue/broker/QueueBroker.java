package villagecompute.talentqueue.broker;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import villagecompute.talentqueue.jobs.JobOptions;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.JobRecord;
import villagecompute.talentqueue.jobs.JobState;

/**
 * Adapter over the durable job store.
 *
 * <p>
 * <b>Delivery:</b> at-least-once. A job can be handed to a worker twice when the stall detector requeues it while the
 * original worker is slow but alive. Mutations performed by a worker are fenced with the per-claim
 * {@link JobRecord#lockToken()}: once a job has been reclaimed, the old worker's {@code ack}/{@code fail}/
 * {@code scheduleRetry} calls return {@code false} and change nothing.
 *
 * <p>
 * <b>Errors:</b> every operation except {@link #ping()} throws
 * {@link villagecompute.talentqueue.exceptions.BrokerUnavailableException} when the store cannot be reached.
 */
public interface QueueBroker {

    /**
     * Failure reason recorded on jobs abandoned by the stall detector.
     */
    String STALLED_REASON = "job stalled more than allowable limit";

    /**
     * Durably records a new job. Returns only after the record is committed. A positive delay stores the job as
     * {@link JobState#DELAYED}; otherwise it is {@link JobState#WAITING}.
     */
    JobRecord enqueue(JobQueue queue, String payload, JobOptions options);

    /**
     * Atomically moves the next waiting job (dispatch order) to ACTIVE on behalf of {@code workerId}, incrementing its
     * attempt counter and issuing a fresh lock token.
     *
     * @return the claimed job, or empty when nothing is ready
     */
    Optional<JobRecord> claimNext(JobQueue queue, String workerId);

    /**
     * Marks a claimed job COMPLETED with its serialized result.
     *
     * @return false if the claim is no longer held
     */
    boolean ack(JobRecord job, String result);

    /**
     * Marks a claimed job terminally FAILED.
     *
     * @return false if the claim is no longer held
     */
    boolean fail(JobRecord job, String reason);

    /**
     * Moves a claimed job to DELAYED until {@code resumeAt}, keeping {@code reason} as the last error.
     *
     * @return false if the claim is no longer held
     */
    boolean scheduleRetry(JobRecord job, Instant resumeAt, String reason);

    /**
     * Records progress for a claimed job.
     *
     * @return false if the claim is no longer held
     */
    boolean updateProgress(JobRecord job, int percent);

    /**
     * Moves every DELAYED job due at {@code now} back to WAITING.
     *
     * @return number of jobs promoted
     */
    int promoteDelayed(Instant now);

    /**
     * Refreshes the heartbeat of the given claims. Fenced like {@link #ack}: a claim whose lock token no longer matches
     * (the job was requeued and claimed again) is skipped.
     *
     * @return number of heartbeats refreshed
     */
    int heartbeat(Collection<JobRecord> claims);

    /**
     * Requeues or abandons ACTIVE jobs of {@code queue} whose heartbeat is older than {@code threshold}.
     */
    StalledRecovery recoverStalled(JobQueue queue, Duration threshold, int maxStalledCount);

    /**
     * Looks up a job by id; unknown and evicted ids yield empty.
     */
    Optional<JobRecord> getJob(long jobId);

    /**
     * Lists jobs in a state: WAITING in dispatch order, DELAYED by resume time, ACTIVE by start time, terminal states
     * newest first.
     */
    List<JobRecord> listByState(JobQueue queue, JobState state, int limit);

    default List<JobRecord> listByState(JobQueue queue, JobState state) {
        return listByState(queue, state, Integer.MAX_VALUE);
    }

    /**
     * Counts the jobs of a queue per state. Every state is present in the result.
     */
    Map<JobState, Long> countByState(JobQueue queue);

    /**
     * Checks that the store answers. Never throws.
     */
    boolean ping();

    /**
     * Releases broker resources. Later calls fail with {@code BrokerUnavailableException}.
     */
    void close();
}
