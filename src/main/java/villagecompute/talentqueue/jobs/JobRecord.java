package villagecompute.talentqueue.jobs;

import java.time.Instant;

/**
 * Point-in-time snapshot of one job as stored by the broker.
 *
 * <p>
 * Snapshots are immutable; every state change goes through a broker operation and produces a new snapshot on the next
 * read. {@code payload} and {@code result} are kept in their serialized JSON form: the scheduling core never looks
 * inside them.
 *
 * @param id
 *            broker-assigned identifier
 * @param queue
 *            workload class (also the payload tag)
 * @param payload
 *            serialized payload, decoded by {@link JobPayloadCodec}
 * @param priority
 *            lower value is dispatched first within the queue
 * @param attempts
 *            execution attempts started so far (the running attempt included while ACTIVE)
 * @param maxAttempts
 *            ceiling on attempts
 * @param backoff
 *            retry delay strategy
 * @param state
 *            lifecycle state
 * @param progress
 *            0-100 as reported by the handler
 * @param enqueuedAt
 *            submission time
 * @param scheduledAt
 *            earliest time a delayed job becomes waiting
 * @param startedAt
 *            start of the most recent attempt
 * @param finishedAt
 *            completion or terminal failure time
 * @param result
 *            serialized handler result once completed
 * @param failureReason
 *            last error message; terminal reason once failed
 * @param stalledCount
 *            times the stall detector recovered this job
 * @param lockedBy
 *            worker holding the job while ACTIVE
 * @param lockToken
 *            per-claim token fencing acknowledgements
 */
public record JobRecord(Long id, JobQueue queue, String payload, int priority, int attempts, int maxAttempts,
        BackoffPolicy backoff, JobState state, int progress, Instant enqueuedAt, Instant scheduledAt, Instant startedAt,
        Instant finishedAt, String result, String failureReason, int stalledCount, String lockedBy, String lockToken) {

    /**
     * Returns true if another attempt is allowed after the current one fails.
     */
    public boolean hasAttemptsRemaining() {
        return attempts < maxAttempts;
    }
}
