package villagecompute.talentqueue.broker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jboss.logging.Logger;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import villagecompute.talentqueue.config.JobsConfig;
import villagecompute.talentqueue.data.models.QueuedJob;
import villagecompute.talentqueue.exceptions.BrokerUnavailableException;
import villagecompute.talentqueue.jobs.JobOptions;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.JobRecord;
import villagecompute.talentqueue.jobs.JobState;

/**
 * {@link QueueBroker} backed by the {@code queued_jobs} table.
 *
 * <p>
 * Every operation runs in its own transaction ({@code QuarkusTransaction.requiringNew()}) and commits before
 * returning, so an enqueue that returns has been durably recorded. Worker-side transitions are single conditional
 * updates guarded by {@code status = 'ACTIVE' AND lock_token = ?}; the database provides the atomicity, no in-process
 * locking is involved.
 *
 * <p>
 * Retention is enforced on every terminal transition: only the newest
 * {@code talentqueue.jobs.retention.completed} completed and {@code talentqueue.jobs.retention.failed} failed rows are
 * kept per queue.
 */
@ApplicationScoped
public class DatabaseQueueBroker implements QueueBroker {

    private static final Logger LOG = Logger.getLogger(DatabaseQueueBroker.class);

    /**
     * Waiting rows fetched per claim. More than one so that losing a race to another worker does not end the poll.
     */
    private static final int CLAIM_CANDIDATES = 5;

    private static final int MAX_REASON_LENGTH = 2000;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Inject
    JobsConfig config;

    @Override
    public JobRecord enqueue(JobQueue queue, String payload, JobOptions options) {
        JobRecord job = inTransaction("enqueue", () -> QueuedJob.create(queue, payload, options, Instant.now())
                .toRecord());
        LOG.debugf("Recorded job %d in queue %s (state: %s, priority: %d)", job.id(), queue.getName(),
                job.state().getLabel(), job.priority());
        return job;
    }

    @Override
    public Optional<JobRecord> claimNext(JobQueue queue, String workerId) {
        return inTransaction("claim", () -> {
            for (QueuedJob candidate : QueuedJob.findWaiting(queue, CLAIM_CANDIDATES)) {
                Instant now = Instant.now();
                String token = UUID.randomUUID().toString();
                int updated = QueuedJob.update(
                        "status = ?1, attempts = attempts + 1, progress = 0, startedAt = ?2, heartbeatAt = ?2, "
                                + "lockedBy = ?3, lockToken = ?4, updatedAt = ?2 WHERE id = ?5 AND status = ?6",
                        JobState.ACTIVE, now, workerId, token, candidate.id, JobState.WAITING);
                if (updated == 1) {
                    QueuedJob.getEntityManager().refresh(candidate);
                    return Optional.of(candidate.toRecord());
                }
                LOG.tracef("Job %d was claimed by another worker, trying next candidate", candidate.id);
            }
            return Optional.<JobRecord> empty();
        });
    }

    @Override
    public boolean ack(JobRecord job, String result) {
        return inTransaction("ack", () -> {
            Instant now = Instant.now();
            int updated = QueuedJob.update(
                    "status = ?1, result = ?2, progress = 100, finishedAt = ?3, heartbeatAt = null, lockedBy = null, "
                            + "lockToken = null, updatedAt = ?3 WHERE id = ?4 AND status = ?5 AND lockToken = ?6",
                    JobState.COMPLETED, result, now, job.id(), JobState.ACTIVE, job.lockToken());
            if (updated == 1) {
                evict(job.queue(), JobState.COMPLETED, config.retention().completed());
            }
            return updated == 1;
        });
    }

    @Override
    public boolean fail(JobRecord job, String reason) {
        return inTransaction("fail", () -> {
            Instant now = Instant.now();
            int updated = QueuedJob.update(
                    "status = ?1, failureReason = ?2, finishedAt = ?3, heartbeatAt = null, lockedBy = null, "
                            + "lockToken = null, updatedAt = ?3 WHERE id = ?4 AND status = ?5 AND lockToken = ?6",
                    JobState.FAILED, truncate(reason), now, job.id(), JobState.ACTIVE, job.lockToken());
            if (updated == 1) {
                evict(job.queue(), JobState.FAILED, config.retention().failed());
            }
            return updated == 1;
        });
    }

    @Override
    public boolean scheduleRetry(JobRecord job, Instant resumeAt, String reason) {
        return inTransaction("retry", () -> QueuedJob.update(
                "status = ?1, scheduledAt = ?2, failureReason = ?3, heartbeatAt = null, lockedBy = null, "
                        + "lockToken = null, updatedAt = ?4 WHERE id = ?5 AND status = ?6 AND lockToken = ?7",
                JobState.DELAYED, resumeAt, truncate(reason), Instant.now(), job.id(), JobState.ACTIVE,
                job.lockToken()) == 1);
    }

    @Override
    public boolean updateProgress(JobRecord job, int percent) {
        int clamped = Math.max(0, Math.min(100, percent));
        return inTransaction("progress", () -> QueuedJob.update(
                "progress = ?1, heartbeatAt = ?2, updatedAt = ?2 WHERE id = ?3 AND status = ?4 AND lockToken = ?5",
                clamped, Instant.now(), job.id(), JobState.ACTIVE, job.lockToken()) == 1);
    }

    @Override
    public int promoteDelayed(Instant now) {
        return inTransaction("promote", () -> QueuedJob.update(
                "status = ?1, updatedAt = ?2 WHERE status = ?3 AND scheduledAt <= ?2", JobState.WAITING, now,
                JobState.DELAYED));
    }

    @Override
    public int heartbeat(Collection<JobRecord> claims) {
        if (claims == null || claims.isEmpty()) {
            return 0;
        }
        List<JobRecord> fenced = List.copyOf(claims);
        return inTransaction("heartbeat", () -> {
            Instant now = Instant.now();
            int refreshed = 0;
            for (JobRecord claim : fenced) {
                refreshed += QueuedJob.update("heartbeatAt = ?1 WHERE id = ?2 AND status = ?3 AND lockToken = ?4", now,
                        claim.id(), JobState.ACTIVE, claim.lockToken());
            }
            return refreshed;
        });
    }

    @Override
    public StalledRecovery recoverStalled(JobQueue queue, Duration threshold, int maxStalledCount) {
        return inTransaction("stall-recovery", () -> {
            Instant now = Instant.now();
            List<Long> requeued = new ArrayList<>();
            List<Long> failed = new ArrayList<>();

            for (QueuedJob stalled : QueuedJob.findStalled(queue, now.minus(threshold))) {
                int stalledCount = stalled.stalledCount + 1;
                int updated;
                if (stalledCount > maxStalledCount) {
                    updated = QueuedJob.update(
                            "status = ?1, stalledCount = ?2, failureReason = ?3, finishedAt = ?4, heartbeatAt = null, "
                                    + "lockedBy = null, lockToken = null, updatedAt = ?4 "
                                    + "WHERE id = ?5 AND status = ?6 AND lockToken = ?7",
                            JobState.FAILED, stalledCount, STALLED_REASON, now, stalled.id, JobState.ACTIVE,
                            stalled.lockToken);
                    if (updated == 1) {
                        failed.add(stalled.id);
                    }
                } else {
                    // The stalled attempt never finished, so it does not count against maxAttempts.
                    updated = QueuedJob.update(
                            "status = ?1, stalledCount = ?2, attempts = ?3, heartbeatAt = null, lockedBy = null, "
                                    + "lockToken = null, updatedAt = ?4 WHERE id = ?5 AND status = ?6 AND lockToken = ?7",
                            JobState.WAITING, stalledCount, Math.max(0, stalled.attempts - 1), now, stalled.id,
                            JobState.ACTIVE, stalled.lockToken);
                    if (updated == 1) {
                        requeued.add(stalled.id);
                    }
                }
            }

            if (!failed.isEmpty()) {
                evict(queue, JobState.FAILED, config.retention().failed());
            }
            return new StalledRecovery(requeued, failed);
        });
    }

    @Override
    public Optional<JobRecord> getJob(long jobId) {
        return inTransaction("get", () -> QueuedJob.<QueuedJob> findByIdOptional(jobId).map(QueuedJob::toRecord));
    }

    @Override
    public List<JobRecord> listByState(JobQueue queue, JobState state, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return inTransaction("list",
                () -> QueuedJob.findByState(queue, state, limit).stream().map(QueuedJob::toRecord).toList());
    }

    @Override
    public Map<JobState, Long> countByState(JobQueue queue) {
        return inTransaction("count", () -> QueuedJob.countByState(queue));
    }

    @Override
    public boolean ping() {
        if (closed.get()) {
            return false;
        }
        try {
            QuarkusTransaction.requiringNew()
                    .run(() -> QueuedJob.getEntityManager().createNativeQuery("SELECT 1").getSingleResult());
            return true;
        } catch (RuntimeException e) {
            LOG.warnf("Broker ping failed: %s", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOG.info("Job broker closed; further operations will be rejected");
        }
    }

    private void evict(JobQueue queue, JobState state, int keep) {
        List<Long> evictable = QueuedJob.findEvictable(queue, state, keep);
        if (!evictable.isEmpty()) {
            long deleted = QueuedJob.delete("id IN ?1", evictable);
            LOG.debugf("Evicted %d %s jobs from queue %s (retention: %d)", deleted, state.getLabel(), queue.getName(),
                    keep);
        }
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }

    private <T> T inTransaction(String operation, Callable<T> work) {
        if (closed.get()) {
            throw new BrokerUnavailableException("Job broker is closed (operation: " + operation + ")");
        }
        try {
            return QuarkusTransaction.requiringNew().call(work);
        } catch (PersistenceException | QuarkusTransactionException e) {
            LOG.errorf(e, "Job broker operation '%s' failed", operation);
            throw new BrokerUnavailableException("Job broker unavailable during " + operation + ": " + e.getMessage(),
                    e);
        }
    }
}
