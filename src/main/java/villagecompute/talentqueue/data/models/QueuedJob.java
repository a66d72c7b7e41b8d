package villagecompute.talentqueue.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Tuple;
import villagecompute.talentqueue.jobs.BackoffPolicy;
import villagecompute.talentqueue.jobs.JobOptions;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.JobRecord;
import villagecompute.talentqueue.jobs.JobState;
import villagecompute.talentqueue.jobs.PriorityScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Panache entity backing the database job broker.
 *
 * <p>
 * Each row is one job. Workers claim rows with a conditional update on {@code status}, so two workers (in this pod or
 * another) never both win the same job. Ownership of an ACTIVE row is identified by {@code lock_token}; every
 * worker-side mutation is conditioned on it.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGINT identity, PK) - Broker-assigned job id</li>
 * <li>{@code queue} (TEXT) - JobQueue enum value, also the payload tag</li>
 * <li>{@code payload} (TEXT) - JSON payload, decoded by the handler's payload type</li>
 * <li>{@code priority} (INT) - Lower values dispatched first</li>
 * <li>{@code status} (TEXT) - WAITING, ACTIVE, COMPLETED, FAILED, DELAYED</li>
 * <li>{@code attempts} / {@code max_attempts} (INT) - Attempt counter and ceiling</li>
 * <li>{@code backoff_kind} / {@code backoff_delay_ms} - Retry strategy</li>
 * <li>{@code progress} (INT) - 0-100 reported by the handler</li>
 * <li>{@code enqueued_at}, {@code scheduled_at}, {@code started_at}, {@code finished_at} (TIMESTAMPTZ)</li>
 * <li>{@code heartbeat_at} (TIMESTAMPTZ) - Last sign of life from the owning worker</li>
 * <li>{@code result} / {@code failure_reason} (TEXT)</li>
 * <li>{@code stalled_count} (INT) - Stall recoveries so far</li>
 * <li>{@code locked_by} / {@code lock_token} (TEXT) - Claim owner and fencing token</li>
 * </ul>
 *
 * @see villagecompute.talentqueue.broker.DatabaseQueueBroker
 */
@Entity
@Table(
        name = "queued_jobs")
public class QueuedJob extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "queue",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobQueue queue;

    @Column(
            name = "payload",
            nullable = false)
    public String payload;

    @Column(
            name = "priority",
            nullable = false)
    public int priority;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobState status;

    @Column(
            name = "attempts",
            nullable = false)
    public int attempts;

    @Column(
            name = "max_attempts",
            nullable = false)
    public int maxAttempts;

    @Column(
            name = "backoff_kind",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public BackoffPolicy.Kind backoffKind;

    @Column(
            name = "backoff_delay_ms",
            nullable = false)
    public long backoffDelayMs;

    @Column(
            name = "progress",
            nullable = false)
    public int progress;

    @Column(
            name = "enqueued_at",
            nullable = false)
    public Instant enqueuedAt;

    @Column(
            name = "scheduled_at",
            nullable = false)
    public Instant scheduledAt;

    @Column(
            name = "started_at")
    public Instant startedAt;

    @Column(
            name = "heartbeat_at")
    public Instant heartbeatAt;

    @Column(
            name = "finished_at")
    public Instant finishedAt;

    @Column(
            name = "result")
    public String result;

    @Column(
            name = "failure_reason")
    public String failureReason;

    @Column(
            name = "stalled_count",
            nullable = false)
    public int stalledCount;

    @Column(
            name = "locked_by")
    public String lockedBy;

    @Column(
            name = "lock_token")
    public String lockToken;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Builds and persists a new job row.
     *
     * @param queue
     *            target queue
     * @param payload
     *            serialized payload
     * @param options
     *            resolved enqueue options
     * @param now
     *            submission time
     * @return the persisted entity with its generated id
     */
    public static QueuedJob create(JobQueue queue, String payload, JobOptions options, Instant now) {
        boolean delayed = !options.delay().isZero();

        QueuedJob job = new QueuedJob();
        job.queue = queue;
        job.payload = payload;
        job.priority = options.priority();
        job.status = delayed ? JobState.DELAYED : JobState.WAITING;
        job.attempts = 0;
        job.maxAttempts = options.maxAttempts();
        job.backoffKind = options.backoff().kind();
        job.backoffDelayMs = options.backoff().baseDelay().toMillis();
        job.progress = 0;
        job.enqueuedAt = now;
        job.scheduledAt = delayed ? now.plus(options.delay()) : now;
        job.stalledCount = 0;
        job.updatedAt = now;
        job.persist();
        return job;
    }

    /**
     * Finds the first waiting jobs of a queue in dispatch order.
     *
     * @param queue
     *            the queue to poll
     * @param limit
     *            max rows to return
     * @return candidates, best first
     */
    public static List<QueuedJob> findWaiting(JobQueue queue, int limit) {
        return find("queue = ?1 AND status = ?2 ORDER BY " + PriorityScheduler.DISPATCH_ORDER_CLAUSE, queue,
                JobState.WAITING).range(0, limit - 1).list();
    }

    /**
     * Finds ACTIVE jobs whose owner has not sent a heartbeat since {@code cutoff}.
     */
    public static List<QueuedJob> findStalled(JobQueue queue, Instant cutoff) {
        return list("queue = ?1 AND status = ?2 AND heartbeatAt < ?3", queue, JobState.ACTIVE, cutoff);
    }

    /**
     * Lists jobs of a queue in one state using the ordering that makes sense for that state.
     */
    public static List<QueuedJob> findByState(JobQueue queue, JobState state, int limit) {
        String order = switch (state) {
            case WAITING -> PriorityScheduler.DISPATCH_ORDER_CLAUSE;
            case DELAYED -> "scheduledAt ASC, id ASC";
            case ACTIVE -> "startedAt ASC, id ASC";
            case COMPLETED, FAILED -> "finishedAt DESC, id DESC";
        };
        return find("queue = ?1 AND status = ?2 ORDER BY " + order, queue, state).range(0, limit - 1).list();
    }

    /**
     * Counts jobs of a queue per state; states without jobs map to zero.
     */
    public static Map<JobState, Long> countByState(JobQueue queue) {
        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        for (JobState state : JobState.values()) {
            counts.put(state, 0L);
        }
        List<Tuple> rows = getEntityManager()
                .createQuery("SELECT j.status AS status, COUNT(j) AS total FROM QueuedJob j WHERE j.queue = :queue "
                        + "GROUP BY j.status", Tuple.class)
                .setParameter("queue", queue).getResultList();
        for (Tuple row : rows) {
            counts.put(row.get("status", JobState.class), row.get("total", Long.class));
        }
        return counts;
    }

    /**
     * Returns ids of terminal jobs beyond the newest {@code keep} in the given state.
     */
    public static List<Long> findEvictable(JobQueue queue, JobState state, int keep) {
        return getEntityManager()
                .createQuery("SELECT j.id FROM QueuedJob j WHERE j.queue = :queue AND j.status = :status "
                        + "ORDER BY j.finishedAt DESC, j.id DESC", Long.class)
                .setParameter("queue", queue).setParameter("status", state).setFirstResult(Math.max(keep, 0))
                .getResultList();
    }

    /**
     * Converts this row into an immutable snapshot.
     */
    public JobRecord toRecord() {
        return new JobRecord(id, queue, payload, priority, attempts, maxAttempts,
                new BackoffPolicy(backoffKind, Duration.ofMillis(backoffDelayMs)), status, progress, enqueuedAt,
                scheduledAt, startedAt, finishedAt, result, failureReason, stalledCount, lockedBy, lockToken);
    }
}
