package villagecompute.talentqueue.jobs;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Dispatch ordering for waiting jobs within one queue.
 *
 * <p>
 * Lowest {@code priority} value first; ties broken by earliest {@code enqueuedAt}, then by lowest id (ids are assigned
 * in submission order, so jobs enqueued within the same clock tick stay FIFO). There is no ordering across queues.
 * Which priority a workload gets is decided by producers, not here.
 *
 * <p>
 * The broker applies the same rule in its claim query via {@link #DISPATCH_ORDER_CLAUSE}.
 */
public final class PriorityScheduler {

    /**
     * JPQL ordering equivalent to {@link #DISPATCH_ORDER}.
     */
    public static final String DISPATCH_ORDER_CLAUSE = "priority ASC, enqueuedAt ASC, id ASC";

    public static final Comparator<JobRecord> DISPATCH_ORDER = Comparator.comparingInt(JobRecord::priority)
            .thenComparing(JobRecord::enqueuedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(JobRecord::id, Comparator.nullsLast(Comparator.naturalOrder()));

    private PriorityScheduler() {
    }

    /**
     * Picks the next job to dispatch.
     *
     * @param waiting
     *            waiting jobs of a single queue, in any order
     * @return the job to run next, or empty if there is none
     */
    public static Optional<JobRecord> selectNext(Collection<JobRecord> waiting) {
        if (waiting == null || waiting.isEmpty()) {
            return Optional.empty();
        }
        return waiting.stream().filter(job -> job.state() == JobState.WAITING).min(DISPATCH_ORDER);
    }
}
