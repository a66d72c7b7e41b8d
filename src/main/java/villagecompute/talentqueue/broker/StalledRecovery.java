package villagecompute.talentqueue.broker;

import java.util.List;

/**
 * Outcome of one stall detection pass over a queue.
 *
 * @param requeued
 *            ids moved back to waiting
 * @param failed
 *            ids abandoned after exceeding the stall limit
 */
public record StalledRecovery(List<Long> requeued, List<Long> failed) {

    public static StalledRecovery none() {
        return new StalledRecovery(List.of(), List.of());
    }

    public boolean isEmpty() {
        return requeued.isEmpty() && failed.isEmpty();
    }
}
