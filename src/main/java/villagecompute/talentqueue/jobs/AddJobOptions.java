package villagecompute.talentqueue.jobs;

import java.time.Duration;

/**
 * Producer-facing enqueue options. Any {@code null} field falls back to the queue's configured default.
 *
 * @param priority
 *            dispatch priority (lower first)
 * @param delay
 *            time before the job becomes eligible
 * @param maxAttempts
 *            attempt ceiling
 * @param backoff
 *            retry strategy
 */
public record AddJobOptions(Integer priority, Duration delay, Integer maxAttempts, BackoffPolicy backoff) {

    public static AddJobOptions defaults() {
        return new AddJobOptions(null, null, null, null);
    }

    public static AddJobOptions withPriority(int priority, Duration delay) {
        return new AddJobOptions(priority, delay, null, null);
    }
}
