package villagecompute.talentqueue.jobs;

import java.time.Duration;
import java.util.Objects;

/**
 * Fully resolved enqueue options handed to the broker.
 *
 * @param priority
 *            dispatch priority (lower first)
 * @param delay
 *            time before the job becomes eligible; zero for immediate
 * @param maxAttempts
 *            attempt ceiling, at least 1
 * @param backoff
 *            retry strategy
 */
public record JobOptions(int priority, Duration delay, int maxAttempts, BackoffPolicy backoff) {

    public JobOptions {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(backoff, "backoff");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
    }
}
