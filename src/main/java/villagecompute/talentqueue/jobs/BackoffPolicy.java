package villagecompute.talentqueue.jobs;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay strategy applied between retry attempts of one job. Stored with the job at enqueue time.
 *
 * @param kind
 *            fixed or exponential
 * @param baseDelay
 *            constant delay (fixed) or the delay of the first retry (exponential)
 */
public record BackoffPolicy(Kind kind, Duration baseDelay) {

    public enum Kind {
        FIXED, EXPONENTIAL
    }

    public BackoffPolicy {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(baseDelay, "baseDelay");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative: " + baseDelay);
        }
    }

    public static BackoffPolicy fixed(Duration delay) {
        return new BackoffPolicy(Kind.FIXED, delay);
    }

    public static BackoffPolicy exponential(Duration baseDelay) {
        return new BackoffPolicy(Kind.EXPONENTIAL, baseDelay);
    }
}
