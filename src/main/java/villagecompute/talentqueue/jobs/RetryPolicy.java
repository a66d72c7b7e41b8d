package villagecompute.talentqueue.jobs;

import java.time.Duration;

/**
 * Computes the wait before the next attempt of a failed job.
 *
 * <p>
 * Stateless: the delay is a pure function of the job's backoff policy and the number of attempts already made, so the
 * same job always yields the same delay and the policy can be tested without a broker.
 *
 * <ul>
 * <li>{@code FIXED}: {@code baseDelay}</li>
 * <li>{@code EXPONENTIAL}: {@code baseDelay * 2^(attempts-1)}; uncapped, saturating at {@code Long.MAX_VALUE} ms</li>
 * </ul>
 *
 * No jitter is applied. Callers that need a ceiling apply it themselves.
 */
public final class RetryPolicy {

    private RetryPolicy() {
    }

    /**
     * Returns the delay before re-running the given job.
     *
     * @param job
     *            the job that just failed; {@code attempts} counts the attempt that failed
     * @return delay until the job should become {@code waiting} again
     */
    public static Duration nextDelay(JobRecord job) {
        return nextDelay(job.backoff(), job.attempts());
    }

    /**
     * Returns the delay for a given backoff policy after {@code attempts} attempts. Values below 1 are treated as 1.
     */
    public static Duration nextDelay(BackoffPolicy backoff, int attempts) {
        long baseMillis = backoff.baseDelay().toMillis();
        if (backoff.kind() == BackoffPolicy.Kind.FIXED) {
            return Duration.ofMillis(baseMillis);
        }

        int exponent = Math.max(attempts, 1) - 1;
        if (baseMillis == 0) {
            return Duration.ZERO;
        }
        if (exponent >= Long.numberOfLeadingZeros(baseMillis)) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        return Duration.ofMillis(baseMillis << exponent);
    }
}
