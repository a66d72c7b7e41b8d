package villagecompute.talentqueue.exceptions;

/**
 * Thrown by a job handler to signal a permanent failure.
 *
 * <p>
 * The job moves straight to {@code failed} without consuming its remaining attempts. Use it for inputs that can never
 * succeed (oversized uploads, unsupported document types, unknown AI operation types). Any other exception is treated
 * as transient and retried per the job's backoff policy.
 */
public class NonRetryableJobException extends RuntimeException {

    public NonRetryableJobException(String message) {
        super(message);
    }

    public NonRetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
