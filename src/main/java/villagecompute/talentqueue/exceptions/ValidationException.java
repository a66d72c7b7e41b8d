package villagecompute.talentqueue.exceptions;

/**
 * Exception thrown when a job submission is rejected before it reaches the broker (malformed payload, payload that
 * does not belong to the target queue, out-of-range options).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request by the REST layer. A job that fails
 * validation never enters a queue.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
