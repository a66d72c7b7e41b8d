package villagecompute.talentqueue.exceptions;

/**
 * Thrown when a producer submits work after the job system started shutting down. Mapped to HTTP 503.
 */
public class JobSystemShutdownException extends RuntimeException {

    public JobSystemShutdownException(String message) {
        super(message);
    }
}
