package villagecompute.talentqueue.exceptions;

/**
 * Exception thrown when a requested resource does not exist (e.g., an unknown queue name in a request path).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 404 Not Found. Unknown job ids are not reported with
 * this exception; the status tracker answers {@code not_found} for those instead.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
