package villagecompute.talentqueue.exceptions;

/**
 * Transient failure signalling that the durable job store could not be reached or refused an operation.
 *
 * <p>
 * Producers receive this from {@code addJob} when the broker is down; the job has not been recorded and the caller
 * decides whether to retry or surface a service-unavailable condition. The REST layer maps it to HTTP 503.
 */
public class BrokerUnavailableException extends RuntimeException {

    public BrokerUnavailableException(String message) {
        super(message);
    }

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
