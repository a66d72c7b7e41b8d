package villagecompute.talentqueue.api.types;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import villagecompute.talentqueue.jobs.BackoffPolicy;

/**
 * Request body of {@code POST /api/jobs/{queue}}. Options left out take the queue's configured defaults.
 *
 * <p>
 * Example request:
 *
 * <pre>{@code
 * {
 *   "payload": {"userId": "u-42", "text": "Senior Java engineer...", "type": "embedding"},
 *   "priority": 6,
 *   "delay_ms": 0,
 *   "max_attempts": 3
 * }
 * }</pre>
 *
 * @param payload
 *            queue-specific payload object
 * @param priority
 *            dispatch priority, lower first
 * @param delayMs
 *            delay before the job becomes eligible
 * @param maxAttempts
 *            attempt ceiling
 * @param backoffKind
 *            FIXED or EXPONENTIAL; requires {@code backoff_delay_ms}
 * @param backoffDelayMs
 *            base backoff delay
 */
public record AddJobRequestType(@JsonProperty("payload") @NotNull(
        message = "payload is required") Map<String, Object> payload,

        @JsonProperty("priority") Integer priority,

        @JsonProperty("delay_ms") @PositiveOrZero(
                message = "delay_ms must not be negative") Long delayMs,

        @JsonProperty("max_attempts") @Min(
                value = 1,
                message = "max_attempts must be at least 1") Integer maxAttempts,

        @JsonProperty("backoff_kind") BackoffPolicy.Kind backoffKind,

        @JsonProperty("backoff_delay_ms") @PositiveOrZero(
                message = "backoff_delay_ms must not be negative") Long backoffDelayMs) {
}
