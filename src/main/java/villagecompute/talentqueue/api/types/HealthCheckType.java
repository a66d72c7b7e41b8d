package villagecompute.talentqueue.api.types;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Health report of the job system.
 *
 * @param status
 *            verdict
 * @param brokerReachable
 *            result of the broker ping
 * @param queues
 *            per-queue statistics; empty when {@code UNHEALTHY}
 * @param details
 *            aggregate counts
 * @param error
 *            cause of an {@code UNHEALTHY} verdict, otherwise null
 * @param timestamp
 *            time of the check
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthCheckType(@JsonProperty("status") HealthStatus status,
        @JsonProperty("broker_reachable") boolean brokerReachable, @JsonProperty("queues") List<QueueStatsType> queues,
        @JsonProperty("details") Details details, @JsonProperty("error") String error,
        @JsonProperty("timestamp") Instant timestamp) {

    /**
     * Aggregate counts across queues.
     */
    public record Details(@JsonProperty("total_jobs") long totalJobs, @JsonProperty("active_jobs") long activeJobs,
            @JsonProperty("failed_jobs") long failedJobs) {

        public static final Details EMPTY = new Details(0, 0, 0);
    }
}
