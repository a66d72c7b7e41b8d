package villagecompute.talentqueue.api.types;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistics of every queue plus totals, as served by {@code GET /api/jobs/stats}.
 */
public record QueueStatsSummaryType(@JsonProperty("queues") List<QueueStatsType> queues,
        @JsonProperty("totals") JobCountsType totals, @JsonProperty("timestamp") Instant timestamp) {
}
