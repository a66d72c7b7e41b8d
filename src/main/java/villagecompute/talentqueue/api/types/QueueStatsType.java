package villagecompute.talentqueue.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistics of one queue.
 *
 * @param queue
 *            queue name
 * @param counts
 *            jobs per state across all instances
 * @param concurrency
 *            configured worker slots per instance
 * @param availableSlots
 *            free slots in this instance (0 when no pool runs here)
 * @param paused
 *            whether dispatch is paused
 */
public record QueueStatsType(@JsonProperty("queue") String queue, @JsonProperty("counts") JobCountsType counts,
        @JsonProperty("concurrency") int concurrency, @JsonProperty("available_slots") int availableSlots,
        @JsonProperty("paused") boolean paused) {
}
