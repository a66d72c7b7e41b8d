package villagecompute.talentqueue.api.types;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.talentqueue.jobs.JobState;

/**
 * Point-in-time view of one job. Failures carry only the recorded reason, never a stack trace.
 */
public record JobStatusType(@JsonProperty("id") String id, @JsonProperty("queue") String queue,
        @JsonProperty("status") JobState status, @JsonProperty("progress") int progress,
        @JsonProperty("priority") int priority, @JsonProperty("attempts") int attempts,
        @JsonProperty("max_attempts") int maxAttempts, @JsonProperty("result") Map<String, Object> result,
        @JsonProperty("error") String error, @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("scheduled_at") Instant scheduledAt, @JsonProperty("processed_at") Instant processedAt,
        @JsonProperty("finished_at") Instant finishedAt) {
}
