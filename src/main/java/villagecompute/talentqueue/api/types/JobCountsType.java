package villagecompute.talentqueue.api.types;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.talentqueue.jobs.JobState;

/**
 * Job counts per state.
 */
public record JobCountsType(@JsonProperty("waiting") long waiting, @JsonProperty("active") long active,
        @JsonProperty("completed") long completed, @JsonProperty("failed") long failed,
        @JsonProperty("delayed") long delayed, @JsonProperty("total") long total) {

    public static final JobCountsType EMPTY = new JobCountsType(0, 0, 0, 0, 0, 0);

    /**
     * Builds counts from a broker state histogram; missing states count as zero.
     */
    public static JobCountsType from(Map<JobState, Long> counts) {
        long waiting = counts.getOrDefault(JobState.WAITING, 0L);
        long active = counts.getOrDefault(JobState.ACTIVE, 0L);
        long completed = counts.getOrDefault(JobState.COMPLETED, 0L);
        long failed = counts.getOrDefault(JobState.FAILED, 0L);
        long delayed = counts.getOrDefault(JobState.DELAYED, 0L);
        return new JobCountsType(waiting, active, completed, failed, delayed,
                waiting + active + completed + failed + delayed);
    }

    public JobCountsType plus(JobCountsType other) {
        return new JobCountsType(waiting + other.waiting, active + other.active, completed + other.completed,
                failed + other.failed, delayed + other.delayed, total + other.total);
    }
}
