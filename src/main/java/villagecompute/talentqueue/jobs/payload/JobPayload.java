package villagecompute.talentqueue.jobs.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;

import villagecompute.talentqueue.jobs.JobQueue;

/**
 * Marker for the payload variants, one record per workload class.
 *
 * <p>
 * The owning {@link JobQueue} acts as the tag of the union: the broker keeps the queue next to the serialized record
 * and decodes with {@link JobQueue#getPayloadType()}. Payloads carry references (storage keys), never raw bytes.
 */
public interface JobPayload {

    /**
     * Verified identity of the user the work is done for.
     */
    String userId();

    /**
     * Queue this payload variant belongs to.
     */
    @JsonIgnore
    JobQueue queue();
}
