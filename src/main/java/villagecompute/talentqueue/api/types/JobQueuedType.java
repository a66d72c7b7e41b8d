/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.talentqueue.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledgement returned to a producer once its job is durably queued.
 *
 * @param jobId
 *            broker-assigned job id
 * @param queue
 *            queue name
 * @param status
 *            always {@code "queued"}
 * @param state
 *            initial state, {@code waiting} or {@code delayed}
 * @param estimatedWaitMs
 *            rough time until a worker picks the job up
 */
public record JobQueuedType(@JsonProperty("job_id") String jobId, @JsonProperty("queue") String queue,
        @JsonProperty("status") String status, @JsonProperty("state") String state,
        @JsonProperty("estimated_wait_ms") long estimatedWaitMs) {

    public static final String QUEUED = "queued";
}
