/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.talentqueue.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import villagecompute.talentqueue.jobs.BackoffPolicy;
import villagecompute.talentqueue.jobs.JobQueue;

/**
 * Job system configuration ({@code talentqueue.jobs.*}).
 *
 * <p>
 * Durations use the Quarkus format ({@code 500ms}, {@code 30s}, {@code 5m}). Every key can be overridden through the
 * environment, e.g. {@code TALENTQUEUE_JOBS_QUEUES_VIDEO_CONCURRENCY=1}.
 */
@ConfigMapping(
        prefix = "talentqueue.jobs")
public interface JobsConfig {

    /**
     * Whether worker pools start at boot. API-only pods set this to false and only enqueue.
     */
    @WithDefault("true")
    boolean workersEnabled();

    /**
     * How long an idle dispatcher sleeps before polling the broker again.
     */
    @WithDefault("1s")
    Duration pollInterval();

    /**
     * Time allowed for in-flight jobs to finish on shutdown.
     */
    @WithDefault("30s")
    Duration shutdownGracePeriod();

    /**
     * Stall detection interval; an ACTIVE job without a heartbeat for this long is stalled.
     */
    @WithDefault("30s")
    Duration stallInterval();

    /**
     * Stall recoveries tolerated before the job is abandoned as failed.
     */
    @WithDefault("1")
    int maxStalledCount();

    /**
     * Interval of the delayed-job promoter.
     */
    @WithDefault("1s")
    Duration promoteInterval();

    /**
     * Default attempt ceiling for jobs enqueued without {@code maxAttempts}.
     */
    @WithDefault("3")
    int defaultAttempts();

    DefaultBackoff defaultBackoff();

    Retention retention();

    WaitEstimate waitEstimate();

    Queues queues();

    /**
     * Resolves the per-queue settings of {@code queue}.
     */
    default QueueSettings queue(JobQueue queue) {
        return switch (queue) {
            case VIDEO -> new QueueSettings(queues().video().concurrency(), queues().video().priority(),
                    queues().video().delay());
            case DOCUMENT -> new QueueSettings(queues().document().concurrency(), queues().document().priority(),
                    queues().document().delay());
            case AI -> new QueueSettings(queues().ai().concurrency(), queues().ai().priority(), queues().ai().delay());
        };
    }

    /**
     * Default backoff as a policy value.
     */
    default BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(defaultBackoff().kind(), defaultBackoff().baseDelay());
    }

    interface DefaultBackoff {

        @WithDefault("EXPONENTIAL")
        BackoffPolicy.Kind kind();

        @WithDefault("2s")
        Duration baseDelay();
    }

    /**
     * Number of terminal records kept per queue; older ones are evicted.
     */
    interface Retention {

        @WithDefault("10")
        int completed();

        @WithDefault("50")
        int failed();
    }

    /**
     * Inputs of the queue wait estimate shown to producers.
     */
    interface WaitEstimate {

        @WithDefault("30s")
        Duration averageProcessingTime();

        @WithDefault("5m")
        Duration max();

        /**
         * Returned when the estimate cannot be computed.
         */
        @WithDefault("1m")
        Duration fallback();
    }

    interface Queues {

        VideoQueue video();

        DocumentQueue document();

        AiQueue ai();
    }

    interface VideoQueue {

        @WithDefault("2")
        int concurrency();

        @WithDefault("10")
        int priority();

        @WithDefault("100ms")
        Duration delay();
    }

    interface DocumentQueue {

        @WithDefault("3")
        int concurrency();

        @WithDefault("8")
        int priority();

        @WithDefault("50ms")
        Duration delay();
    }

    interface AiQueue {

        @WithDefault("4")
        int concurrency();

        /**
         * Priority of analysis and matching jobs.
         */
        @WithDefault("4")
        int priority();

        @WithDefault("200ms")
        Duration delay();

        @WithDefault("6")
        int embeddingPriority();

        @WithDefault("0s")
        Duration embeddingDelay();
    }

    /**
     * Resolved settings of one queue.
     *
     * @param concurrency
     *            worker slots in this process
     * @param priority
     *            default priority
     * @param delay
     *            default delay
     */
    record QueueSettings(int concurrency, int priority, Duration delay) {
    }
}
