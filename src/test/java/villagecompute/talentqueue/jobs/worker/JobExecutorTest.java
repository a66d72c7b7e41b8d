package villagecompute.talentqueue.jobs.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import villagecompute.talentqueue.exceptions.NonRetryableJobException;
import villagecompute.talentqueue.jobs.BackoffPolicy;
import villagecompute.talentqueue.jobs.JobHandlerRegistry;
import villagecompute.talentqueue.jobs.JobOptions;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.JobRecord;
import villagecompute.talentqueue.jobs.JobState;
import villagecompute.talentqueue.jobs.worker.JobExecutor.Outcome;
import villagecompute.talentqueue.testing.InMemoryQueueBroker;
import villagecompute.talentqueue.testing.ScriptedAiHandler;
import villagecompute.talentqueue.testing.TestJobs;

/**
 * Tests for {@link JobExecutor} outcome handling: completion, retry scheduling, permanent failure and fencing.
 */
class JobExecutorTest {

    private InMemoryQueueBroker broker;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        broker = new InMemoryQueueBroker();
        meterRegistry = new SimpleMeterRegistry();
    }

    private JobExecutor executor(ScriptedAiHandler handler) {
        return new JobExecutor(broker, new JobHandlerRegistry(List.of(handler)), TestJobs.CODEC,
                OpenTelemetry.noop().getTracer("test"), meterRegistry);
    }

    private JobRecord claimAiJob(JobOptions options) {
        broker.enqueue(JobQueue.AI, TestJobs.CODEC.encodePayload(TestJobs.embedding("hello")), options);
        return broker.claimNext(JobQueue.AI, "worker-1").orElseThrow();
    }

    @Test
    void testSuccess_storesResultAndCompletes() {
        ScriptedAiHandler handler = new ScriptedAiHandler((call, payload, progress) -> {
            progress.report(50);
            return Map.of("dimension", 3);
        });
        JobRecord job = claimAiJob(TestJobs.options(1, 3));

        assertEquals(Outcome.COMPLETED, executor(handler).execute(job));

        JobRecord stored = broker.getJob(job.id()).orElseThrow();
        assertEquals(JobState.COMPLETED, stored.state());
        assertEquals(100, stored.progress());
        assertEquals(Map.of("dimension", 3), TestJobs.CODEC.decodeResult(stored.result()));
        assertEquals(List.of(50), broker.progressReports());
        assertEquals(1.0, meterRegistry.get("talentqueue_jobs_total").tag("queue", "ai")
                .tag("outcome", "completed").counter().count());
    }

    @Test
    void testTransientFailure_schedulesRetryWithBackoff() {
        ScriptedAiHandler handler = new ScriptedAiHandler((call, payload, progress) -> {
            throw new IOException("model timeout");
        });
        JobOptions options = new JobOptions(1, Duration.ZERO, 3, BackoffPolicy.exponential(Duration.ofSeconds(10)));
        JobRecord job = claimAiJob(options);
        Instant before = Instant.now();

        assertEquals(Outcome.RETRY_SCHEDULED, executor(handler).execute(job));

        JobRecord stored = broker.getJob(job.id()).orElseThrow();
        assertEquals(JobState.DELAYED, stored.state());
        assertEquals("model timeout", stored.failureReason());
        assertTrue(!stored.scheduledAt().isBefore(before.plusSeconds(10)));
    }

    @Test
    void testFinalAttemptFailure_isTerminal() {
        ScriptedAiHandler handler = new ScriptedAiHandler((call, payload, progress) -> {
            throw new IllegalStateException("still broken");
        });
        JobRecord job = claimAiJob(TestJobs.options(1, 1));

        assertEquals(Outcome.FAILED, executor(handler).execute(job));

        JobRecord stored = broker.getJob(job.id()).orElseThrow();
        assertEquals(JobState.FAILED, stored.state());
        assertEquals("still broken", stored.failureReason());
        assertEquals(1, stored.attempts());
        assertNull(stored.result());
    }

    @Test
    void testFailsTwiceThenCompletes_withExponentialDelays() {
        ScriptedAiHandler handler = new ScriptedAiHandler((call, payload, progress) -> {
            if (call < 3) {
                throw new IllegalStateException("attempt " + call + " failed");
            }
            return Map.of("ok", true);
        });
        JobExecutor executor = executor(handler);
        JobRecord job = claimAiJob(
                new JobOptions(1, Duration.ZERO, 3, BackoffPolicy.exponential(Duration.ofMillis(500))));

        for (long expectedDelayMs : new long[]{500, 1000}) {
            Instant before = Instant.now();
            assertEquals(Outcome.RETRY_SCHEDULED, executor.execute(job));
            Instant after = Instant.now();

            JobRecord delayed = broker.getJob(job.id()).orElseThrow();
            assertEquals(JobState.DELAYED, delayed.state());
            assertTrue(!delayed.scheduledAt().isBefore(before.plusMillis(expectedDelayMs)));
            assertTrue(!delayed.scheduledAt().isAfter(after.plusMillis(expectedDelayMs)));

            broker.promoteDelayed(delayed.scheduledAt());
            job = broker.claimNext(JobQueue.AI, "worker-1").orElseThrow();
        }

        assertEquals(Outcome.COMPLETED, executor.execute(job));
        JobRecord done = broker.getJob(job.id()).orElseThrow();
        assertEquals(JobState.COMPLETED, done.state());
        assertEquals(3, done.attempts());
        assertEquals(3, handler.calls());
    }

    @Test
    void testNonRetryableFailure_skipsRemainingAttempts() {
        ScriptedAiHandler handler = new ScriptedAiHandler((call, payload, progress) -> {
            throw new NonRetryableJobException("file too large");
        });
        JobRecord job = claimAiJob(TestJobs.options(1, 5));

        assertEquals(Outcome.FAILED, executor(handler).execute(job));
        assertEquals(JobState.FAILED, broker.getJob(job.id()).orElseThrow().state());
    }

    @Test
    void testMissingHandler_failsPermanently() {
        JobExecutor executor = new JobExecutor(broker, new JobHandlerRegistry(List.of()), TestJobs.CODEC,
                OpenTelemetry.noop().getTracer("test"), meterRegistry);
        JobRecord job = claimAiJob(TestJobs.options(1, 3));

        assertEquals(Outcome.FAILED, executor.execute(job));
        assertTrue(broker.getJob(job.id()).orElseThrow().failureReason().contains("No handler"));
    }

    @Test
    void testUndecodablePayload_failsPermanently() {
        ScriptedAiHandler handler = new ScriptedAiHandler((call, payload, progress) -> Map.of());
        broker.enqueue(JobQueue.AI, "{not json", TestJobs.options(1, 3));
        JobRecord job = broker.claimNext(JobQueue.AI, "worker-1").orElseThrow();

        assertEquals(Outcome.FAILED, executor(handler).execute(job));
        assertEquals(0, handler.calls());
    }

    @Test
    void testStaleClaim_isNotRecorded() {
        ScriptedAiHandler handler = new ScriptedAiHandler((call, payload, progress) -> Map.of("ok", true));
        JobRecord job = claimAiJob(TestJobs.options(1, 3));
        JobRecord stale = new JobRecord(job.id(), job.queue(), job.payload(), job.priority(), job.attempts(),
                job.maxAttempts(), job.backoff(), job.state(), 0, job.enqueuedAt(), job.scheduledAt(), job.startedAt(),
                null, null, null, 0, "worker-0", "expired-token");

        assertEquals(Outcome.CLAIM_LOST, executor(handler).execute(stale));
        assertEquals(JobState.ACTIVE, broker.getJob(job.id()).orElseThrow().state());
    }

    @Test
    void testBrokerOutageWhileRecording() {
        JobRecord job = claimAiJob(TestJobs.options(1, 3));
        ScriptedAiHandler handler = new ScriptedAiHandler((call, payload, progress) -> {
            broker.setAvailable(false);
            return Map.of();
        });

        assertEquals(Outcome.BROKER_ERROR, executor(handler).execute(job));
    }

    @Test
    void testInterruptedJob_leftActive() {
        ScriptedAiHandler handler = new ScriptedAiHandler((call, payload, progress) -> {
            throw new InterruptedException("shutdown");
        });
        JobRecord job = claimAiJob(TestJobs.options(1, 3));

        assertEquals(Outcome.INTERRUPTED, executor(handler).execute(job));
        assertTrue(Thread.interrupted(), "interrupt flag should be restored");
        assertEquals(JobState.ACTIVE, broker.getJob(job.id()).orElseThrow().state());
    }

    @Test
    void testResumeAtIsClamped() {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");

        assertEquals(now.plusSeconds(5), JobExecutor.resumeAt(now, Duration.ofSeconds(5)));
        assertEquals(JobExecutor.MAX_RESUME_AT, JobExecutor.resumeAt(now, Duration.ofMillis(Long.MAX_VALUE)));
    }
}
