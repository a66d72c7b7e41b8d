package villagecompute.talentqueue.jobs.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.broker.StalledRecovery;
import villagecompute.talentqueue.config.JobsConfig;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.JobRecord;
import villagecompute.talentqueue.jobs.JobState;
import villagecompute.talentqueue.testing.InMemoryQueueBroker;
import villagecompute.talentqueue.testing.TestJobs;

class StalledJobDetectorTest {

    private InMemoryQueueBroker broker;
    private WorkerPoolManager pools;
    private StalledJobDetector detector;

    @BeforeEach
    void setUp() {
        broker = new InMemoryQueueBroker();
        pools = mock(WorkerPoolManager.class);
        JobsConfig config = mock(JobsConfig.class);
        when(config.stallInterval()).thenReturn(Duration.ZERO);
        when(config.maxStalledCount()).thenReturn(1);

        detector = new StalledJobDetector();
        detector.broker = broker;
        detector.config = config;
        detector.pools = pools;
    }

    private JobRecord claimed() {
        broker.enqueue(JobQueue.AI, TestJobs.CODEC.encodePayload(TestJobs.embedding("x")), TestJobs.options(1, 3));
        return broker.claimNext(JobQueue.AI, "dead-worker").orElseThrow();
    }

    @Test
    void testFirstStallRequeuesWithoutConsumingAttempt() {
        JobRecord job = claimed();

        StalledRecovery recovery = detector.recover(JobQueue.AI);

        assertEquals(List.of(job.id()), recovery.requeued());
        JobRecord requeued = broker.getJob(job.id()).orElseThrow();
        assertEquals(JobState.WAITING, requeued.state());
        assertEquals(0, requeued.attempts());
        assertEquals(1, requeued.stalledCount());
        verify(pools).wakeUp(JobQueue.AI);
    }

    @Test
    void testStallBeyondLimitFailsJob() {
        JobRecord job = claimed();
        detector.recover(JobQueue.AI);
        broker.claimNext(JobQueue.AI, "dead-worker-2").orElseThrow();

        StalledRecovery recovery = detector.recover(JobQueue.AI);

        assertEquals(List.of(job.id()), recovery.failed());
        JobRecord failed = broker.getJob(job.id()).orElseThrow();
        assertEquals(JobState.FAILED, failed.state());
        assertEquals(QueueBroker.STALLED_REASON, failed.failureReason());
    }

    @Test
    void testLateAckAfterRequeueIsRejected() {
        JobRecord job = claimed();
        detector.recover(JobQueue.AI);

        assertTrue(!broker.ack(job, "{}"));
        assertEquals(JobState.WAITING, broker.getJob(job.id()).orElseThrow().state());
    }

    @Test
    void testBrokerOutageSkipsCheck() {
        claimed();
        broker.setAvailable(false);

        assertTrue(detector.recover(JobQueue.AI).isEmpty());
        verify(pools, never()).wakeUp(JobQueue.AI);
    }
}
