package villagecompute.talentqueue.jobs.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.talentqueue.jobs.BackoffPolicy;
import villagecompute.talentqueue.jobs.JobOptions;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.JobState;
import villagecompute.talentqueue.testing.InMemoryQueueBroker;
import villagecompute.talentqueue.testing.TestJobs;

class DelayedJobPromoterTest {

    private InMemoryQueueBroker broker;
    private WorkerPoolManager pools;
    private DelayedJobPromoter promoter;

    @BeforeEach
    void setUp() {
        broker = new InMemoryQueueBroker();
        pools = mock(WorkerPoolManager.class);
        promoter = new DelayedJobPromoter();
        promoter.broker = broker;
        promoter.pools = pools;
    }

    private long enqueueDelayed(Duration delay) {
        JobOptions options = new JobOptions(1, delay, 1, BackoffPolicy.fixed(Duration.ZERO));
        return broker.enqueue(JobQueue.VIDEO, TestJobs.CODEC.encodePayload(TestJobs.video("u1")), options).id();
    }

    @Test
    void testPromotesOnlyDueJobs() {
        long due = enqueueDelayed(Duration.ofMillis(100));
        long later = enqueueDelayed(Duration.ofHours(1));

        assertEquals(1, promoter.promote(Instant.now().plusSeconds(1)));

        assertEquals(JobState.WAITING, broker.getJob(due).orElseThrow().state());
        assertEquals(JobState.DELAYED, broker.getJob(later).orElseThrow().state());
        verify(pools).wakeUp(JobQueue.VIDEO);
    }

    @Test
    void testNothingDue() {
        enqueueDelayed(Duration.ofHours(1));

        assertEquals(0, promoter.promote(Instant.now()));
        verify(pools, never()).wakeUp(any());
    }

    @Test
    void testBrokerOutage() {
        broker.setAvailable(false);

        assertEquals(-1, promoter.promote(Instant.now()));
    }
}
