package villagecompute.talentqueue.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import villagecompute.talentqueue.testing.TestJobs;

class PrioritySchedulerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void testLowerPriorityNumberWins() {
        JobRecord low = TestJobs.waiting(1, 10, T0);
        JobRecord high = TestJobs.waiting(2, 1, T0.plusSeconds(5));

        assertEquals(2L, PriorityScheduler.selectNext(List.of(low, high)).orElseThrow().id());
    }

    @Test
    void testFifoWithinSamePriority() {
        JobRecord later = TestJobs.waiting(1, 5, T0.plus(Duration.ofMillis(10)));
        JobRecord earlier = TestJobs.waiting(2, 5, T0);

        assertEquals(2L, PriorityScheduler.selectNext(List.of(later, earlier)).orElseThrow().id());
    }

    @Test
    void testIdBreaksTimestampTies() {
        JobRecord second = TestJobs.waiting(8, 5, T0);
        JobRecord first = TestJobs.waiting(7, 5, T0);

        assertEquals(7L, PriorityScheduler.selectNext(List.of(second, first)).orElseThrow().id());
    }

    @Test
    void testIgnoresJobsThatAreNotWaiting() {
        JobRecord waiting = TestJobs.waiting(1, 9, T0);
        JobRecord active = new JobRecord(2L, JobQueue.AI, "{}", 1, 1, 3, waiting.backoff(), JobState.ACTIVE, 0, T0,
                T0, T0, null, null, null, 0, "w", "t");

        assertEquals(1L, PriorityScheduler.selectNext(List.of(active, waiting)).orElseThrow().id());
    }

    @Test
    void testEmptyInput() {
        assertTrue(PriorityScheduler.selectNext(List.of()).isEmpty());
        assertTrue(PriorityScheduler.selectNext(null).isEmpty());
    }
}
