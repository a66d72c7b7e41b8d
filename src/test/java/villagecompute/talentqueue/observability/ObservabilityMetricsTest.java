package villagecompute.talentqueue.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.exceptions.BrokerUnavailableException;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.JobState;
import villagecompute.talentqueue.jobs.worker.WorkerPoolManager;

class ObservabilityMetricsTest {

    private SimpleMeterRegistry registry;
    private QueueBroker broker;
    private ObservabilityMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        broker = mock(QueueBroker.class);
        WorkerPoolManager pools = mock(WorkerPoolManager.class);
        when(pools.availableSlots(JobQueue.AI)).thenReturn(3);

        metrics = new ObservabilityMetrics();
        metrics.registry = registry;
        metrics.broker = broker;
        metrics.pools = pools;
        metrics.registerMetrics(null);
    }

    private double depth(JobQueue queue, JobState state) {
        Gauge gauge = registry.get("talentqueue_jobs_depth").tag("queue", queue.getName())
                .tag("state", state.getLabel()).gauge();
        return gauge.value();
    }

    @Test
    void testDepthGaugesShareOneCountPerQueue() {
        when(broker.countByState(any())).thenReturn(Map.of(JobState.WAITING, 4L, JobState.ACTIVE, 2L));

        for (JobQueue queue : JobQueue.values()) {
            for (JobState state : JobState.values()) {
                depth(queue, state);
            }
        }

        assertEquals(4.0, depth(JobQueue.VIDEO, JobState.WAITING));
        assertEquals(2.0, depth(JobQueue.VIDEO, JobState.ACTIVE));
        assertEquals(0.0, depth(JobQueue.VIDEO, JobState.FAILED));
        for (JobQueue queue : JobQueue.values()) {
            verify(broker, times(1)).countByState(queue);
        }
    }

    @Test
    void testDepthIsNaNWhenBrokerUnavailable() {
        when(broker.countByState(any())).thenThrow(new BrokerUnavailableException("down"));

        assertTrue(Double.isNaN(depth(JobQueue.DOCUMENT, JobState.WAITING)));
        assertTrue(Double.isNaN(depth(JobQueue.DOCUMENT, JobState.ACTIVE)));
        verify(broker, times(1)).countByState(JobQueue.DOCUMENT);
    }

    @Test
    void testSlotGauge() {
        double slots = registry.get("talentqueue_worker_slots_available").tag("queue", "ai").gauge().value();

        assertEquals(3.0, slots);
    }
}
