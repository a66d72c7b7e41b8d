package villagecompute.talentqueue.api.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.exceptions.BrokerUnavailableException;
import villagecompute.talentqueue.jobs.JobState;

/**
 * Health endpoint verdicts with a mocked broker.
 */
@QuarkusTest
class JobHealthResourceTest {

    @InjectMock
    QueueBroker broker;

    @Test
    void testHealth_degradedWhenPingFails() {
        when(broker.countByState(any())).thenReturn(Map.of(JobState.WAITING, 2L, JobState.FAILED, 1L));
        when(broker.ping()).thenReturn(false);

        given().when().get("/api/jobs/health").then().statusCode(200).body("status", equalTo("degraded"))
                .body("broker_reachable", equalTo(false)).body("queues", hasSize(3))
                .body("details.total_jobs", equalTo(9)).body("details.failed_jobs", equalTo(3));
    }

    @Test
    void testHealth_unhealthyWhenStatisticsUnreadable() {
        when(broker.countByState(any())).thenThrow(new BrokerUnavailableException("connection refused"));

        given().when().get("/api/jobs/health").then().statusCode(503).body("status", equalTo("unhealthy"))
                .body("broker_reachable", equalTo(false));
    }
}
