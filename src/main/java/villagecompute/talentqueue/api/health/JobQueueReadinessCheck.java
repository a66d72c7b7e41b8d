package villagecompute.talentqueue.api.health;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.talentqueue.api.types.HealthCheckType;
import villagecompute.talentqueue.api.types.HealthStatus;
import villagecompute.talentqueue.services.QueueHealthService;

/**
 * Readiness probe for the job system, served at {@code /q/health/ready}.
 *
 * <p>
 * Reports DOWN only for an {@code UNHEALTHY} verdict. A {@code DEGRADED} system still answers producers, so it stays
 * in the load balancer.
 */
@ApplicationScoped
@Readiness
public class JobQueueReadinessCheck implements HealthCheck {

    @Inject
    QueueHealthService healthService;

    @Override
    public HealthCheckResponse call() {
        HealthCheckType health = healthService.healthCheck();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("job-queues")
                .status(health.status() != HealthStatus.UNHEALTHY).withData("status", health.status().getLabel())
                .withData("broker_reachable", health.brokerReachable())
                .withData("total_jobs", health.details().totalJobs())
                .withData("active_jobs", health.details().activeJobs())
                .withData("failed_jobs", health.details().failedJobs());
        if (health.error() != null) {
            builder.withData("error", health.error());
        }
        return builder.build();
    }
}
