package villagecompute.talentqueue.api.rest;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.talentqueue.api.types.AddJobRequestType;
import villagecompute.talentqueue.api.types.HealthCheckType;
import villagecompute.talentqueue.api.types.HealthStatus;
import villagecompute.talentqueue.api.types.JobQueuedType;
import villagecompute.talentqueue.api.types.JobStatusType;
import villagecompute.talentqueue.api.types.QueueStatsSummaryType;
import villagecompute.talentqueue.exceptions.ValidationException;
import villagecompute.talentqueue.jobs.AddJobOptions;
import villagecompute.talentqueue.jobs.BackoffPolicy;
import villagecompute.talentqueue.jobs.JobState;
import villagecompute.talentqueue.services.BackgroundJobService;

/**
 * REST endpoints of the job system.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code POST /api/jobs/{queue}} – add a job (202 Accepted)</li>
 * <li>{@code GET /api/jobs/{queue}/{jobId}} – job status (404 {@code {"status":"not_found"}} when unknown)</li>
 * <li>{@code GET /api/jobs/{queue}/jobs?state=} – list jobs in a state</li>
 * <li>{@code POST /api/jobs/{queue}/pause}, {@code /resume} – stop or restart dispatch</li>
 * <li>{@code GET /api/jobs/stats} – per-queue statistics</li>
 * <li>{@code GET /api/jobs/health} – health verdict (503 when unhealthy)</li>
 * </ul>
 *
 * <p>
 * Callers are authenticated upstream; the {@code userId} inside payloads is the verified identity.
 */
@Path("/api/jobs")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Jobs",
        description = "Background job submission, status and queue operations")
public class JobQueueResource {

    private static final Logger LOG = Logger.getLogger(JobQueueResource.class);

    private static final int MAX_LIST_LIMIT = 500;

    @Inject
    BackgroundJobService jobService;

    @POST
    @Path("/{queue}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Add job",
            description = "Durably queues a job. Options left out take the queue defaults.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "202",
                    description = "Job queued",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = JobQueuedType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid payload or options"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Unknown queue"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Broker unavailable or shutting down")})
    public Response addJob(@Parameter(
            description = "Queue name (video, document, ai)",
            required = true) @PathParam("queue") String queue, @Valid AddJobRequestType request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        JobQueuedType queued = jobService.addJob(queue, request.payload(), toOptions(request));
        return Response.accepted(queued).build();
    }

    @GET
    @Path("/{queue}/{jobId}")
    @Operation(
            summary = "Job status",
            description = "Current status of a job. Evicted and unknown jobs are not found.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Job found",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = JobStatusType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Job or queue not found")})
    public Response getJobStatus(@PathParam("queue") String queue, @PathParam("jobId") String jobId) {
        return jobService.getJobStatus(jobId, queue).map(status -> Response.ok(status).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND).entity(Map.of("status", "not_found"))
                        .build());
    }

    @GET
    @Path("/{queue}/jobs")
    @Operation(
            summary = "List jobs",
            description = "Jobs of a queue in one state. Waiting jobs in dispatch order, finished jobs newest first.")
    public List<JobStatusType> listJobs(@PathParam("queue") String queue,
            @QueryParam("state") @DefaultValue("waiting") String state,
            @QueryParam("limit") @DefaultValue("50") int limit) {
        JobState jobState = JobState.fromLabel(state)
                .orElseThrow(() -> new ValidationException("Unknown job state: " + state));
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        return jobService.listJobs(queue, jobState, limit);
    }

    @POST
    @Path("/{queue}/pause")
    @Operation(
            summary = "Pause queue",
            description = "Stops claiming new jobs in this instance; running jobs finish.")
    public Map<String, Object> pause(@PathParam("queue") String queue) {
        jobService.pauseQueue(queue);
        return Map.of("queue", queue, "paused", true);
    }

    @POST
    @Path("/{queue}/resume")
    @Operation(
            summary = "Resume queue")
    public Map<String, Object> resume(@PathParam("queue") String queue) {
        jobService.resumeQueue(queue);
        return Map.of("queue", queue, "paused", false);
    }

    @GET
    @Path("/stats")
    @Operation(
            summary = "Queue statistics")
    public QueueStatsSummaryType stats() {
        return jobService.getQueueStats();
    }

    @GET
    @Path("/health")
    @Operation(
            summary = "Job system health",
            description = "healthy, degraded (broker ping failed) or unhealthy (statistics unreadable)")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Healthy or degraded",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HealthCheckType.class))),
                    @APIResponse(
                            responseCode = "503",
                            description = "Unhealthy")})
    public Response health() {
        HealthCheckType health = jobService.healthCheck();
        if (health.status() == HealthStatus.UNHEALTHY) {
            LOG.warnf("Job system unhealthy: %s", health.error());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE).entity(health).build();
        }
        return Response.ok(health).build();
    }

    static AddJobOptions toOptions(AddJobRequestType request) {
        BackoffPolicy backoff = null;
        if (request.backoffKind() != null || request.backoffDelayMs() != null) {
            if (request.backoffKind() == null || request.backoffDelayMs() == null) {
                throw new ValidationException("backoff_kind and backoff_delay_ms must be given together");
            }
            backoff = new BackoffPolicy(request.backoffKind(), Duration.ofMillis(request.backoffDelayMs()));
        }
        Duration delay = request.delayMs() == null ? null : Duration.ofMillis(request.delayMs());
        return new AddJobOptions(request.priority(), delay, request.maxAttempts(), backoff);
    }
}
