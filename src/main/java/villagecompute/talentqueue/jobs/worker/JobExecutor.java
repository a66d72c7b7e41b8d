package villagecompute.talentqueue.jobs.worker;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.exceptions.BrokerUnavailableException;
import villagecompute.talentqueue.exceptions.NonRetryableJobException;
import villagecompute.talentqueue.jobs.JobHandler;
import villagecompute.talentqueue.jobs.JobHandlerRegistry;
import villagecompute.talentqueue.jobs.JobPayloadCodec;
import villagecompute.talentqueue.jobs.JobProgress;
import villagecompute.talentqueue.jobs.JobRecord;
import villagecompute.talentqueue.jobs.RetryPolicy;
import villagecompute.talentqueue.jobs.payload.JobPayload;
import villagecompute.talentqueue.observability.LoggingConfig;

/**
 * Runs one claimed job attempt and records its outcome in the broker.
 *
 * <p>
 * <b>Transitions:</b>
 * <ul>
 * <li>handler returns → {@code ack} (COMPLETED with the result)</li>
 * <li>{@link NonRetryableJobException}, undecodable payload or no handler → {@code fail} immediately</li>
 * <li>any other exception with attempts remaining → {@code scheduleRetry} after {@link RetryPolicy#nextDelay}</li>
 * <li>any other exception on the last attempt → {@code fail} with the handler's message</li>
 * <li>interrupted (shutdown) → nothing recorded; the job stays ACTIVE until the stall detector requeues it</li>
 * </ul>
 *
 * <p>
 * Every attempt runs inside a {@code job.execute} span with MDC fields from {@link LoggingConfig}, and is counted in
 * {@code talentqueue_jobs_total{queue,outcome}} and timed in {@code talentqueue_job_duration{queue}}.
 */
@ApplicationScoped
public class JobExecutor {

    private static final Logger LOG = Logger.getLogger(JobExecutor.class);

    /**
     * Latest resume time the broker can store. Saturated exponential delays are clamped to it.
     */
    static final Instant MAX_RESUME_AT = Instant.parse("9999-12-31T23:59:59Z");

    /**
     * Outcome of one attempt as seen by this executor.
     */
    public enum Outcome {
        COMPLETED, RETRY_SCHEDULED, FAILED, INTERRUPTED,
        /** The claim was taken over by another delivery before the outcome could be recorded. */
        CLAIM_LOST,
        /** The outcome could not be recorded because the broker was unreachable. */
        BROKER_ERROR;

        public String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final QueueBroker broker;
    private final JobHandlerRegistry handlers;
    private final JobPayloadCodec codec;
    private final Tracer tracer;
    private final MeterRegistry registry;

    @Inject
    public JobExecutor(QueueBroker broker, JobHandlerRegistry handlers, JobPayloadCodec codec, Tracer tracer,
            MeterRegistry registry) {
        this.broker = broker;
        this.handlers = handlers;
        this.codec = codec;
        this.tracer = tracer;
        this.registry = registry;
    }

    /**
     * Executes one attempt of {@code job}, which must have been claimed by the calling pool.
     *
     * @param job
     *            claimed job (ACTIVE, with its lock token)
     * @return what was recorded for the attempt
     */
    public Outcome execute(JobRecord job) {
        long startNanos = System.nanoTime();
        String queueName = job.queue().getName();
        Outcome outcome = Outcome.BROKER_ERROR;

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.id())
                .setAttribute("job.queue", queueName).setAttribute("job.attempt", job.attempts()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJob(job);
            outcome = run(job, span);
            span.setAttribute("job.outcome", outcome.tagValue());
        } finally {
            long elapsedNanos = System.nanoTime() - startNanos;
            span.end();
            Counter.builder("talentqueue_jobs_total").description("Job attempts by queue and outcome")
                    .tag("queue", queueName).tag("outcome", outcome.tagValue()).register(registry).increment();
            Timer.builder("talentqueue_job_duration").description("Wall-clock duration of job attempts")
                    .tag("queue", queueName).register(registry).record(elapsedNanos, TimeUnit.NANOSECONDS);
            LOG.infof("Job %d (queue: %s) attempt %d/%d finished in %d ms: %s", job.id(), queueName, job.attempts(),
                    job.maxAttempts(), TimeUnit.NANOSECONDS.toMillis(elapsedNanos), outcome.tagValue());
            LoggingConfig.clearMDC();
        }
        return outcome;
    }

    private Outcome run(JobRecord job, Span span) {
        String result;
        try {
            result = invokeHandler(job);
        } catch (NonRetryableJobException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            LOG.errorf("Job %d (queue: %s) failed permanently on attempt %d: %s", job.id(), job.queue().getName(),
                    job.attempts(), e.getMessage());
            return record(job, Outcome.FAILED, () -> broker.fail(job, failureReason(e)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.recordException(e);
            span.addEvent("job.interrupted");
            LOG.warnf("Job %d (queue: %s) interrupted on attempt %d; left active for stall recovery", job.id(),
                    job.queue().getName(), job.attempts());
            return Outcome.INTERRUPTED;
        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            if (job.hasAttemptsRemaining()) {
                Duration delay = RetryPolicy.nextDelay(job);
                LOG.warnf(e, "Job %d (queue: %s) failed on attempt %d/%d, retrying in %d ms: %s", job.id(),
                        job.queue().getName(), job.attempts(), job.maxAttempts(), delay.toMillis(), e.getMessage());
                return record(job, Outcome.RETRY_SCHEDULED,
                        () -> broker.scheduleRetry(job, resumeAt(Instant.now(), delay), failureReason(e)));
            }
            LOG.errorf(e, "Job %d (queue: %s) failed on final attempt %d/%d: %s", job.id(), job.queue().getName(),
                    job.attempts(), job.maxAttempts(), e.getMessage());
            return record(job, Outcome.FAILED, () -> broker.fail(job, failureReason(e)));
        }

        span.addEvent("job.completed");
        return record(job, Outcome.COMPLETED, () -> broker.ack(job, result));
    }

    /**
     * Decodes the payload, runs the queue's handler and encodes its result.
     */
    private String invokeHandler(JobRecord job) throws Exception {
        JobHandler<?> handler = handlers.handlerFor(job.queue()).orElseThrow(
                () -> new NonRetryableJobException("No handler registered for queue " + job.queue().getName()));

        JobPayload payload;
        try {
            payload = codec.decodePayload(job.queue(), job.payload());
        } catch (IllegalArgumentException e) {
            throw new NonRetryableJobException(e.getMessage(), e);
        }
        LoggingConfig.setUserId(payload.userId());

        Map<String, Object> result = invoke(handler, job, payload);
        try {
            return codec.encodeResult(result == null ? Map.of() : result);
        } catch (IllegalArgumentException e) {
            throw new NonRetryableJobException(e.getMessage(), e);
        }
    }

    private <P extends JobPayload> Map<String, Object> invoke(JobHandler<P> handler, JobRecord job, JobPayload payload)
            throws Exception {
        return handler.execute(job.id(), handler.payloadType().cast(payload), progressReporter(job));
    }

    private JobProgress progressReporter(JobRecord job) {
        return percent -> {
            try {
                if (!broker.updateProgress(job, percent)) {
                    LOG.debugf("Progress %d%% for job %d ignored; claim no longer held", percent, job.id());
                }
            } catch (BrokerUnavailableException e) {
                LOG.warnf("Could not record progress %d%% for job %d: %s", percent, job.id(), e.getMessage());
            }
        };
    }

    private Outcome record(JobRecord job, Outcome outcome, BooleanSupplier transition) {
        try {
            if (transition.getAsBoolean()) {
                return outcome;
            }
            LOG.warnf("Job %d (queue: %s) was reclaimed before its %s outcome could be recorded (duplicate delivery)",
                    job.id(), job.queue().getName(), outcome.tagValue());
            return Outcome.CLAIM_LOST;
        } catch (BrokerUnavailableException e) {
            LOG.errorf(e, "Could not record %s outcome for job %d (queue: %s); the stall detector will requeue it",
                    outcome.tagValue(), job.id(), job.queue().getName());
            return Outcome.BROKER_ERROR;
        }
    }

    static Instant resumeAt(Instant now, Duration delay) {
        try {
            Instant resumeAt = now.plus(delay);
            return resumeAt.isAfter(MAX_RESUME_AT) ? MAX_RESUME_AT : resumeAt;
        } catch (DateTimeException | ArithmeticException e) {
            return MAX_RESUME_AT;
        }
    }

    private static String failureReason(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
