package villagecompute.talentqueue.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;
import villagecompute.talentqueue.jobs.JobRecord;

/**
 * Standard MDC field names and helpers for structured logging.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code user_id} - User the job or request acts for</li>
 * <li>{@code request_origin} - HTTP request path or {@code job:<queue>}</li>
 * <li>{@code job_id} - Broker job id (job execution only)</li>
 * <li>{@code job_queue} - Queue name (job execution only)</li>
 * <li>{@code job_attempt} - 1-based attempt number (job execution only)</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the job executor:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJob(job);
 * LoggingConfig.setUserId(payload.userId());
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> {@link MDC} is thread-local. Worker threads are reused, so every job must clear the MDC when
 * it finishes.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_USER_ID = "user_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_JOB_QUEUE = "job_queue";

    public static final String MDC_JOB_ATTEMPT = "job_attempt";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span. Without an active span the fields are set to
     * empty strings so the JSON log schema stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setUserId(String userId) {
        if (userId != null && !userId.isBlank()) {
            MDC.put(MDC_USER_ID, userId);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Sets job_id, job_queue, job_attempt and a {@code job:<queue>} request origin.
     *
     * @param job
     *            the claimed job
     */
    public static void setJob(JobRecord job) {
        if (job == null) {
            return;
        }
        if (job.id() != null) {
            MDC.put(MDC_JOB_ID, job.id().toString());
        }
        MDC.put(MDC_JOB_QUEUE, job.queue().getName());
        MDC.put(MDC_JOB_ATTEMPT, String.valueOf(job.attempts()));
        setRequestOrigin("job:" + job.queue().getName());
    }

    /**
     * Clears every field set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_JOB_QUEUE);
        MDC.remove(MDC_JOB_ATTEMPT);
    }
}
