package locaposty.worker.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching worker logs with trace and job context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code job_id} - Delayed job primary key (only for job execution)</li>
 * <li>{@code post_id} - Post being published</li>
 * <li>{@code location_id} - Location whose credentials are in use</li>
 * <li>{@code request_origin} - HTTP path, job type, or periodic task name</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Job Handlers:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(jobId);
 * LoggingConfig.setRequestOrigin("JobType." + jobType.name());
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Each job execution must
 * call {@link #clearMDC()} when done because worker threads are reused.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    /**
     * Delayed job primary key (Long as String).
     */
    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_POST_ID = "post_id";

    public static final String MDC_LOCATION_ID = "location_id";

    /**
     * HTTP request path (e.g. "/ping"), job type identifier (e.g. "JobType.POST_PUBLISH") or periodic task name.
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings are written when no
     * span is active so the log structure stays consistent.
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

    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    public static void setPostId(String postId) {
        if (postId != null) {
            MDC.put(MDC_POST_ID, postId);
        }
    }

    public static void setLocationId(String locationId) {
        if (locationId != null) {
            MDC.put(MDC_LOCATION_ID, locationId);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all observability-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_POST_ID);
        MDC.remove(MDC_LOCATION_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
