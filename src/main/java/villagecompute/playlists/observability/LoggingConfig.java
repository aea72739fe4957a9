package villagecompute.playlists.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching job-run logs with observability context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code user_id} - Owner of the schedule being run</li>
 * <li>{@code schedule_id} - Schedule primary key</li>
 * <li>{@code job_execution_id} - JobExecution primary key, once the run row exists</li>
 * <li>{@code job_type} - {@code JobType} wire value (raid, shuffle, ...)</li>
 * <li>{@code request_origin} - {@code scheduler} for background fires, {@code manual} for run-now requests</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the executor:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setScheduleId(scheduleId);
 * LoggingConfig.setRequestOrigin(LoggingConfig.ORIGIN_SCHEDULER);
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which is thread-local. Scheduler worker threads are
 * pooled, so every run must clear MDC when it finishes.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_USER_ID = "user_id";

    public static final String MDC_SCHEDULE_ID = "schedule_id";

    public static final String MDC_JOB_EXECUTION_ID = "job_execution_id";

    public static final String MDC_JOB_TYPE = "job_type";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    public static final String ORIGIN_SCHEDULER = "scheduler";

    public static final String ORIGIN_MANUAL = "manual";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span. Without a valid span the fields are set to
     * empty strings to keep the log structure stable.
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

    public static void setUserId(Long userId) {
        if (userId != null) {
            MDC.put(MDC_USER_ID, userId.toString());
        }
    }

    public static void setScheduleId(Long scheduleId) {
        if (scheduleId != null) {
            MDC.put(MDC_SCHEDULE_ID, scheduleId.toString());
        }
    }

    public static void setJobExecutionId(Long executionId) {
        if (executionId != null) {
            MDC.put(MDC_JOB_EXECUTION_ID, executionId.toString());
        }
    }

    public static void setJobType(String jobType) {
        if (jobType != null) {
            MDC.put(MDC_JOB_TYPE, jobType);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all fields set by this class. Call at the end of every job run.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_SCHEDULE_ID);
        MDC.remove(MDC_JOB_EXECUTION_ID);
        MDC.remove(MDC_JOB_TYPE);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
