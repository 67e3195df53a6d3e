/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.observability;

import org.jboss.logging.MDC;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

/**
 * Standard MDC fields for authentication logs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - current span identifier within the trace</li>
 * <li>{@code request_origin} - HTTP method and path of the request being handled</li>
 * <li>{@code auth_provider} - identity provider of the flow ({@code apple})</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Callers clear MDC when the
 * request ends to prevent context leakage.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    public static final String MDC_AUTH_PROVIDER = "auth_provider";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace and span ids of the current OpenTelemetry span into MDC. Empty strings are written when no span is
     * active to keep the JSON log schema stable.
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

    public static void setRequestOrigin(String origin) {
        if (origin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, origin);
        }
    }

    public static void setAuthProvider(String provider) {
        if (provider != null) {
            MDC.put(MDC_AUTH_PROVIDER, provider);
        }
    }

    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_AUTH_PROVIDER);
    }
}
