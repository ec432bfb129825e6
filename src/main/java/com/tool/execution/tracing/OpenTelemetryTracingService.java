package com.tool.execution.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * Emits one INTERNAL span per tool invocation through the OpenTelemetry API.
 *
 * <p>State transitions become span events named after the state. A failed invocation
 * ends with status ERROR and the error code as the status description.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_SCOPE = "com.tool.execution";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    public static OpenTelemetryTracingService fromOpenTelemetry(OpenTelemetry openTelemetry) {
        return new OpenTelemetryTracingService(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, null);
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach((key, value) -> {
                if (value != null) {
                    builder.setAttribute(key, value);
                }
            });
        }
        return new InvocationSpan(builder.startSpan());
    }

    private static final class InvocationSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        InvocationSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            if (value != null) {
                delegate.setAttribute(key, value);
            }
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, boolean value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void addEvent(String name) {
            delegate.addEvent(name);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void setStatus(SpanStatus status, String description) {
            if (status == SpanStatus.ERROR && description != null) {
                delegate.setStatus(StatusCode.ERROR, description);
            } else {
                setStatus(status);
            }
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
