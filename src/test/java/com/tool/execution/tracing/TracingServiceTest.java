package com.tool.execution.tracing;

import com.tool.execution.core.model.ToolDescriptor;
import com.tool.execution.engine.ToolEngine;
import com.tool.execution.registry.ToolRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan("tool.invoke", Map.of("tool.name", "echo"))) {
                    span.setAttribute("tool.attempts", 2L);
                    span.setAttribute("tool.from_cache", true);
                    span.addEvent("VALIDATED");
                    span.setStatus(Span.SpanStatus.OK);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertSame(noOp.startSpan("op1"), noOp.startSpan("op2"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer mockTracer;
        private SpanBuilder mockBuilder;
        private io.opentelemetry.api.trace.Span mockOtelSpan;

        @BeforeEach
        void setUp() {
            mockTracer = mock(Tracer.class);
            mockBuilder = mock(SpanBuilder.class);
            mockOtelSpan = mock(io.opentelemetry.api.trace.Span.class);

            when(mockTracer.spanBuilder(anyString())).thenReturn(mockBuilder);
            when(mockBuilder.setSpanKind(any(SpanKind.class))).thenReturn(mockBuilder);
            when(mockBuilder.setAttribute(anyString(), anyString())).thenReturn(mockBuilder);
            when(mockBuilder.startSpan()).thenReturn(mockOtelSpan);
        }

        @Test
        @DisplayName("Should create an internal span with the initial attributes")
        void createSpan() {
            OpenTelemetryTracingService service = new OpenTelemetryTracingService(mockTracer);

            Span span = service.startSpan("tool.invoke", Map.of("tool.name", "echo"));

            assertNotNull(span);
            verify(mockTracer).spanBuilder("tool.invoke");
            verify(mockBuilder).setSpanKind(SpanKind.INTERNAL);
            verify(mockBuilder).setAttribute("tool.name", "echo");
            verify(mockBuilder).startSpan();
        }

        @Test
        @DisplayName("Should forward attributes, events, status and exceptions")
        void forwardsCalls() {
            OpenTelemetryTracingService service = new OpenTelemetryTracingService(mockTracer);
            Span span = service.startSpan("tool.invoke");
            RuntimeException ex = new RuntimeException("boom");

            span.setAttribute("tool.error_code", "TIMEOUT");
            span.setAttribute("tool.attempts", 3L);
            span.setAttribute("tool.from_cache", false);
            span.addEvent("DISPATCHING");
            span.recordException(ex);
            span.setStatus(Span.SpanStatus.ERROR);
            span.close();

            verify(mockOtelSpan).setAttribute("tool.error_code", "TIMEOUT");
            verify(mockOtelSpan).setAttribute("tool.attempts", 3L);
            verify(mockOtelSpan).setAttribute("tool.from_cache", false);
            verify(mockOtelSpan).addEvent("DISPATCHING");
            verify(mockOtelSpan).recordException(ex);
            verify(mockOtelSpan).setStatus(StatusCode.ERROR);
            verify(mockOtelSpan).end();
        }

        @Test
        @DisplayName("Engine emits one event per state and ends the span once")
        void engineSpan() {
            ToolRegistry registry = new ToolRegistry();
            registry.register(ToolDescriptor.builder().name("echo").build(), args -> "hi");

            try (ToolEngine engine = ToolEngine.builder()
                    .registry(registry)
                    .tracingService(new OpenTelemetryTracingService(mockTracer))
                    .build()) {
                engine.invoke("echo", Map.of());
            }

            verify(mockOtelSpan).addEvent("RECEIVED");
            verify(mockOtelSpan).addEvent("DISPATCHING");
            verify(mockOtelSpan).addEvent("SUCCEEDED");
            verify(mockOtelSpan).setStatus(StatusCode.OK);
            verify(mockOtelSpan, times(1)).end();
        }

        @Test
        @DisplayName("A failed invocation carries its error code as the status description")
        void failedInvocationSpan() {
            try (ToolEngine engine = ToolEngine.builder()
                    .registry(new ToolRegistry())
                    .tracingService(new OpenTelemetryTracingService(mockTracer))
                    .build()) {
                engine.invoke("missing", Map.of());
            }

            verify(mockOtelSpan).addEvent("FAILED");
            verify(mockOtelSpan).setAttribute("tool.error_code", "NOT_FOUND");
            verify(mockOtelSpan).setStatus(StatusCode.ERROR, "NOT_FOUND");
            verify(mockOtelSpan, never()).setStatus(StatusCode.OK);
            verify(mockOtelSpan, times(1)).end();
        }

        @Test
        @DisplayName("Null attribute values are left off the span")
        void nullAttributesSkipped() {
            OpenTelemetryTracingService service = new OpenTelemetryTracingService(mockTracer);
            Map<String, String> attributes = new HashMap<>();
            attributes.put("tool.name", "echo");
            attributes.put("tool.request_id", null);

            Span span = service.startSpan("tool.invoke", attributes);
            span.setAttribute("tool.error_code", (String) null);

            verify(mockBuilder).setAttribute("tool.name", "echo");
            verify(mockBuilder, never()).setAttribute(eq("tool.request_id"), anyString());
            verify(mockOtelSpan, never()).setAttribute(anyString(), anyString());
        }

        @Test
        @DisplayName("fromOpenTelemetry uses the engine's instrumentation scope")
        void fromOpenTelemetry() {
            OpenTelemetry openTelemetry = mock(OpenTelemetry.class);
            when(openTelemetry.getTracer(OpenTelemetryTracingService.INSTRUMENTATION_SCOPE)).thenReturn(mockTracer);

            OpenTelemetryTracingService.fromOpenTelemetry(openTelemetry).startSpan("tool.invoke");

            verify(openTelemetry).getTracer("com.tool.execution");
            verify(mockTracer).spanBuilder("tool.invoke");
        }
    }
}
