package com.sports.sync.tracing;

import com.sports.sync.core.model.EntityType;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
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
                try (SyncSpan span = noOp.startSynchronization(EntityType.TEAM, 3, 60)) {
                    span.setAttribute("key", "value");
                    span.setAttribute("count", 42L);
                    span.succeeded();
                    span.failed(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertSame(noOp.startSynchronization(EntityType.TEAM, 1, 1),
                    noOp.startPair(EntityType.TEAM, "opta", "statsbomb", 1));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    @ExtendWith(MockitoExtension.class)
    class OTelTests {

        @Mock
        private Tracer mockTracer;
        @Mock
        private SpanBuilder mockBuilder;
        @Mock
        private Span mockOtelSpan;

        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            when(mockTracer.spanBuilder(anyString())).thenReturn(mockBuilder);
            when(mockBuilder.setAttribute(anyString(), anyString())).thenReturn(mockBuilder);
            when(mockBuilder.setAttribute(anyString(), anyLong())).thenReturn(mockBuilder);
            when(mockBuilder.startSpan()).thenReturn(mockOtelSpan);

            service = new OpenTelemetryTracingService(mockTracer);
        }

        @Test
        @DisplayName("Should create synchronization span with entity type and sizes")
        void synchronizationSpan() {
            SyncSpan span = service.startSynchronization(EntityType.PLAYER, 3, 75);

            assertNotNull(span);
            verify(mockTracer).spanBuilder(TracingService.SYNCHRONIZE_SPAN);
            verify(mockBuilder).setAttribute("sync.entity_type", "PLAYER");
            verify(mockBuilder).setAttribute("sync.providers", 3L);
            verify(mockBuilder).setAttribute("sync.records", 75L);
            verify(mockBuilder).startSpan();
        }

        @Test
        @DisplayName("Should create pair span with both providers and the pass")
        void pairSpan() {
            service.startPair(EntityType.TEAM, "opta", "statsbomb", 2);

            verify(mockTracer).spanBuilder(TracingService.PAIR_SPAN);
            verify(mockBuilder).setAttribute("sync.left_provider", "opta");
            verify(mockBuilder).setAttribute("sync.right_provider", "statsbomb");
            verify(mockBuilder).setAttribute("sync.pass", 2L);
        }

        @Test
        @DisplayName("Should set attributes on span")
        void setAttributes() {
            SyncSpan span = service.startSynchronization(EntityType.TEAM, 2, 4);
            span.setAttribute("key", "value");
            span.setAttribute("sync.rows", 42L);

            verify(mockOtelSpan).setAttribute("key", "value");
            verify(mockOtelSpan).setAttribute("sync.rows", 42L);
        }

        @Test
        @DisplayName("Should record failures with error status")
        void failed() {
            SyncSpan span = service.startSynchronization(EntityType.TEAM, 2, 4);
            RuntimeException ex = new RuntimeException("test error");

            span.failed(ex);

            verify(mockOtelSpan).recordException(ex);
            verify(mockOtelSpan).setStatus(StatusCode.ERROR, "test error");
        }

        @Test
        @DisplayName("Should set OK status and end span on close")
        void succeededAndClose() {
            try (SyncSpan span = service.startSynchronization(EntityType.TEAM, 2, 4)) {
                span.succeeded();
            }

            verify(mockOtelSpan).setStatus(StatusCode.OK);
            verify(mockOtelSpan).end();
        }
    }
}
