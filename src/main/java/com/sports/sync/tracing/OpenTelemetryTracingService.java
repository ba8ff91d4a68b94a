package com.sports.sync.tracing;

import com.sports.sync.core.model.EntityType;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Synchronization spans carry {@code sync.entity_type}, {@code sync.providers} and
 * {@code sync.records}; pair spans carry the two providers and the engine pass.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public SyncSpan startSynchronization(EntityType type, int providers, int records) {
        Span span = tracer.spanBuilder(SYNCHRONIZE_SPAN)
                .setAttribute("sync.entity_type", type.name())
                .setAttribute("sync.providers", providers)
                .setAttribute("sync.records", records)
                .startSpan();
        return new OTelSyncSpan(span);
    }

    @Override
    public SyncSpan startPair(EntityType type, String leftProvider, String rightProvider, int pass) {
        Span span = tracer.spanBuilder(PAIR_SPAN)
                .setAttribute("sync.entity_type", type.name())
                .setAttribute("sync.left_provider", leftProvider)
                .setAttribute("sync.right_provider", rightProvider)
                .setAttribute("sync.pass", pass)
                .startSpan();
        return new OTelSyncSpan(span);
    }

    private static class OTelSyncSpan implements SyncSpan {

        private final Span span;

        OTelSyncSpan(Span span) {
            this.span = span;
        }

        @Override
        public void setAttribute(String key, String value) {
            span.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            span.setAttribute(key, value);
        }

        @Override
        public void succeeded() {
            span.setStatus(StatusCode.OK);
        }

        @Override
        public void failed(Throwable t) {
            span.recordException(t);
            span.setStatus(StatusCode.ERROR, t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage());
        }

        @Override
        public void close() {
            span.end();
        }
    }
}
