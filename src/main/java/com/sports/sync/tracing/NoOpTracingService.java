package com.sports.sync.tracing;

import com.sports.sync.core.model.EntityType;

/**
 * No-op implementation of {@link TracingService}; every call returns the same inert span.
 */
public class NoOpTracingService implements TracingService {

    private static final SyncSpan NO_OP_SPAN = new NoOpSpan();

    @Override
    public SyncSpan startSynchronization(EntityType type, int providers, int records) {
        return NO_OP_SPAN;
    }

    @Override
    public SyncSpan startPair(EntityType type, String leftProvider, String rightProvider, int pass) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements SyncSpan {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void succeeded() {
        }

        @Override
        public void failed(Throwable t) {
        }

        @Override
        public void close() {
        }
    }
}
