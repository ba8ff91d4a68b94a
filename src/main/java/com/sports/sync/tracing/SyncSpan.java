package com.sports.sync.tracing;

/**
 * A traced unit of synchronization work. Closing the span ends it, so spans are
 * used in try-with-resources blocks:
 * <pre>
 * try (SyncSpan span = tracing.startSynchronization(EntityType.TEAM, 3, 60)) {
 *     span.setAttribute("sync.rows", table.size());
 *     span.succeeded();
 * }
 * </pre>
 */
public interface SyncSpan extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void succeeded();

    void failed(Throwable t);

    @Override
    void close();
}
