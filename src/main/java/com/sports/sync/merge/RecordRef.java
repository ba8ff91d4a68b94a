package com.sports.sync.merge;

import java.util.Comparator;

/**
 * Position of one record in a synchronization call: the provider's position in the
 * input list and the record's position in that provider's content.
 */
public record RecordRef(int provider, int index) implements Comparable<RecordRef> {

    private static final Comparator<RecordRef> ORDER =
            Comparator.comparingInt(RecordRef::provider).thenComparingInt(RecordRef::index);

    public RecordRef {
        if (provider < 0 || index < 0) {
            throw new IllegalArgumentException("provider and index must be non-negative");
        }
    }

    @Override
    public int compareTo(RecordRef other) {
        return ORDER.compare(this, other);
    }
}
