package com.sports.sync.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered rows produced by one synchronization call. Identifier columns follow
 * the input provider order. Not persisted; ownership passes to the caller.
 */
public final class ResultTable {

    private final EntityType entityType;
    private final List<String> providers;
    private final List<ResultRow> rows;

    public ResultTable(EntityType entityType, List<String> providers, List<ResultRow> rows) {
        this.entityType = Objects.requireNonNull(entityType, "entityType is required");
        this.providers = List.copyOf(providers);
        this.rows = List.copyOf(rows);
    }

    public static ResultTable empty(EntityType entityType) {
        return new ResultTable(entityType, List.of(), List.of());
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public List<String> getProviders() {
        return providers;
    }

    public List<ResultRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Identifier columns in provider order.
     */
    public List<String> idColumns() {
        return providers.stream().map(entityType::idField).toList();
    }

    /**
     * Finds the row holding the given identifier for the given provider.
     */
    public Optional<ResultRow> findByIdentifier(String provider, String identifier) {
        String column = entityType.idField(provider);
        return rows.stream()
                .filter(row -> Objects.equals(row.getIdentifier(column), identifier))
                .findFirst();
    }

    /**
     * All non-null identifiers of one provider, in row order.
     */
    public List<String> identifiersFor(String provider) {
        String column = entityType.idField(provider);
        return rows.stream()
                .map(row -> row.getIdentifier(column))
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Rows in which every provider has an identifier.
     */
    public List<ResultRow> fullyResolvedRows() {
        return rows.stream()
                .filter(row -> row.providerCount() == providers.size())
                .toList();
    }

    @Override
    public String toString() {
        return "ResultTable{" +
                "entityType=" + entityType +
                ", providers=" + providers +
                ", rows=" + rows.size() +
                '}';
    }
}
