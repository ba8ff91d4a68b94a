package com.sports.sync.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One resolved (or unresolved) entity: an identifier per provider column
 * ({@code {provider}_{type}_id}, null when the provider has no counterpart) plus the
 * context and deduplication columns carried through from the contributing records.
 */
public final class ResultRow {

    private final Map<String, String> identifiers;
    private final Map<String, Object> columns;

    public ResultRow(Map<String, String> identifiers, Map<String, Object> columns) {
        Objects.requireNonNull(identifiers, "identifiers is required");
        if (identifiers.values().stream().allMatch(Objects::isNull)) {
            throw new IllegalArgumentException("A result row needs at least one provider identifier");
        }
        this.identifiers = Collections.unmodifiableMap(new LinkedHashMap<>(identifiers));
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(columns, "columns is required")));
    }

    /**
     * Identifier columns in provider order; values may be null.
     */
    public Map<String, String> getIdentifiers() {
        return identifiers;
    }

    public String getIdentifier(String idColumn) {
        return identifiers.get(idColumn);
    }

    /**
     * Context and deduplication columns carried through from the matched records.
     */
    public Map<String, Object> getColumns() {
        return columns;
    }

    public Object getColumn(String column) {
        return columns.get(column);
    }

    /**
     * Number of providers with a non-null identifier in this row.
     */
    public int providerCount() {
        return (int) identifiers.values().stream().filter(Objects::nonNull).count();
    }

    /**
     * Flat view of the row: identifier columns followed by carried columns.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> flat = new LinkedHashMap<>(identifiers);
        flat.putAll(columns);
        return flat;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResultRow that = (ResultRow) o;
        return identifiers.equals(that.identifiers) && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifiers, columns);
    }

    @Override
    public String toString() {
        return "ResultRow" + asMap();
    }
}
