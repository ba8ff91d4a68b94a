package com.sports.sync.core.model;

import com.sports.sync.core.SyncConfigurationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One provider's records for one group (a match, a competition season, ...),
 * tagged with the provider label and the entity type being synchronized.
 *
 * <p>Every record carries its own identifier in {@link #idField()}, e.g.
 * {@code opta_player_id} for provider {@code opta} and type {@link EntityType#PLAYER}.
 * Instances are immutable; {@link #merge} and {@link #append} return new contents.</p>
 */
public final class SyncableContent {

    private static final Set<String> PROVIDER_COLUMNS = Set.of("data_provider", "provider");

    private final EntityType entityType;
    private final String provider;
    private final List<Record> records;

    public SyncableContent(EntityType entityType, String provider, List<Record> records) {
        this.entityType = Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(provider, "provider is required");
        if (provider.isBlank()) {
            throw new IllegalArgumentException("provider must not be blank");
        }
        this.provider = provider;
        this.records = List.copyOf(Objects.requireNonNull(records, "records is required"));
    }

    /**
     * Builds content from records that use a unified schema: a provider-agnostic
     * identifier column ({@code provider_team_id}) plus a {@code data_provider} or
     * {@code provider} column. The identifier column is renamed to this provider's
     * {@link #idField()} and the provider column is dropped. Records that do not
     * use the unified schema are kept as they are.
     */
    public static SyncableContent fromUnifiedSchema(EntityType entityType, String provider, List<Record> records) {
        String unifiedId = entityType.unifiedIdField();
        String idField = entityType.idField(provider);
        List<Record> converted = new ArrayList<>(records.size());
        for (Record record : records) {
            boolean hasProviderColumn = record.fieldNames().stream().anyMatch(PROVIDER_COLUMNS::contains);
            if (hasProviderColumn && record.hasField(unifiedId)) {
                Record cleaned = record.rename(unifiedId, idField);
                for (String column : PROVIDER_COLUMNS) {
                    cleaned = cleaned.without(column);
                }
                converted.add(cleaned);
            } else {
                converted.add(record);
            }
        }
        return new SyncableContent(entityType, provider, converted);
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getProvider() {
        return provider;
    }

    public List<Record> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Identifier column of this provider, e.g. {@code statsbomb_match_id}.
     */
    public String idField() {
        return entityType.idField(provider);
    }

    /**
     * Canonical identifier of a record of this content.
     */
    public String identifierOf(Record record) {
        return record.keyValue(idField());
    }

    /**
     * Left-joins the identifier columns of {@code right} onto this content's records,
     * using {@code right}'s identifier column as the join key. Only columns holding
     * identifiers of this entity type are copied; existing non-null values win.
     * Records without a counterpart in {@code right} receive null identifiers.
     *
     * @throws SyncConfigurationException if the entity types differ or the join column is missing
     */
    public SyncableContent merge(SyncableContent right) {
        Objects.requireNonNull(right, "right is required");
        if (right.entityType != entityType) {
            throw new SyncConfigurationException("Cannot merge " + right.entityType
                    + " content into " + entityType + " content");
        }
        String joinField = right.idField();
        for (Record record : records) {
            if (!record.hasField(joinField)) {
                throw new SyncConfigurationException("Join column '" + joinField
                        + "' of provider " + right.provider + " is missing from content of provider " + provider);
            }
        }

        Set<String> idColumns = new LinkedHashSet<>();
        Map<String, Record> rightById = new HashMap<>();
        for (Record record : right.records) {
            record.fieldNames().stream().filter(entityType::isIdField).forEach(idColumns::add);
            String id = record.keyValue(joinField);
            if (id != null) {
                rightById.putIfAbsent(id, record);
            }
        }
        if (idColumns.isEmpty()) {
            throw new SyncConfigurationException("Content of provider " + right.provider
                    + " has no " + entityType.getKey() + " identifier columns");
        }

        List<Record> merged = new ArrayList<>(records.size());
        for (Record record : records) {
            String joinId = record.keyValue(joinField);
            Record match = joinId == null ? null : rightById.get(joinId);
            Record result = record;
            for (String column : idColumns) {
                if (result.get(column) == null) {
                    result = result.with(column, match == null ? null : match.get(column));
                }
            }
            merged.add(result);
        }
        return new SyncableContent(entityType, provider, merged);
    }

    /**
     * Returns new content with the records of {@code right} appended. A null
     * {@code right} returns this content unchanged.
     *
     * @throws SyncConfigurationException if the entity types differ
     */
    public SyncableContent append(SyncableContent right) {
        if (right == null) {
            return this;
        }
        if (right.entityType != entityType) {
            throw new SyncConfigurationException("Cannot append " + right.entityType
                    + " content to " + entityType + " content");
        }
        return append(right.records);
    }

    public SyncableContent append(List<Record> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        List<Record> combined = new ArrayList<>(records);
        combined.addAll(extra);
        return new SyncableContent(entityType, provider, combined);
    }

    @Override
    public String toString() {
        return "SyncableContent{" +
                "entityType=" + entityType +
                ", provider='" + provider + '\'' +
                ", records=" + records.size() +
                '}';
    }
}
