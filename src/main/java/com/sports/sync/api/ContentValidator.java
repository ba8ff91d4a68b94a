package com.sports.sync.api;

import com.sports.sync.core.SyncConfigurationException;
import com.sports.sync.core.model.EntityType;
import com.sports.sync.core.model.Record;
import com.sports.sync.core.model.SyncableContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fail-fast checks run before any matching starts.
 */
class ContentValidator {
    private static final Logger log = LoggerFactory.getLogger(ContentValidator.class);

    private final EntityType entityType;
    private final List<String> requiredColumns;

    ContentValidator(EntityType entityType, boolean useCompetitionContext) {
        this.entityType = entityType;
        this.requiredColumns = entityType.requiredColumns(useCompetitionContext);
    }

    /**
     * @throws SyncConfigurationException on the first problem found
     */
    void validate(List<SyncableContent> contents) {
        Set<String> providers = new HashSet<>();
        for (SyncableContent content : contents) {
            if (content == null) {
                throw new SyncConfigurationException("Content list must not contain null entries");
            }
            if (content.getEntityType() != entityType) {
                throw new SyncConfigurationException("Content of provider " + content.getProvider()
                        + " is " + content.getEntityType() + " but this engine synchronizes " + entityType);
            }
            if (!providers.add(content.getProvider())) {
                throw new SyncConfigurationException("Duplicate provider tag: " + content.getProvider());
            }
            validateRecords(content);
        }
    }

    private void validateRecords(SyncableContent content) {
        String idField = content.idField();
        Set<String> seen = new HashSet<>();
        List<Record> records = content.getRecords();
        for (int i = 0; i < records.size(); i++) {
            Record record = records.get(i);
            for (Map.Entry<String, Object> field : record.asMap().entrySet()) {
                if (Record.isInfinite(field.getValue())) {
                    throw new SyncConfigurationException("Infinite value in column '" + field.getKey()
                            + "' of record " + i + " of provider " + content.getProvider());
                }
            }
            for (String column : requiredColumns) {
                if (!record.hasField(column)) {
                    throw new SyncConfigurationException("Missing required column '" + column
                            + "' in content of provider " + content.getProvider() + " (record " + i + ")");
                }
            }
            String id = content.identifierOf(record);
            if (id == null) {
                throw new SyncConfigurationException("Record " + i + " of provider " + content.getProvider()
                        + " has no identifier in column '" + idField + "'");
            }
            if (!seen.add(id)) {
                log.warn("Provider {} lists {} '{}' more than once", content.getProvider(), idField, id);
            }
            for (String column : EntityType.DATE_COLUMNS) {
                if (record.hasField(column)) {
                    try {
                        record.getDate(column);
                    } catch (IllegalArgumentException e) {
                        throw new SyncConfigurationException("Unreadable " + column + " in record " + i
                                + " of provider " + content.getProvider(), e);
                    }
                }
            }
        }
    }
}
