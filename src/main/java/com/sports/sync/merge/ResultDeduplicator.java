package com.sports.sync.merge;

import com.sports.sync.core.model.EntityType;
import com.sports.sync.core.model.Record;
import com.sports.sync.core.model.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses result rows that describe the same entity.
 *
 * <p>Rows are grouped by the values of the deduplication columns, date columns
 * compared as calendar dates. A row with a null
 * value in any of those columns never joins a group. Inside a group, rows are folded
 * together taking the first non-null identifier per provider column, but only when
 * they do not carry different identifiers for the same provider; a conflicting row
 * starts its own entry. Output keeps the position of each entry's first row.</p>
 */
public class ResultDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(ResultDeduplicator.class);

    private final List<String> deduplicationColumns;

    public ResultDeduplicator(List<String> deduplicationColumns) {
        this.deduplicationColumns = List.copyOf(deduplicationColumns);
    }

    public List<String> getDeduplicationColumns() {
        return deduplicationColumns;
    }

    public List<ResultRow> deduplicate(List<ResultRow> rows) {
        List<Entry> entries = new ArrayList<>();
        Map<List<String>, List<Entry>> groups = new LinkedHashMap<>();

        for (ResultRow row : rows) {
            List<String> key = groupKey(row);
            if (key == null) {
                entries.add(new Entry(row));
                continue;
            }
            List<Entry> group = groups.computeIfAbsent(key, k -> new ArrayList<>());
            Entry target = null;
            for (Entry candidate : group) {
                if (candidate.compatibleWith(row)) {
                    target = candidate;
                    break;
                }
            }
            if (target == null) {
                Entry entry = new Entry(row);
                group.add(entry);
                entries.add(entry);
            } else {
                target.absorb(row);
            }
        }

        List<ResultRow> result = entries.stream().map(Entry::toRow).toList();
        if (result.size() < rows.size()) {
            log.debug("Deduplication on {} collapsed {} rows into {}",
                    deduplicationColumns, rows.size(), result.size());
        }
        return result;
    }

    private List<String> groupKey(ResultRow row) {
        if (deduplicationColumns.isEmpty()) {
            return null;
        }
        Record values = Record.fromMap(row.getColumns());
        List<String> key = new ArrayList<>(deduplicationColumns.size());
        for (String column : deduplicationColumns) {
            String value = EntityType.DATE_COLUMNS.contains(column)
                    ? values.dateKeyValue(column) : values.keyValue(column);
            if (value == null) {
                return null;
            }
            key.add(value);
        }
        return key;
    }

    private static final class Entry {
        private final Map<String, String> identifiers;
        private final Map<String, Object> columns;

        private Entry(ResultRow row) {
            this.identifiers = new LinkedHashMap<>(row.getIdentifiers());
            this.columns = new LinkedHashMap<>(row.getColumns());
        }

        private boolean compatibleWith(ResultRow row) {
            for (Map.Entry<String, String> id : row.getIdentifiers().entrySet()) {
                String existing = identifiers.get(id.getKey());
                if (existing != null && id.getValue() != null && !existing.equals(id.getValue())) {
                    return false;
                }
            }
            return true;
        }

        private void absorb(ResultRow row) {
            row.getIdentifiers().forEach((column, value) -> {
                if (identifiers.get(column) == null) {
                    identifiers.put(column, value);
                }
            });
            row.getColumns().forEach((column, value) -> {
                if (columns.get(column) == null) {
                    columns.put(column, value);
                }
            });
        }

        private ResultRow toRow() {
            return new ResultRow(identifiers, columns);
        }
    }

    @Override
    public String toString() {
        return "ResultDeduplicator{columns=" + deduplicationColumns + '}';
    }
}
