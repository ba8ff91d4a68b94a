package com.sports.sync.strategy;

import com.sports.sync.core.model.Record;

/**
 * Builds the equality key of a record for an exact-key stage.
 * Returns null when a key column is missing, so the record cannot match in that stage.
 */
@FunctionalInterface
public interface KeyExtractor {

    String key(Record record);

    /**
     * Joins the canonical values of the given columns; null if any of them is null.
     */
    static KeyExtractor ofColumns(String... columns) {
        return record -> join(record, null, columns);
    }

    /**
     * Like {@link #ofColumns}, with {@code dateColumn} compared as a calendar date, so
     * {@code "2024-03-05T20:00:00"} and {@code LocalDate 2024-03-05} share a key.
     * {@code dateColumn} must be one of {@code columns}.
     */
    static KeyExtractor ofColumnsWithDate(String dateColumn, String... columns) {
        return record -> join(record, dateColumn, columns);
    }

    private static String join(Record record, String dateColumn, String[] columns) {
        StringBuilder key = new StringBuilder();
        for (String column : columns) {
            String value = column.equals(dateColumn) ? record.dateKeyValue(column) : record.keyValue(column);
            if (value == null) {
                return null;
            }
            if (key.length() > 0) {
                key.append('\u001F');
            }
            key.append(value);
        }
        return key.toString();
    }
}
