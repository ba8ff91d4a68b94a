package com.sports.sync.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One entity instance as reported by one provider: an ordered mapping from field
 * name to value. Values are strings, {@link LocalDate}s, numbers or null.
 * Instances are immutable; the {@code with}/{@code without} methods return copies.
 */
public final class Record {

    private static final Pattern INTEGRAL_NUMBER = Pattern.compile("-?\\d+(\\.0+)?");

    private final Map<String, Object> fields;

    private Record(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Creates a record from alternating field names and values.
     */
    public static Record of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected alternating field names and values");
        }
        Builder builder = builder();
        for (int i = 0; i < keyValues.length; i += 2) {
            builder.put((String) keyValues[i], keyValues[i + 1]);
        }
        return builder.build();
    }

    public static Record fromMap(Map<String, ?> values) {
        Objects.requireNonNull(values, "values is required");
        return new Record(new LinkedHashMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasField(String field) {
        return fields.containsKey(field);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    /**
     * Returns the value as a trimmed string, or null when absent or blank.
     */
    public String getString(String field) {
        Object value = fields.get(field);
        if (value == null || isNaN(value)) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Returns the value as a date. Accepts {@link LocalDate} values and ISO
     * {@code yyyy-MM-dd} strings (a trailing time part is ignored).
     *
     * @throws IllegalArgumentException if the value cannot be read as a date
     */
    public LocalDate getDate(String field) {
        Object value = fields.get(field);
        if (value == null || isNaN(value)) {
            return null;
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.length() > 10 && text.charAt(10) == 'T') {
            text = text.substring(0, 10);
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Field '" + field + "' is not an ISO date: '" + value + "'", e);
        }
    }

    /**
     * Key form of a date column: the ISO date, whether the value was a {@link LocalDate}
     * or a string with a trailing time part.
     *
     * @throws IllegalArgumentException if the value cannot be read as a date
     */
    public String dateKeyValue(String field) {
        LocalDate date = getDate(field);
        return date == null ? null : date.toString();
    }

    /**
     * Canonical form used for key equality. Integral numbers and numeric strings
     * collapse to the same text ({@code 10}, {@code 10L}, {@code "10"}, {@code "10.0"}),
     * dates use ISO form and blank strings are treated as missing. {@code NaN} counts
     * as missing.
     *
     * @throws IllegalArgumentException for infinite numbers
     */
    public String keyValue(String field) {
        Object value = fields.get(field);
        if (value == null || isNaN(value)) {
            return null;
        }
        if (isInfinite(value)) {
            throw new IllegalArgumentException("Field '" + field + "' holds an infinite number: " + value);
        }
        if (value instanceof LocalDate date) {
            return date.toString();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Number number) {
            BigDecimal decimal = new BigDecimal(number.toString()).stripTrailingZeros();
            return decimal.scale() <= 0 ? decimal.toBigInteger().toString() : decimal.toPlainString();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (INTEGRAL_NUMBER.matcher(text).matches()) {
            int dot = text.indexOf('.');
            return dot < 0 ? text : text.substring(0, dot);
        }
        return text;
    }

    private static boolean isNaN(Object value) {
        return (value instanceof Double d && d.isNaN()) || (value instanceof Float f && f.isNaN());
    }

    /**
     * True for infinite floating point values, which no key can be built from.
     */
    public static boolean isInfinite(Object value) {
        return (value instanceof Double d && d.isInfinite()) || (value instanceof Float f && f.isInfinite());
    }

    public Record with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new Record(copy);
    }

    public Record without(String field) {
        if (!fields.containsKey(field)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.remove(field);
        return new Record(copy);
    }

    /**
     * Returns a copy with {@code oldName} renamed to {@code newName}, keeping field order.
     */
    public Record rename(String oldName, String newName) {
        if (!fields.containsKey(oldName)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((k, v) -> copy.put(k.equals(oldName) ? newName : k, v));
        return new Record(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Record record = (Record) o;
        return fields.equals(record.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Record" + fields;
    }

    public static class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        public Builder put(String field, Object value) {
            Objects.requireNonNull(field, "field name is required");
            fields.put(field, value);
            return this;
        }

        public Record build() {
            return new Record(new LinkedHashMap<>(fields));
        }
    }
}
