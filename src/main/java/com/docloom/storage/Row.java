package com.docloom.storage;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Column name to value. An absent column is a SQL {@code NULL}.
 */
public final class Row {
    private final Map<String, ColumnValue> values = new LinkedHashMap<>();

    public Row put(String column, ColumnValue value) {
        values.put(Objects.requireNonNull(column, "column"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public Row putText(String column, String value) {
        return value == null ? this : put(column, ColumnValue.text(value));
    }

    public Row putInteger(String column, long value) {
        return put(column, ColumnValue.integer(value));
    }

    public Row putTimestamp(String column, Instant value) {
        return value == null ? this : put(column, ColumnValue.timestamp(value));
    }

    public Optional<ColumnValue> get(String column) {
        return Optional.ofNullable(values.get(column));
    }

    public String text(String column) throws ConversionException {
        return require(column).asText();
    }

    public String optionalText(String column) throws ConversionException {
        ColumnValue value = values.get(column);
        return value == null ? null : value.asText();
    }

    public long integer(String column) throws ConversionException {
        return require(column).asInteger();
    }

    public Instant optionalTimestamp(String column) throws ConversionException {
        ColumnValue value = values.get(column);
        return value == null ? null : value.asTimestamp();
    }

    public Map<String, ColumnValue> values() {
        return Collections.unmodifiableMap(values);
    }

    private ColumnValue require(String column) throws ConversionException {
        ColumnValue value = values.get(column);
        if (value == null) {
            throw new ConversionException("Missing value for column " + column);
        }
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Row)) {
            return false;
        }
        return values.equals(((Row) other).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
