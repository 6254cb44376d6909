package com.docloom.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * Closed set of values a column can hold. Each variant carries exactly one storage primitive.
 */
public interface ColumnValue {

    ColumnType type();

    String keyString();

    default String asText() throws ConversionException {
        throw mismatch(ColumnType.TEXT);
    }

    default long asInteger() throws ConversionException {
        throw mismatch(ColumnType.INTEGER);
    }

    default Instant asTimestamp() throws ConversionException {
        throw mismatch(ColumnType.TIMESTAMP);
    }

    private ConversionException mismatch(ColumnType expected) {
        return new ConversionException("Expected " + expected + " value but found " + type());
    }

    static ColumnValue text(String value) {
        return new TextValue(value);
    }

    static ColumnValue integer(long value) {
        return new IntegerValue(value);
    }

    static ColumnValue timestamp(Instant value) {
        return new TimestampValue(value);
    }

    record TextValue(String value) implements ColumnValue {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ColumnType type() {
            return ColumnType.TEXT;
        }

        @Override
        public String keyString() {
            return value;
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record IntegerValue(long value) implements ColumnValue {
        @Override
        public ColumnType type() {
            return ColumnType.INTEGER;
        }

        @Override
        public String keyString() {
            return Long.toString(value);
        }

        @Override
        public long asInteger() {
            return value;
        }
    }

    record TimestampValue(Instant value) implements ColumnValue {
        public TimestampValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ColumnType type() {
            return ColumnType.TIMESTAMP;
        }

        @Override
        public String keyString() {
            return value.toString();
        }

        @Override
        public Instant asTimestamp() {
            return value;
        }
    }
}
