package com.docloom.storage;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Encodes rows as flat JSON objects typed by the table schema: TEXT as string, INTEGER as number,
 * TIMESTAMP as ISO-8601 string. Absent columns are omitted.
 */
final class RowCodec {
    private static final DateTimeFormatter SQLITE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final TableSchema schema;

    RowCodec(TableSchema schema) {
        this.schema = schema;
    }

    ObjectNode encode(Row row, ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        for (Map.Entry<String, ColumnValue> entry : row.values().entrySet()) {
            ColumnValue value = entry.getValue();
            switch (value.type()) {
                case TEXT -> node.put(entry.getKey(), ((ColumnValue.TextValue) value).value());
                case INTEGER -> node.put(entry.getKey(), ((ColumnValue.IntegerValue) value).value());
                case TIMESTAMP -> node.put(entry.getKey(), ((ColumnValue.TimestampValue) value).value().toString());
            }
        }
        return node;
    }

    Row decode(JsonNode node) throws ConversionException {
        if (node == null || !node.isObject()) {
            throw new ConversionException("Stored row in table " + schema.name() + " is not a JSON object");
        }
        Row row = new Row();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNull()) {
                continue;
            }
            Column column = schema.column(field.getKey())
                    .orElseThrow(() -> new ConversionException(
                            "Unknown column " + field.getKey() + " in table " + schema.name()));
            row.put(column.name(), decodeValue(column, field.getValue()));
        }
        schema.validate(row);
        return row;
    }

    private ColumnValue decodeValue(Column column, JsonNode value) throws ConversionException {
        boolean valid = switch (column.type()) {
            case TEXT, TIMESTAMP -> value.isTextual();
            case INTEGER -> value.isIntegralNumber() && value.canConvertToLong();
        };
        if (!valid) {
            throw new ConversionException("Column " + schema.name() + "." + column.name() + " expects "
                    + column.type() + " but stored value is " + value.getNodeType());
        }
        return switch (column.type()) {
            case TEXT -> ColumnValue.text(value.asText());
            case INTEGER -> ColumnValue.integer(value.asLong());
            case TIMESTAMP -> ColumnValue.timestamp(parseTimestamp(value.asText()));
        };
    }

    static Instant parseTimestamp(String raw) throws ConversionException {
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException iso) {
            try {
                return LocalDateTime.parse(raw, SQLITE_TIMESTAMP).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException sqlite) {
                throw new ConversionException("Invalid timestamp '" + raw + "'", sqlite);
            }
        }
    }
}
