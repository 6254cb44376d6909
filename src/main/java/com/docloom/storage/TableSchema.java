package com.docloom.storage;

import java.util.List;
import java.util.Optional;

/**
 * Persisted shape of one entity kind: primary key {@code id}, the columns indexed for equality
 * lookup, and the single column used as embedding input (null when the entity has none).
 */
public record TableSchema(String name, List<Column> columns, String embeddingColumn) {

    public static final String ID = "id";

    public TableSchema {
        columns = List.copyOf(columns);
        List<Column> keys = columns.stream().filter(Column::primaryKey).toList();
        if (keys.size() != 1 || !ID.equals(keys.get(0).name())) {
            throw new IllegalArgumentException("Table " + name + " must declare exactly one primary key named '" + ID + "'");
        }
        long distinct = columns.stream().map(Column::name).distinct().count();
        if (distinct != columns.size()) {
            throw new IllegalArgumentException("Table " + name + " declares duplicate columns");
        }
        if (embeddingColumn != null) {
            Column embedded = columns.stream()
                    .filter(column -> column.name().equals(embeddingColumn))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Embedding column " + embeddingColumn + " is not declared in table " + name));
            if (embedded.type() != ColumnType.TEXT) {
                throw new IllegalArgumentException("Embedding column " + embeddingColumn + " must be TEXT");
            }
        }
    }

    public Optional<Column> column(String columnName) {
        return columns.stream().filter(column -> column.name().equals(columnName)).findFirst();
    }

    public Column primaryKey() {
        return column(ID).orElseThrow();
    }

    public List<Column> indexedColumns() {
        return columns.stream().filter(Column::indexed).toList();
    }

    public boolean hasEmbedding() {
        return embeddingColumn != null;
    }

    public void validate(Row row) throws ConversionException {
        for (String columnName : row.values().keySet()) {
            if (column(columnName).isEmpty()) {
                throw new ConversionException("Column " + columnName + " is not part of table " + name);
            }
        }
        for (Column column : columns) {
            Optional<ColumnValue> value = row.get(column.name());
            if (value.isEmpty()) {
                if (!column.nullable()) {
                    throw new ConversionException("Column " + name + "." + column.name() + " must not be null");
                }
                continue;
            }
            if (value.get().type() != column.type()) {
                throw new ConversionException("Column " + name + "." + column.name() + " expects " + column.type()
                        + " but got " + value.get().type());
            }
        }
    }
}
