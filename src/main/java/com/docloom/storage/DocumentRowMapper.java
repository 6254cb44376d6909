package com.docloom.storage;

import java.util.List;

import com.docloom.model.Document;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class DocumentRowMapper implements RowMapper<Document> {
    public static final String SOURCE_ID = "source_id";
    public static final String CONTENT = "content";
    public static final String CREATED_AT = "created_at";
    public static final String METADATA = "metadata";

    private static final TableSchema SCHEMA = new TableSchema("documents", List.of(
            Column.primaryKey(TableSchema.ID, ColumnType.TEXT),
            Column.required(SOURCE_ID, ColumnType.TEXT).withIndex(),
            Column.required(CONTENT, ColumnType.TEXT),
            Column.optional(CREATED_AT, ColumnType.TIMESTAMP),
            Column.optional(METADATA, ColumnType.TEXT)),
            CONTENT);

    private final ObjectMapper objectMapper;

    public DocumentRowMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public TableSchema schema() {
        return SCHEMA;
    }

    @Override
    public Row toRow(Document document) {
        return new Row()
                .putText(TableSchema.ID, document.id())
                .putText(SOURCE_ID, document.sourceId())
                .putText(CONTENT, document.content())
                .putTimestamp(CREATED_AT, document.createdAt())
                .putText(METADATA, document.metadata() == null ? null : writeMetadata(document));
    }

    @Override
    public Document fromRow(Row row) throws ConversionException {
        String metadata = row.optionalText(METADATA);
        JsonNode parsed = null;
        if (metadata != null) {
            try {
                parsed = objectMapper.readTree(metadata);
            } catch (JsonProcessingException e) {
                throw new ConversionException("Invalid metadata JSON for document " + row.optionalText(TableSchema.ID), e);
            }
        }
        return new Document(
                row.text(TableSchema.ID),
                row.text(SOURCE_ID),
                row.text(CONTENT),
                row.optionalTimestamp(CREATED_AT),
                parsed);
    }

    private String writeMetadata(Document document) {
        try {
            return objectMapper.writeValueAsString(document.metadata());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Metadata of document " + document.id() + " is not serializable", e);
        }
    }
}
