package com.docloom.model;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Unit of ingestion. Only {@code content} is fed to embedding; {@code metadata} keeps the original
 * provider payload so new fields never need a schema migration.
 */
public record Document(
        String id,
        String sourceId,
        String content,
        Instant createdAt,
        JsonNode metadata) {

    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceId, "sourceId");
        content = content == null ? "" : content;
    }
}
