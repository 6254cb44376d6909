package com.docloom.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON-file table keyed by primary key. Rows carry the embedding of the schema's embedding column;
 * every other column is stored alongside as retrievable metadata. Writes are upserts.
 */
public class VectorTable<T> {
    private static final Logger log = LoggerFactory.getLogger(VectorTable.class);

    private final Path path;
    private final RowMapper<T> mapper;
    private final RowCodec codec;
    private final EmbeddingService embeddingService;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, StoredRow> rows = new LinkedHashMap<>();

    private VectorTable(Path path, RowMapper<T> mapper, EmbeddingService embeddingService) {
        this.path = path;
        this.mapper = mapper;
        this.codec = new RowCodec(mapper.schema());
        this.embeddingService = embeddingService;
    }

    public static <T> VectorTable<T> open(Path path, RowMapper<T> mapper, EmbeddingService embeddingService)
            throws StorageException {
        VectorTable<T> table = new VectorTable<>(path, mapper, embeddingService);
        table.load();
        return table;
    }

    public TableSchema schema() {
        return mapper.schema();
    }

    /**
     * Validates and embeds the whole batch before applying any of it; a failing entity leaves the
     * table unchanged.
     */
    public synchronized int upsert(Iterable<T> entities) throws StorageException {
        Map<String, StoredRow> staged = new LinkedHashMap<>();
        for (T entity : entities) {
            Row row = mapper.toRow(entity);
            try {
                schema().validate(row);
            } catch (ConversionException e) {
                throw new StorageException("Row rejected by table " + schema().name() + ": " + e.getMessage(), e);
            }
            String key = row.get(TableSchema.ID).orElseThrow().keyString();
            staged.put(key, new StoredRow(row, embed(key, row), embeddingService.version()));
        }
        rows.putAll(staged);
        return staged.size();
    }

    public synchronized Optional<T> get(ColumnValue id) throws ConversionException {
        StoredRow stored = rows.get(id.keyString());
        return stored == null ? Optional.empty() : Optional.of(mapper.fromRow(stored.row()));
    }

    public synchronized List<T> findBy(String column, ColumnValue value) throws ConversionException {
        requireIndexed(column);
        List<T> out = new ArrayList<>();
        for (StoredRow stored : rows.values()) {
            if (stored.row().get(column).map(value::equals).orElse(false)) {
                out.add(mapper.fromRow(stored.row()));
            }
        }
        return out;
    }

    public synchronized int deleteBy(String column, ColumnValue value) {
        requireIndexed(column);
        int before = rows.size();
        rows.values().removeIf(stored -> stored.row().get(column).map(value::equals).orElse(false));
        return before - rows.size();
    }

    public synchronized Optional<float[]> embedding(ColumnValue id) {
        StoredRow stored = rows.get(id.keyString());
        return stored == null || stored.embedding() == null ? Optional.empty() : Optional.of(stored.embedding().clone());
    }

    public synchronized int size() {
        return rows.size();
    }

    public synchronized void save() throws StorageException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("table", schema().name());
        ArrayNode stored = root.putArray("rows");
        for (StoredRow row : rows.values()) {
            ObjectNode node = stored.addObject();
            node.set("values", codec.encode(row.row(), objectMapper));
            if (row.embedding() != null) {
                ArrayNode vector = node.putArray("embedding");
                for (float component : row.embedding()) {
                    vector.add(component);
                }
                node.put("embeddingVersion", row.embeddingVersion());
            }
        }
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), root);
        } catch (IOException e) {
            throw new StorageException("Failed to save table " + schema().name() + " to " + path, e);
        }
    }

    private void load() throws StorageException {
        if (!Files.exists(path)) {
            return;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new StorageException("Failed to read table " + schema().name() + " from " + path, e);
        }
        int reembedded = 0;
        for (JsonNode node : root.path("rows")) {
            Row row;
            try {
                row = codec.decode(node.path("values"));
            } catch (ConversionException e) {
                throw new StorageException("Corrupt row in table " + schema().name() + ": " + e.getMessage(), e);
            }
            String version = node.path("embeddingVersion").asText("");
            float[] embedding = readVector(node.path("embedding"));
            String key = row.get(TableSchema.ID).orElseThrow().keyString();
            if (schema().hasEmbedding() && (embedding == null || !embeddingService.version().equals(version))) {
                embedding = embed(key, row);
                version = embeddingService.version();
                reembedded++;
            }
            rows.put(key, new StoredRow(row, embedding, version));
        }
        if (reembedded > 0) {
            log.info("Re-embedded {} rows of table {} for embedding version {}",
                    reembedded, schema().name(), embeddingService.version());
        }
    }

    private float[] embed(String key, Row row) throws StorageException {
        if (!schema().hasEmbedding()) {
            return null;
        }
        String text = row.get(schema().embeddingColumn()).map(ColumnValue::keyString).orElse("");
        try {
            return embeddingService.embed(text);
        } catch (EmbeddingException e) {
            throw new StorageException("Failed to embed row " + key + " of table " + schema().name()
                    + " with " + embeddingService.version() + ": " + e.getMessage(), e);
        }
    }

    private static float[] readVector(JsonNode node) {
        if (!node.isArray()) {
            return null;
        }
        float[] vector = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            vector[i] = (float) node.get(i).asDouble();
        }
        return vector;
    }

    private void requireIndexed(String column) {
        Column declared = schema().column(column)
                .orElseThrow(() -> new IllegalArgumentException("Unknown column " + column + " in table " + schema().name()));
        if (!declared.indexed()) {
            throw new IllegalArgumentException("Column " + schema().name() + "." + column + " is not indexed");
        }
    }

    private record StoredRow(Row row, float[] embedding, String embeddingVersion) {
    }
}
