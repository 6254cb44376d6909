package com.docloom.storage;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.docloom.model.Account;
import com.docloom.model.Document;
import com.docloom.model.MessageSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VectorTableTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EmbeddingService embeddings = new HashingEmbeddingService(16);

    @Test
    void shouldRoundTripDocumentsThroughFile() throws Exception {
        Path path = tempDir.resolve("documents.json");
        ObjectNode metadata = objectMapper.createObjectNode().put("number", 42).put("state", "open");
        Document document = new Document("github:pr:acme:acme/widget/42", "github:acme", "Pull Request: #42",
                Instant.parse("2024-02-01T10:15:30Z"), metadata);

        VectorTable<Document> table = VectorTable.open(path, new DocumentRowMapper(objectMapper), embeddings);
        table.upsert(List.of(document));
        table.save();

        VectorTable<Document> reopened = VectorTable.open(path, new DocumentRowMapper(objectMapper), embeddings);
        assertEquals(Optional.of(document), reopened.get(ColumnValue.text(document.id())));
        assertArrayEquals(embeddings.embed("Pull Request: #42"), reopened.embedding(ColumnValue.text(document.id())).orElseThrow());
    }

    @Test
    void shouldReplaceExistingRowOnUpsert() throws Exception {
        VectorTable<Document> table = VectorTable.open(tempDir.resolve("documents.json"),
                new DocumentRowMapper(objectMapper), embeddings);

        table.upsert(List.of(new Document("site:https://example.com", "site:https://example.com", "old text", null, null)));
        float[] before = table.embedding(ColumnValue.text("site:https://example.com")).orElseThrow();
        table.upsert(List.of(new Document("site:https://example.com", "site:https://example.com", "brand new words", null, null)));

        assertEquals(1, table.size());
        assertEquals("brand new words", table.get(ColumnValue.text("site:https://example.com")).orElseThrow().content());
        assertFalse(Arrays.equals(before, table.embedding(ColumnValue.text("site:https://example.com")).orElseThrow()));
    }

    @Test
    void shouldFindAndDeleteByIndexedColumnOnly() throws Exception {
        VectorTable<Document> table = VectorTable.open(tempDir.resolve("documents.json"),
                new DocumentRowMapper(objectMapper), embeddings);
        table.upsert(List.of(
                new Document("a", "github:acme", "one", null, null),
                new Document("b", "github:acme", "two", null, null),
                new Document("c", "file:docs/*.md", "three", null, null)));

        assertEquals(List.of("a", "b"), table.findBy(DocumentRowMapper.SOURCE_ID, ColumnValue.text("github:acme"))
                .stream().map(Document::id).toList());
        assertThrows(IllegalArgumentException.class,
                () -> table.findBy(DocumentRowMapper.CONTENT, ColumnValue.text("one")));
        assertThrows(IllegalArgumentException.class,
                () -> table.findBy("no_such_column", ColumnValue.text("x")));

        assertEquals(2, table.deleteBy(DocumentRowMapper.SOURCE_ID, ColumnValue.text("github:acme")));
        assertEquals(1, table.size());
    }

    @Test
    void shouldReembedRowsWhenEmbeddingVersionChanges() throws Exception {
        Path path = tempDir.resolve("documents.json");
        VectorTable<Document> table = VectorTable.open(path, new DocumentRowMapper(objectMapper), embeddings);
        table.upsert(List.of(new Document("a", "file:a", "some content", null, null)));
        table.save();

        EmbeddingService smaller = new HashingEmbeddingService(8);
        VectorTable<Document> reopened = VectorTable.open(path, new DocumentRowMapper(objectMapper), smaller);

        assertEquals(8, reopened.embedding(ColumnValue.text("a")).orElseThrow().length);
    }

    @Test
    void shouldLeaveTableUnchangedWhenAnyRowOfBatchFailsToEmbed() throws Exception {
        Path path = tempDir.resolve("documents.json");
        EmbeddingService flaky = new EmbeddingService() {
            @Override
            public float[] embed(String text) throws EmbeddingException {
                if (text.contains("unreachable")) {
                    throw new EmbeddingException("Embedding provider acme returned HTTP 503");
                }
                return embeddings.embed(text);
            }

            @Override
            public String version() {
                return embeddings.version();
            }
        };
        VectorTable<Document> table = VectorTable.open(path, new DocumentRowMapper(objectMapper), flaky);
        table.upsert(List.of(new Document("a", "file:a", "kept content", null, null)));

        StorageException error = assertThrows(StorageException.class, () -> table.upsert(List.of(
                new Document("a", "file:a", "replacement", null, null),
                new Document("b", "file:b", "fresh", null, null),
                new Document("c", "file:c", "provider unreachable here", null, null))));
        table.save();

        assertTrue(error.getMessage().startsWith("Failed to embed row c of table documents"), error.getMessage());
        VectorTable<Document> reopened = VectorTable.open(path, new DocumentRowMapper(objectMapper), embeddings);
        assertEquals(1, reopened.size());
        assertEquals("kept content", reopened.get(ColumnValue.text("a")).orElseThrow().content());
        assertTrue(reopened.get(ColumnValue.text("b")).isEmpty());
    }

    @Test
    void shouldKeyIntegerTablesAndSkipEmbeddings() throws Exception {
        Path path = tempDir.resolve("accounts.json");
        Account account = new Account(7L, "discord:1234", "octocat", MessageSource.DISCORD,
                Instant.parse("2024-01-01T00:00:00Z"), null);

        VectorTable<Account> table = VectorTable.open(path, new AccountRowMapper(), embeddings);
        table.upsert(List.of(account));
        table.save();
        VectorTable<Account> reopened = VectorTable.open(path, new AccountRowMapper(), embeddings);

        assertEquals(Optional.of(account), reopened.get(ColumnValue.integer(7L)));
        assertTrue(reopened.embedding(ColumnValue.integer(7L)).isEmpty());
        assertEquals(List.of(account), reopened.findBy("source_id", ColumnValue.text("discord:1234")));
    }

    @Test
    void shouldRejectCorruptFiles() throws Exception {
        Path path = tempDir.resolve("documents.json");
        Files.writeString(path, "{\"table\":\"documents\",\"rows\":[{\"values\":{\"id\":\"a\",\"source_id\":\"x\",\"content\":7}}]}");

        StorageException error = assertThrows(StorageException.class,
                () -> VectorTable.open(path, new DocumentRowMapper(objectMapper), embeddings));

        assertTrue(error.getMessage().contains("content"), error.getMessage());
    }

    @Test
    void shouldAcceptSqliteStyleTimestamps() throws Exception {
        Path path = tempDir.resolve("documents.json");
        Files.writeString(path, "{\"table\":\"documents\",\"rows\":[{\"values\":{\"id\":\"a\",\"source_id\":\"x\","
                + "\"content\":\"hello\",\"created_at\":\"2024-03-01 12:30:00\"}}]}");

        VectorTable<Document> table = VectorTable.open(path, new DocumentRowMapper(objectMapper), embeddings);

        assertEquals(Instant.parse("2024-03-01T12:30:00Z"), table.get(ColumnValue.text("a")).orElseThrow().createdAt());
        assertEquals(16, table.embedding(ColumnValue.text("a")).orElseThrow().length);
    }
}
