package com.docloom.storage;

import com.docloom.model.Document;

/**
 * The only storage operation the ingestion core depends on. Implementations must upsert by
 * document id: writing an existing id replaces its content and metadata.
 */
public interface DocumentSink {
    void addDocuments(Iterable<Document> documents) throws StorageException;
}
