package com.docloom.storage;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docloom.model.Account;
import com.docloom.model.Channel;
import com.docloom.model.Conversation;
import com.docloom.model.Document;
import com.docloom.model.Message;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * One JSON file per table under a single directory.
 */
public class KnowledgeStore implements DocumentSink {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeStore.class);

    private final VectorTable<Document> documents;
    private final VectorTable<Message> messages;
    private final VectorTable<Account> accounts;
    private final VectorTable<Conversation> conversations;
    private final VectorTable<Channel> channels;

    private KnowledgeStore(VectorTable<Document> documents,
            VectorTable<Message> messages,
            VectorTable<Account> accounts,
            VectorTable<Conversation> conversations,
            VectorTable<Channel> channels) {
        this.documents = documents;
        this.messages = messages;
        this.accounts = accounts;
        this.conversations = conversations;
        this.channels = channels;
    }

    public static KnowledgeStore open(Path directory, EmbeddingService embeddingService) throws StorageException {
        ObjectMapper objectMapper = new ObjectMapper();
        return new KnowledgeStore(
                VectorTable.open(directory.resolve("documents.json"), new DocumentRowMapper(objectMapper), embeddingService),
                VectorTable.open(directory.resolve("messages.json"), new MessageRowMapper(), embeddingService),
                VectorTable.open(directory.resolve("accounts.json"), new AccountRowMapper(), embeddingService),
                VectorTable.open(directory.resolve("conversations.json"), new ConversationRowMapper(), embeddingService),
                VectorTable.open(directory.resolve("channels.json"), new ChannelRowMapper(), embeddingService));
    }

    @Override
    public void addDocuments(Iterable<Document> batch) throws StorageException {
        int written = documents.upsert(batch);
        documents.save();
        log.info("Stored documents written={} total={}", written, documents.size());
    }

    public int deleteDocumentsBySource(String sourceId) throws StorageException {
        int removed = documents.deleteBy(DocumentRowMapper.SOURCE_ID, ColumnValue.text(sourceId));
        documents.save();
        log.info("Deleted documents sourceId={} removed={}", sourceId, removed);
        return removed;
    }

    public void addMessages(Iterable<Message> batch) throws StorageException {
        messages.upsert(batch);
        messages.save();
    }

    public VectorTable<Document> documents() {
        return documents;
    }

    public VectorTable<Message> messages() {
        return messages;
    }

    public VectorTable<Account> accounts() {
        return accounts;
    }

    public VectorTable<Conversation> conversations() {
        return conversations;
    }

    public VectorTable<Channel> channels() {
        return channels;
    }
}
