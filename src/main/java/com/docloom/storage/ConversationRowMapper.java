package com.docloom.storage;

import java.util.List;

import com.docloom.model.Conversation;

public class ConversationRowMapper implements RowMapper<Conversation> {
    private static final TableSchema SCHEMA = new TableSchema("conversations", List.of(
            Column.primaryKey(TableSchema.ID, ColumnType.TEXT),
            Column.required("user_id", ColumnType.TEXT).withIndex(),
            Column.required("title", ColumnType.TEXT),
            Column.optional("created_at", ColumnType.TIMESTAMP),
            Column.optional("updated_at", ColumnType.TIMESTAMP)),
            null);

    @Override
    public TableSchema schema() {
        return SCHEMA;
    }

    @Override
    public Row toRow(Conversation conversation) {
        return new Row()
                .putText(TableSchema.ID, conversation.id())
                .putText("user_id", conversation.userId())
                .putText("title", conversation.title())
                .putTimestamp("created_at", conversation.createdAt())
                .putTimestamp("updated_at", conversation.updatedAt());
    }

    @Override
    public Conversation fromRow(Row row) throws ConversionException {
        return new Conversation(
                row.text(TableSchema.ID),
                row.text("user_id"),
                row.text("title"),
                row.optionalTimestamp("created_at"),
                row.optionalTimestamp("updated_at"));
    }
}
