package com.docloom.storage;

import java.util.List;

import com.docloom.model.ChannelType;
import com.docloom.model.Message;
import com.docloom.model.MessageSource;

public class MessageRowMapper implements RowMapper<Message> {
    public static final String SOURCE = "source";
    public static final String SOURCE_ID = "source_id";
    public static final String CHANNEL_TYPE = "channel_type";
    public static final String CHANNEL_ID = "channel_id";
    public static final String ACCOUNT_ID = "account_id";
    public static final String ROLE = "role";
    public static final String CONTENT = "content";
    public static final String CREATED_AT = "created_at";

    private static final TableSchema SCHEMA = new TableSchema("messages", List.of(
            Column.primaryKey(TableSchema.ID, ColumnType.TEXT),
            Column.required(SOURCE, ColumnType.TEXT),
            Column.required(SOURCE_ID, ColumnType.TEXT).withIndex(),
            Column.required(CHANNEL_TYPE, ColumnType.TEXT),
            Column.required(CHANNEL_ID, ColumnType.TEXT).withIndex(),
            Column.required(ACCOUNT_ID, ColumnType.TEXT).withIndex(),
            Column.required(ROLE, ColumnType.TEXT),
            Column.required(CONTENT, ColumnType.TEXT),
            Column.optional(CREATED_AT, ColumnType.TIMESTAMP)),
            CONTENT);

    @Override
    public TableSchema schema() {
        return SCHEMA;
    }

    @Override
    public Row toRow(Message message) {
        return new Row()
                .putText(TableSchema.ID, message.id())
                .putText(SOURCE, message.source().canonicalName())
                .putText(SOURCE_ID, message.sourceId())
                .putText(CHANNEL_TYPE, message.channelType().canonicalName())
                .putText(CHANNEL_ID, message.channelId())
                .putText(ACCOUNT_ID, message.accountId())
                .putText(ROLE, message.role())
                .putText(CONTENT, message.content())
                .putTimestamp(CREATED_AT, message.createdAt());
    }

    @Override
    public Message fromRow(Row row) throws ConversionException {
        return new Message(
                row.text(TableSchema.ID),
                MessageSource.fromCanonicalName(row.text(SOURCE)),
                row.text(SOURCE_ID),
                ChannelType.fromCanonicalName(row.text(CHANNEL_TYPE)),
                row.text(CHANNEL_ID),
                row.text(ACCOUNT_ID),
                row.text(ROLE),
                row.text(CONTENT),
                row.optionalTimestamp(CREATED_AT));
    }
}
