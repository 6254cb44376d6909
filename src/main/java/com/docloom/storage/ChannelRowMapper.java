package com.docloom.storage;

import java.util.List;

import com.docloom.model.Channel;
import com.docloom.model.ChannelType;
import com.docloom.model.MessageSource;

public class ChannelRowMapper implements RowMapper<Channel> {
    private static final TableSchema SCHEMA = new TableSchema("channels", List.of(
            Column.primaryKey(TableSchema.ID, ColumnType.TEXT),
            Column.required("channel_id", ColumnType.TEXT).withIndex(),
            Column.required("channel_type", ColumnType.TEXT),
            Column.required("source", ColumnType.TEXT),
            Column.required("name", ColumnType.TEXT),
            Column.optional("created_at", ColumnType.TIMESTAMP),
            Column.optional("updated_at", ColumnType.TIMESTAMP)),
            null);

    @Override
    public TableSchema schema() {
        return SCHEMA;
    }

    @Override
    public Row toRow(Channel channel) {
        return new Row()
                .putText(TableSchema.ID, channel.id())
                .putText("channel_id", channel.channelId())
                .putText("channel_type", channel.channelType().canonicalName())
                .putText("source", channel.source().canonicalName())
                .putText("name", channel.name())
                .putTimestamp("created_at", channel.createdAt())
                .putTimestamp("updated_at", channel.updatedAt());
    }

    @Override
    public Channel fromRow(Row row) throws ConversionException {
        return new Channel(
                row.text(TableSchema.ID),
                row.text("channel_id"),
                ChannelType.fromCanonicalName(row.text("channel_type")),
                MessageSource.fromCanonicalName(row.text("source")),
                row.text("name"),
                row.optionalTimestamp("created_at"),
                row.optionalTimestamp("updated_at"));
    }
}
