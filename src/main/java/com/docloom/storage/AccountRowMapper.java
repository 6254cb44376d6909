package com.docloom.storage;

import java.util.List;

import com.docloom.model.Account;
import com.docloom.model.MessageSource;

public class AccountRowMapper implements RowMapper<Account> {
    private static final TableSchema SCHEMA = new TableSchema("accounts", List.of(
            Column.primaryKey(TableSchema.ID, ColumnType.INTEGER),
            Column.required("source_id", ColumnType.TEXT).withIndex(),
            Column.required("name", ColumnType.TEXT),
            Column.required("source", ColumnType.TEXT),
            Column.optional("created_at", ColumnType.TIMESTAMP),
            Column.optional("updated_at", ColumnType.TIMESTAMP)),
            null);

    @Override
    public TableSchema schema() {
        return SCHEMA;
    }

    @Override
    public Row toRow(Account account) {
        return new Row()
                .putInteger(TableSchema.ID, account.id())
                .putText("source_id", account.sourceId())
                .putText("name", account.name())
                .putText("source", account.source().canonicalName())
                .putTimestamp("created_at", account.createdAt())
                .putTimestamp("updated_at", account.updatedAt());
    }

    @Override
    public Account fromRow(Row row) throws ConversionException {
        return new Account(
                row.integer(TableSchema.ID),
                row.text("source_id"),
                row.text("name"),
                MessageSource.fromCanonicalName(row.text("source")),
                row.optionalTimestamp("created_at"),
                row.optionalTimestamp("updated_at"));
    }
}
