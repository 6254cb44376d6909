package com.docloom.storage;

public interface RowMapper<T> {
    TableSchema schema();

    Row toRow(T entity);

    T fromRow(Row row) throws ConversionException;
}
