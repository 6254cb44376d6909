package com.docloom.storage;

public enum ColumnType {
    TEXT,
    INTEGER,
    TIMESTAMP
}
