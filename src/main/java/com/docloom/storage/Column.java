package com.docloom.storage;

public record Column(String name, ColumnType type, boolean primaryKey, boolean indexed, boolean nullable) {

    public static Column primaryKey(String name, ColumnType type) {
        return new Column(name, type, true, true, false);
    }

    public static Column required(String name, ColumnType type) {
        return new Column(name, type, false, false, false);
    }

    public static Column optional(String name, ColumnType type) {
        return new Column(name, type, false, false, true);
    }

    public Column withIndex() {
        return new Column(name, type, primaryKey, true, nullable);
    }
}
