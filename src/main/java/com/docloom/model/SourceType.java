package com.docloom.model;

import java.util.Arrays;
import java.util.Optional;

public enum SourceType {
    GITHUB("github"),
    SITE("site"),
    FILE("file"),
    PDF("pdf");

    private final String prefix;

    SourceType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public static Optional<SourceType> fromPrefix(String prefix) {
        return Arrays.stream(values())
                .filter(type -> type.prefix.equals(prefix))
                .findFirst();
    }
}
