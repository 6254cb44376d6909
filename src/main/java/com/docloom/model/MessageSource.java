package com.docloom.model;

import com.docloom.storage.ConversionException;

public enum MessageSource {
    DISCORD("discord"),
    TELEGRAM("telegram"),
    TWITTER("twitter"),
    GITHUB("github");

    private final String canonicalName;

    MessageSource(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    public String canonicalName() {
        return canonicalName;
    }

    public static MessageSource fromCanonicalName(String value) throws ConversionException {
        for (MessageSource source : values()) {
            if (source.canonicalName.equals(value)) {
                return source;
            }
        }
        throw new ConversionException("Unknown message source '" + value + "'");
    }
}
