package com.docloom.model;

import com.docloom.storage.ConversionException;

public enum ChannelType {
    DIRECT_MESSAGE("direct_message"),
    TEXT("text"),
    VOICE("voice"),
    THREAD("thread");

    private final String canonicalName;

    ChannelType(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    public String canonicalName() {
        return canonicalName;
    }

    public static ChannelType fromCanonicalName(String value) throws ConversionException {
        for (ChannelType type : values()) {
            if (type.canonicalName.equals(value)) {
                return type;
            }
        }
        throw new ConversionException("Unknown channel type '" + value + "'");
    }
}
