package com.docloom.source;

import java.util.Objects;

import com.docloom.model.SourceType;

public record SourceDescriptor(SourceType type, String locator) {

    public SourceDescriptor {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(locator, "locator");
    }

    /**
     * Splits on the first colon only; locators such as URLs may contain further colons.
     */
    public static SourceDescriptor parse(String raw) throws InvalidSourceException {
        if (raw == null || raw.isBlank()) {
            throw new InvalidSourceException("empty source descriptor");
        }
        int colon = raw.indexOf(':');
        if (colon < 0) {
            throw new InvalidSourceException("missing '<type>:' prefix in '" + raw + "'");
        }
        String prefix = raw.substring(0, colon).strip();
        String locator = raw.substring(colon + 1).strip();
        SourceType type = SourceType.fromPrefix(prefix)
                .orElseThrow(() -> new InvalidSourceException("unrecognized source type '" + prefix + "'"));
        if (locator.isEmpty()) {
            throw new InvalidSourceException("empty locator for source type '" + prefix + "'");
        }
        return new SourceDescriptor(type, locator);
    }

    /**
     * Canonical {@code type:locator} form, also used as the {@code sourceId} of loaded documents.
     */
    public String canonical() {
        return type.prefix() + ":" + locator;
    }

    @Override
    public String toString() {
        return canonical();
    }
}
