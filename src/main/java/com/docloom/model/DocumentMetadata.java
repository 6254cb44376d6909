package com.docloom.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Metadata attached to documents that have no provider payload of their own.
 */
public final class DocumentMetadata {
    public static final String SOURCE_TYPE = "source_type";
    public static final String SOURCE_URL = "source_url";

    private DocumentMetadata() {
    }

    public static ObjectNode of(SourceType type, String sourceUrl) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(SOURCE_TYPE, type.prefix());
        node.put(SOURCE_URL, sourceUrl);
        return node;
    }
}
