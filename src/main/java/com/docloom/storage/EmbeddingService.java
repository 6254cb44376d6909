package com.docloom.storage;

/**
 * Embeds the text of a table's embedding column. Every stored row records the {@link #version()}
 * it was embedded with and {@link VectorTable} re-embeds rows with a different version on open, so
 * the version must change whenever the vector space does.
 */
public interface EmbeddingService {
    float[] embed(String text) throws EmbeddingException;

    String version();
}
