package com.docloom.storage;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Signed feature hashing over word tokens, L2-normalized. Offline and deterministic; the default
 * when no embedding provider is configured.
 */
public class HashingEmbeddingService implements EmbeddingService {
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null) {
            return vector;
        }
        Matcher tokens = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (tokens.find()) {
            int hash = tokens.group().hashCode();
            // sign from the hash, bucket from its residue
            vector[Math.floorMod(hash, dimension)] += hash < 0 ? -1f : 1f;
        }
        return unitLength(vector);
    }

    private static float[] unitLength(float[] vector) {
        double squares = 0;
        for (float component : vector) {
            squares += component * component;
        }
        if (squares == 0) {
            return vector;
        }
        float scale = (float) (1 / Math.sqrt(squares));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
        return vector;
    }

    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "hashing-" + dimension + "-v2";
    }
}
