package com.docloom.storage;

import java.util.Map;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    static final int LOCAL_DIMENSION = 384;

    private EmbeddingServices() {
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient) {
        return fromEnvironment(httpClient, System.getenv());
    }

    static EmbeddingService fromEnvironment(OkHttpClient httpClient, Map<String, String> env) {
        String endpoint = env.get("DOCLOOM_EMBEDDING_URL");
        if (endpoint == null || endpoint.isBlank()) {
            return new HashingEmbeddingService(LOCAL_DIMENSION);
        }
        String provider = env.getOrDefault("DOCLOOM_EMBEDDING_PROVIDER", "custom");
        String apiKey = env.get("DOCLOOM_EMBEDDING_API_KEY");
        return new ExternalProviderEmbeddingService(httpClient, endpoint, provider, apiKey);
    }
}
