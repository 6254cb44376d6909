package com.docloom.extract;

import java.util.Map;

import com.docloom.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class ContentExtractors {
    private ContentExtractors() {
    }

    public static ContentExtractor fromConfig(AppConfig.ExtractionConfig config, OkHttpClient httpClient) {
        return fromConfig(config, httpClient, System.getenv());
    }

    static ContentExtractor fromConfig(AppConfig.ExtractionConfig config, OkHttpClient httpClient, Map<String, String> env) {
        String apiKey = config.getApiKeyEnv() == null ? null : env.get(config.getApiKeyEnv());
        return new ChatCompletionContentExtractor(httpClient,
                config.getEndpoint(),
                config.getModel(),
                apiKey,
                config.getMaxInputChars());
    }
}
