package com.docloom.storage;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Embeds text through an HTTP provider. The request is {@code {"input": text}}; the reply is either
 * {@code {"embedding": [...]}} or the OpenAI-style {@code {"data": [{"embedding": [...]}]}}.
 * Every vector must have the length of the first one the provider returned.
 */
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.get("application/json");
    private static final int UNKNOWN = -1;

    private final OkHttpClient httpClient;
    private final HttpUrl endpoint;
    private final String provider;
    private final String apiKey;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicInteger dimension = new AtomicInteger(UNKNOWN);

    public ExternalProviderEmbeddingService(OkHttpClient httpClient, String endpoint, String provider, String apiKey) {
        HttpUrl parsed = HttpUrl.parse(endpoint);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid embedding endpoint: " + endpoint);
        }
        this.httpClient = httpClient;
        this.endpoint = parsed;
        this.provider = provider;
        this.apiKey = apiKey;
    }

    @Override
    public float[] embed(String text) throws EmbeddingException {
        try (Response response = httpClient.newCall(request(text == null ? "" : text)).execute()) {
            ResponseBody body = response.body();
            String payload = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new EmbeddingException("Embedding provider " + provider + " returned HTTP " + response.code());
            }
            return checkDimension(vectorOf(mapper.readTree(payload)));
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Embedding provider " + provider + " returned malformed JSON", e);
        } catch (IOException e) {
            throw new EmbeddingException("Embedding provider " + provider + " unreachable at " + endpoint, e);
        }
    }

    @Override
    public String version() {
        return "external-" + provider + "-v1";
    }

    private Request request(String text) {
        String payload = mapper.createObjectNode().put("input", text).toString();
        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private float[] vectorOf(JsonNode reply) throws EmbeddingException {
        JsonNode array = reply.path("embedding");
        if (!array.isArray()) {
            array = reply.path("data").path(0).path("embedding");
        }
        if (!array.isArray() || array.isEmpty()) {
            throw new EmbeddingException("Embedding provider " + provider + " returned no embedding array");
        }
        float[] vector = new float[array.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode component = array.get(i);
            if (!component.isNumber()) {
                throw new EmbeddingException("Embedding provider " + provider + " returned a non-numeric component at " + i);
            }
            vector[i] = component.floatValue();
        }
        return vector;
    }

    private float[] checkDimension(float[] vector) throws EmbeddingException {
        int expected = dimension.compareAndExchange(UNKNOWN, vector.length);
        if (expected != UNKNOWN && expected != vector.length) {
            throw new EmbeddingException("Embedding provider " + provider + " changed dimension from "
                    + expected + " to " + vector.length);
        }
        return vector;
    }
}
