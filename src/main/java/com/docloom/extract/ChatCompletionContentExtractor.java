package com.docloom.extract;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Asks an OpenAI-compatible chat completions endpoint for a JSON object with a single
 * {@code content} attribute.
 */
public class ChatCompletionContentExtractor implements ContentExtractor {
    private static final Logger log = LoggerFactory.getLogger(ChatCompletionContentExtractor.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    static final String PREAMBLE = "Cleanup the content in the given text to only have the main content. "
            + "Return a json data structure with a 'content' attribute set only.";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int maxInputChars;

    public ChatCompletionContentExtractor(OkHttpClient httpClient,
            String endpoint,
            String model,
            String apiKey,
            int maxInputChars) {
        if (maxInputChars <= 0) {
            throw new IllegalArgumentException("maxInputChars must be positive");
        }
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.maxInputChars = maxInputChars;
    }

    @Override
    public ExtractedContent extract(String text) throws ExtractionException {
        String input = text == null ? "" : text;
        if (input.length() > maxInputChars) {
            log.debug("Truncating extraction input chars={} max={}", input.length(), maxInputChars);
            input = input.substring(0, maxInputChars);
        }

        Request.Builder requestBuilder;
        try {
            requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(requestBody(input)), JSON));
        } catch (IOException e) {
            throw new ExtractionException("Failed to encode extraction request", e);
        } catch (IllegalArgumentException e) {
            throw new ExtractionException("Invalid extraction endpoint " + endpoint, e);
        }
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }

        String payload;
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            payload = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new ExtractionException("Extraction model returned HTTP " + response.code() + " model=" + model);
            }
        } catch (IOException e) {
            throw new ExtractionException("Failed to call extraction model " + model + ": " + e.getMessage(), e);
        }
        return parseReply(payload);
    }

    private ObjectNode requestBody(String input) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.putObject("response_format").put("type", "json_object");
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", PREAMBLE);
        messages.addObject().put("role", "user").put("content", input);
        return body;
    }

    ExtractedContent parseReply(String payload) throws ExtractionException {
        JsonNode message;
        try {
            message = mapper.readTree(payload).path("choices").path(0).path("message").path("content");
        } catch (IOException e) {
            throw new ExtractionException("Extraction reply is not JSON", e);
        }
        if (!message.isTextual()) {
            throw new ExtractionException("Extraction reply has no message content");
        }
        JsonNode structured;
        try {
            structured = mapper.readTree(message.asText());
        } catch (IOException e) {
            throw new ExtractionException("Extraction model did not return a JSON object", e);
        }
        JsonNode content = structured == null ? null : structured.get("content");
        if (content == null || !content.isTextual()) {
            throw new ExtractionException("Extraction model reply lacks a textual 'content' attribute");
        }
        return new ExtractedContent(content.asText());
    }
}
