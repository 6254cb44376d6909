package com.docloom.github;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.databind.JsonNode;

final class GitHubJson {
    private GitHubJson() {
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNull() || value.isMissingNode() ? null : value.asText();
    }

    static String text(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value == null ? fallback : value;
    }

    static String login(JsonNode node, String field) {
        return text(node.path(field), "login");
    }

    static Instant instant(JsonNode node, String field) throws GitHubFetchException {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new GitHubFetchException("Unparseable timestamp '" + value + "' in field " + field, e);
        }
    }
}
