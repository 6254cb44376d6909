package com.docloom.github;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

public record GitHubPullRequest(
        long number,
        String title,
        String author,
        String state,
        String htmlUrl,
        Instant createdAt,
        Instant updatedAt,
        String body,
        JsonNode payload) {

    static GitHubPullRequest fromJson(JsonNode node) throws GitHubFetchException {
        return new GitHubPullRequest(
                node.path("number").asLong(),
                GitHubJson.text(node, "title", ""),
                GitHubJson.login(node, "user"),
                GitHubJson.text(node, "state", "unknown"),
                GitHubJson.text(node, "html_url", ""),
                GitHubJson.instant(node, "created_at"),
                GitHubJson.instant(node, "updated_at"),
                GitHubJson.text(node, "body", ""),
                node);
    }
}
