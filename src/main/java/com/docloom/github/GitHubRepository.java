package com.docloom.github;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

public record GitHubRepository(
        String fullName,
        String description,
        String htmlUrl,
        Instant createdAt,
        Instant updatedAt,
        JsonNode payload) {

    static GitHubRepository fromJson(JsonNode node) throws GitHubFetchException {
        String name = GitHubJson.text(node, "name", "");
        return new GitHubRepository(
                GitHubJson.text(node, "full_name", name),
                GitHubJson.text(node, "description"),
                GitHubJson.text(node, "html_url", ""),
                GitHubJson.instant(node, "created_at"),
                GitHubJson.instant(node, "updated_at"),
                node);
    }
}
