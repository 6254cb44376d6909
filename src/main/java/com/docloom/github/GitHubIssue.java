package com.docloom.github;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param pullRequest true when the issues endpoint returned a pull request (it carries a
 *                    {@code pull_request} member)
 */
public record GitHubIssue(
        long number,
        String title,
        String author,
        String state,
        String htmlUrl,
        Instant createdAt,
        Instant updatedAt,
        String body,
        boolean pullRequest,
        JsonNode payload) {

    static GitHubIssue fromJson(JsonNode node) throws GitHubFetchException {
        return new GitHubIssue(
                node.path("number").asLong(),
                GitHubJson.text(node, "title", ""),
                GitHubJson.login(node, "user"),
                GitHubJson.text(node, "state", "unknown"),
                GitHubJson.text(node, "html_url", ""),
                GitHubJson.instant(node, "created_at"),
                GitHubJson.instant(node, "updated_at"),
                GitHubJson.text(node, "body", ""),
                node.hasNonNull("pull_request"),
                node);
    }
}
