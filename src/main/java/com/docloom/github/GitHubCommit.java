package com.docloom.github;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param authorLogin GitHub account linked to the commit, null when the author email is unmatched
 * @param authorName  name recorded in the git commit itself
 */
public record GitHubCommit(
        String sha,
        String authorLogin,
        String authorName,
        Instant authoredAt,
        String htmlUrl,
        String message,
        JsonNode payload) {

    static GitHubCommit fromJson(JsonNode node) throws GitHubFetchException {
        JsonNode commit = node.path("commit");
        JsonNode gitAuthor = commit.path("author");
        return new GitHubCommit(
                GitHubJson.text(node, "sha", ""),
                GitHubJson.login(node, "author"),
                GitHubJson.text(gitAuthor, "name", ""),
                GitHubJson.instant(gitAuthor, "date"),
                GitHubJson.text(node, "html_url", ""),
                GitHubJson.text(commit, "message", ""),
                node);
    }
}
