package com.docloom.github;

import java.time.Instant;

import com.docloom.model.Document;

/**
 * Normalizes GitHub entities into documents. Ids depend only on entity identity so that
 * re-syncing the same entity overwrites the stored row.
 */
public final class GitHubDocuments {
    private GitHubDocuments() {
    }

    public static String repositoryId(RepositoryName name) {
        return "github:repo:" + name.qualified();
    }

    public static String pullRequestId(RepositoryName name, long number) {
        return "github:pr:" + name.owner() + ":" + name.qualified() + "/" + number;
    }

    public static String issueId(RepositoryName name, long number) {
        return "github:issue:" + name.owner() + ":" + name.qualified() + "/" + number;
    }

    public static String commitId(RepositoryName name, String sha) {
        return "github:commit:" + name.owner() + ":" + name.qualified() + "/" + sha;
    }

    static Document repository(RepositoryName name, GitHubRepository repository, String sourceId) {
        String description = repository.description() == null || repository.description().isBlank()
                ? "No description"
                : repository.description();
        String content = "Repository: " + repository.fullName()
                + "\nDescription: " + description
                + "\nURL: " + repository.htmlUrl()
                + "\nCreated: " + timestamp(repository.createdAt())
                + "\nLast Updated: " + timestamp(repository.updatedAt());
        return new Document(repositoryId(name), sourceId, content, repository.createdAt(), repository.payload());
    }

    static Document pullRequest(RepositoryName name, GitHubPullRequest pull, String sourceId) {
        String content = "Pull Request: #" + pull.number() + " - " + pull.title()
                + "\nAuthor: @" + nullToEmpty(pull.author())
                + "\nState: " + pull.state()
                + "\nURL: " + pull.htmlUrl()
                + "\nCreated: " + timestamp(pull.createdAt())
                + "\nLast Updated: " + timestamp(pull.updatedAt())
                + "\n\n" + pull.body();
        return new Document(pullRequestId(name, pull.number()), sourceId, content, pull.createdAt(), pull.payload());
    }

    static Document issue(RepositoryName name, GitHubIssue issue, String sourceId) {
        String content = "Issue: #" + issue.number() + " - " + issue.title()
                + "\nAuthor: @" + nullToEmpty(issue.author())
                + "\nState: " + issue.state()
                + "\nURL: " + issue.htmlUrl()
                + "\nCreated: " + timestamp(issue.createdAt())
                + "\nLast Updated: " + timestamp(issue.updatedAt())
                + "\n\n" + issue.body();
        return new Document(issueId(name, issue.number()), sourceId, content, issue.createdAt(), issue.payload());
    }

    static Document commit(RepositoryName name, GitHubCommit commit, String sourceId) {
        String author = commit.authorLogin() != null ? "@" + commit.authorLogin() : commit.authorName();
        String content = "Commit: " + commit.sha()
                + "\nAuthor: " + author
                + "\nDate: " + timestamp(commit.authoredAt())
                + "\nURL: " + commit.htmlUrl()
                + "\n\n" + commit.message();
        return new Document(commitId(name, commit.sha()), sourceId, content, commit.authoredAt(), commit.payload());
    }

    private static String timestamp(Instant instant) {
        return instant == null ? "unknown" : instant.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
