package com.docloom.github;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * GitHub REST v3 client for the activity endpoints used by the sync. Pull requests and issues are
 * re-filtered against the watermark on the client; commits rely on the API's {@code since}.
 */
public class GitHubClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);
    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"next\"");
    private static final String API_VERSION = "2022-11-28";

    private final OkHttpClient httpClient;
    private final HttpUrl apiUrl;
    private final String token;
    private final int perPage;
    private final int maxPages;
    private final ObjectMapper mapper = new ObjectMapper();

    public GitHubClient(OkHttpClient httpClient, String apiUrl, String token, int perPage, int maxPages) {
        HttpUrl parsed = HttpUrl.parse(apiUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid GitHub API url: " + apiUrl);
        }
        if (perPage <= 0 || maxPages <= 0) {
            throw new IllegalArgumentException("perPage and maxPages must be positive");
        }
        this.httpClient = httpClient;
        this.apiUrl = parsed;
        this.token = token;
        this.perPage = perPage;
        this.maxPages = maxPages;
    }

    public List<GitHubRepository> listOrgRepositories(String org) throws GitHubFetchException {
        HttpUrl url = endpoint("orgs", org, "repos").newBuilder()
                .addQueryParameter("type", "all")
                .build();
        List<GitHubRepository> repositories = new ArrayList<>();
        for (JsonNode node : fetchPages("fetch organization repositories for " + org, url, page -> true, false)) {
            repositories.add(GitHubRepository.fromJson(node));
        }
        return repositories;
    }

    public GitHubRepository getRepository(String owner, String repo) throws GitHubFetchException {
        String operation = "fetch repository " + owner + "/" + repo;
        JsonNode node = fetch(operation, endpoint("repos", owner, repo));
        if (node == null || !node.isObject()) {
            throw new GitHubFetchException("Failed to " + operation + ": unexpected payload", 200);
        }
        return GitHubRepository.fromJson(node);
    }

    public List<GitHubPullRequest> listPullRequests(String owner, String repo, Instant since) throws GitHubFetchException {
        HttpUrl url = sortedByUpdate(endpoint("repos", owner, repo, "pulls"));
        List<GitHubPullRequest> pulls = new ArrayList<>();
        for (JsonNode node : fetchPages("fetch pull requests for " + owner + "/" + repo, url, olderPagesMayMatch(since), false)) {
            GitHubPullRequest pull = GitHubPullRequest.fromJson(node);
            if (updatedSince(pull.updatedAt(), since)) {
                pulls.add(pull);
            }
        }
        return pulls;
    }

    public List<GitHubIssue> listIssues(String owner, String repo, Instant since) throws GitHubFetchException {
        HttpUrl url = sortedByUpdate(endpoint("repos", owner, repo, "issues"));
        List<GitHubIssue> issues = new ArrayList<>();
        for (JsonNode node : fetchPages("fetch issues for " + owner + "/" + repo, url, olderPagesMayMatch(since), false)) {
            GitHubIssue issue = GitHubIssue.fromJson(node);
            // the issues endpoint also lists pull requests
            if (!issue.pullRequest() && updatedSince(issue.updatedAt(), since)) {
                issues.add(issue);
            }
        }
        return issues;
    }

    public List<GitHubCommit> listCommits(String owner, String repo, Instant since) throws GitHubFetchException {
        HttpUrl url = endpoint("repos", owner, repo, "commits").newBuilder()
                .addQueryParameter("since", since.toString())
                .build();
        List<GitHubCommit> commits = new ArrayList<>();
        for (JsonNode node : fetchPages("fetch commits for " + owner + "/" + repo, url, page -> true, true)) {
            commits.add(GitHubCommit.fromJson(node));
        }
        return commits;
    }

    private static boolean updatedSince(Instant updatedAt, Instant since) {
        return updatedAt != null && !updatedAt.isBefore(since);
    }

    /**
     * Results are sorted by update time descending, so once a page ends before the watermark no
     * later page can contain a match.
     */
    private static PageFilter olderPagesMayMatch(Instant since) {
        return page -> {
            if (page.isEmpty()) {
                return false;
            }
            Instant last = GitHubJson.instant(page.get(page.size() - 1), "updated_at");
            return updatedSince(last, since);
        };
    }

    private HttpUrl sortedByUpdate(HttpUrl url) {
        return url.newBuilder()
                .addQueryParameter("state", "all")
                .addQueryParameter("sort", "updated")
                .addQueryParameter("direction", "desc")
                .build();
    }

    private HttpUrl endpoint(String... segments) {
        HttpUrl.Builder builder = apiUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private List<JsonNode> fetchPages(String operation,
            HttpUrl firstPage,
            PageFilter continueAfter,
            boolean emptyOnConflict) throws GitHubFetchException {
        List<JsonNode> items = new ArrayList<>();
        HttpUrl next = firstPage.newBuilder().addQueryParameter("per_page", Integer.toString(perPage)).build();
        int pages = 0;
        while (next != null) {
            if (pages == maxPages) {
                // partial listings fail the source so its watermark stays put
                log.error("Page limit of {} reached while trying to {}", maxPages, operation);
                throw new GitHubFetchException("Failed to " + operation + ": more than " + maxPages
                        + " pages of results (github.maxPages)", -1);
            }
            Page page = fetchPage(operation, next, emptyOnConflict);
            items.addAll(page.items());
            pages++;
            next = continueAfter.test(page.items()) ? page.next() : null;
        }
        return items;
    }

    private Page fetchPage(String operation, HttpUrl url, boolean emptyOnConflict) throws GitHubFetchException {
        try (Response response = httpClient.newCall(request(url)).execute()) {
            if (emptyOnConflict && response.code() == 409) {
                log.debug("Empty repository while trying to {}", operation);
                return new Page(List.of(), null);
            }
            JsonNode body = readBody(operation, response);
            if (!body.isArray()) {
                throw new GitHubFetchException("Failed to " + operation + ": expected a JSON array", response.code());
            }
            List<JsonNode> items = new ArrayList<>();
            body.forEach(items::add);
            return new Page(items, nextLink(response.header("Link")));
        } catch (IOException e) {
            throw new GitHubFetchException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    private JsonNode fetch(String operation, HttpUrl url) throws GitHubFetchException {
        try (Response response = httpClient.newCall(request(url)).execute()) {
            return readBody(operation, response);
        } catch (IOException e) {
            throw new GitHubFetchException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    private JsonNode readBody(String operation, Response response) throws IOException, GitHubFetchException {
        ResponseBody body = response.body();
        String payload = body == null ? "" : body.string();
        if (!response.isSuccessful()) {
            throw failure(operation, response, payload);
        }
        return mapper.readTree(payload.isEmpty() ? "null" : payload);
    }

    private GitHubFetchException failure(String operation, Response response, String payload) {
        int code = response.code();
        if ((code == 403 || code == 429) && "0".equals(response.header("X-RateLimit-Remaining"))) {
            String reset = response.header("X-RateLimit-Reset");
            String resetAt = reset == null ? "unknown" : resetInstant(reset);
            return new GitHubFetchException("GitHub rate limit exhausted while trying to " + operation
                    + "; resets at " + resetAt, code);
        }
        String message = providerMessage(payload);
        if (code == 401) {
            return new GitHubFetchException("Failed to " + operation + ": authentication rejected (HTTP 401) " + message, code);
        }
        return new GitHubFetchException("Failed to " + operation + ": HTTP " + code + " " + message, code);
    }

    private static String resetInstant(String epochSeconds) {
        try {
            return Instant.ofEpochSecond(Long.parseLong(epochSeconds.trim())).toString();
        } catch (NumberFormatException e) {
            return epochSeconds;
        }
    }

    private String providerMessage(String payload) {
        if (payload == null || payload.isBlank()) {
            return "";
        }
        try {
            return mapper.readTree(payload).path("message").asText("");
        } catch (IOException e) {
            return payload.length() > 200 ? payload.substring(0, 200) : payload;
        }
    }

    private Request request(HttpUrl url) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .get()
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", API_VERSION)
                .header("User-Agent", "docloom");
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder.build();
    }

    static HttpUrl nextLink(String linkHeader) {
        if (linkHeader == null) {
            return null;
        }
        Matcher matcher = NEXT_LINK.matcher(linkHeader);
        return matcher.find() ? HttpUrl.parse(matcher.group(1)) : null;
    }

    private record Page(List<JsonNode> items, HttpUrl next) {
    }

    @FunctionalInterface
    private interface PageFilter {
        boolean test(List<JsonNode> page) throws GitHubFetchException;
    }
}
