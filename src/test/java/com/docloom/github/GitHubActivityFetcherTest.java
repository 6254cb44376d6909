package com.docloom.github;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.docloom.http.StubInterceptor;
import com.docloom.http.StubInterceptor.Stub;
import com.docloom.model.Document;
import com.docloom.source.UpstreamDataException;

import static com.docloom.github.GitHubClientTest.commit;
import static com.docloom.github.GitHubClientTest.pull;
import static com.docloom.github.GitHubClientTest.repository;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GitHubActivityFetcherTest {
    private static final String API = "https://api.github.com";
    private static final Instant WATERMARK = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void shouldProduceRepositoryAndPullRequestRecordsForOrganization() throws Exception {
        StubInterceptor stub = new StubInterceptor()
                .json("/orgs/acme/repos", "[" + repository("acme/widget") + "]")
                .json("/repos/acme/widget/pulls", "[" + pull(42, "2024-02-01T00:00:00Z") + "]")
                .json("/repos/acme/widget/issues", "[]")
                .json("/repos/acme/widget/commits", "[]");
        GitHubActivityFetcher fetcher = new GitHubActivityFetcher(new GitHubClient(stub.client(), API, null, 100, 10), 4);

        List<Document> documents = fetcher.syncOrganization("acme", WATERMARK);

        assertEquals(List.of("github:repo:acme/widget", "github:pr:acme:acme/widget/42"),
                documents.stream().map(Document::id).toList());
        assertTrue(documents.stream().allMatch(document -> document.sourceId().equals("github:acme")));
        assertEquals("Repository: acme/widget\nDescription: No description\nURL: https://github.com/acme/widget"
                + "\nCreated: 2020-01-01T00:00:00Z\nLast Updated: 2024-01-05T00:00:00Z", documents.get(0).content());
        Document pullRequest = documents.get(1);
        assertTrue(pullRequest.content().startsWith("Pull Request: #42 - Change 42\nAuthor: @octocat\nState: open"),
                pullRequest.content());
        assertTrue(pullRequest.content().endsWith("\n\nDetails"));
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), pullRequest.createdAt());
        assertEquals(42, pullRequest.metadata().path("number").asInt());
        assertEquals(WATERMARK.toString(), stub.requests().stream()
                .filter(request -> request.url().encodedPath().endsWith("/commits"))
                .findFirst().orElseThrow().url().queryParameter("since"));
    }

    @Test
    void shouldKeepListingOrderRegardlessOfCompletionOrder() throws Exception {
        List<String> names = List.of("one", "two", "three", "four", "five");
        StringBuilder listing = new StringBuilder("[");
        StubInterceptor stub = new StubInterceptor();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            listing.append(i == 0 ? "" : ",").append(repository("acme/" + name));
            long delayMs = (names.size() - i) * 20L;
            stub.on("/repos/acme/" + name + "/pulls", request -> {
                sleep(delayMs);
                return Stub.json("[" + pull(1, "2024-02-01T00:00:00Z") + "]");
            });
            stub.json("/repos/acme/" + name + "/issues", "[]");
            stub.json("/repos/acme/" + name + "/commits", "[" + commit(name + "-sha") + "]");
        }
        stub.json("/orgs/acme/repos", listing.append("]").toString());
        GitHubActivityFetcher fetcher = new GitHubActivityFetcher(new GitHubClient(stub.client(), API, null, 100, 10), 5);

        List<Document> documents = fetcher.syncOrganization("acme", WATERMARK);

        assertEquals(15, documents.size());
        for (int i = 0; i < names.size(); i++) {
            String qualified = "acme/" + names.get(i);
            assertEquals("github:repo:" + qualified, documents.get(i * 3).id());
            assertEquals("github:pr:acme:" + qualified + "/1", documents.get(i * 3 + 1).id());
            assertEquals("github:commit:acme:" + qualified + "/" + names.get(i) + "-sha", documents.get(i * 3 + 2).id());
        }
    }

    @Test
    void shouldAbortBeforeFanOutOnUnsplittableRepositoryName() {
        StubInterceptor stub = new StubInterceptor()
                .json("/orgs/acme/repos", "[" + repository("acme/widget") + ",{\"name\":\"broken\",\"full_name\":\"broken\"}]");
        GitHubActivityFetcher fetcher = new GitHubActivityFetcher(new GitHubClient(stub.client(), API, null, 100, 10), 2);

        UpstreamDataException error = assertThrows(UpstreamDataException.class,
                () -> fetcher.syncOrganization("acme", WATERMARK));

        assertTrue(error.getMessage().contains("'broken'"), error.getMessage());
        assertEquals(1, stub.requests().size());
    }

    @Test
    void shouldFailWholeOrganizationWhenOneRepositoryFails() {
        StubInterceptor stub = new StubInterceptor()
                .json("/orgs/acme/repos", "[" + repository("acme/widget") + "," + repository("acme/gadget") + "]")
                .json("/repos/acme/widget/pulls", "[]")
                .json("/repos/acme/widget/issues", "[]")
                .json("/repos/acme/widget/commits", "[]")
                .on("/repos/acme/gadget/pulls", request -> Stub.status(500, "{\"message\":\"Server Error\"}"));
        GitHubActivityFetcher fetcher = new GitHubActivityFetcher(new GitHubClient(stub.client(), API, null, 100, 10), 2);

        GitHubFetchException error = assertThrows(GitHubFetchException.class,
                () -> fetcher.syncOrganization("acme", WATERMARK));

        assertEquals(500, error.statusCode());
        assertTrue(error.getMessage().contains("acme/gadget"), error.getMessage());
    }

    @Test
    void shouldReturnNothingForEmptyOrganization() throws Exception {
        StubInterceptor stub = new StubInterceptor().json("/orgs/quiet/repos", "[]");
        GitHubActivityFetcher fetcher = new GitHubActivityFetcher(new GitHubClient(stub.client(), API, null, 100, 10), 2);

        assertTrue(fetcher.syncOrganization("quiet", WATERMARK).isEmpty());
    }

    @Test
    void shouldProduceIdenticalRecordsWhenRepeated() throws Exception {
        StubInterceptor stub = new StubInterceptor()
                .json("/repos/acme/widget", repository("acme/widget"))
                .json("/repos/acme/widget/pulls", "[" + pull(42, "2024-02-01T00:00:00Z") + "]")
                .json("/repos/acme/widget/issues", "[" + GitHubClientTest.issue(7, "2024-02-03T00:00:00Z") + "]")
                .json("/repos/acme/widget/commits", "[" + commit("abc123") + "]");
        GitHubActivityFetcher fetcher = new GitHubActivityFetcher(new GitHubClient(stub.client(), API, null, 100, 10), 2);

        List<Document> first = fetcher.syncRepository("acme", "widget", WATERMARK);
        List<Document> second = fetcher.syncRepository("acme", "widget", WATERMARK);

        assertEquals(List.of("github:repo:acme/widget", "github:pr:acme:acme/widget/42",
                "github:issue:acme:acme/widget/7", "github:commit:acme:acme/widget/abc123"),
                first.stream().map(Document::id).toList());
        assertEquals(first, second);
        assertTrue(first.stream().allMatch(document -> document.sourceId().equals("github:acme/widget")));
        assertEquals("Commit: abc123\nAuthor: @octocat\nDate: 2024-03-02T00:00:00Z"
                + "\nURL: https://github.com/acme/widget/commit/abc123\n\nFix build", first.get(3).content());
    }

    @Test
    void shouldRejectNonPositiveConcurrency() {
        GitHubClient client = new GitHubClient(new StubInterceptor().client(), API, null, 100, 10);
        assertThrows(IllegalArgumentException.class, () -> new GitHubActivityFetcher(client, 0));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
