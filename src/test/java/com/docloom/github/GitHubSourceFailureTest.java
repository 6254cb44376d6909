package com.docloom.github;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.docloom.http.StubInterceptor;
import com.docloom.http.StubInterceptor.Stub;
import com.docloom.ingest.IngestionReport;
import com.docloom.ingest.IngestionService;
import com.docloom.model.Document;
import com.docloom.model.SourceType;
import com.docloom.source.LoadRequest;
import com.docloom.source.LoadResult;
import com.docloom.source.MultiSourceLoader;
import com.docloom.source.SourceLoader;
import com.docloom.source.SourceOutcome;
import com.docloom.state.WatermarkStore;

import static com.docloom.github.GitHubClientTest.commit;
import static com.docloom.github.GitHubClientTest.repository;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GitHubSourceFailureTest {
    private static final String API = "https://api.github.com";
    private static final Instant SINCE = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration DEADLINE = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    @Test
    void shouldKeepWatermarkWhenCommitHistoryExceedsPageCap() throws Exception {
        String commits = "/repos/acme/widget/commits";
        StubInterceptor stub = new StubInterceptor()
                .json("/repos/acme/widget", repository("acme/widget"))
                .json("/repos/acme/widget/pulls", "[]")
                .json("/repos/acme/widget/issues", "[]")
                .onPage(commits, "2", request -> Stub.json("[" + commit("old") + "]"))
                .on(commits, request -> Stub.json("[" + commit("new") + "]",
                        Map.of("Link", "<" + API + commits + "?page=2>; rel=\"next\"")));
        List<Document> stored = new ArrayList<>();
        WatermarkStore watermarks = new WatermarkStore(tempDir.resolve("watermarks.json"));
        IngestionService service = new IngestionService(loader(stub, 1), documents -> documents.forEach(stored::add), watermarks);

        IngestionReport report = service.ingest(List.of("github:acme/widget"), SINCE, DEADLINE, false);

        SourceOutcome outcome = report.loadReport().outcomes().get(0);
        assertEquals(SourceOutcome.Status.FAILED, outcome.status());
        assertTrue(outcome.detail().contains("more than 1 pages of results"), outcome.detail());
        assertTrue(stored.isEmpty());
        assertTrue(watermarks.load().isEmpty());
    }

    @Test
    void shouldConfineMalformedTimestampToItsOwnSource() {
        StubInterceptor stub = new StubInterceptor().json("/repos/acme/widget",
                repository("acme/widget").replace("2020-01-01T00:00:00Z", "yesterday"));

        LoadResult result = loader(stub, 10).load(LoadRequest.of(List.of("file:notes.md", "github:acme/widget"), SINCE, DEADLINE));

        assertEquals(List.of("file:notes.md"), result.documents().stream().map(Document::id).toList());
        List<SourceOutcome> outcomes = result.report().outcomes();
        assertEquals(SourceOutcome.Status.LOADED, outcomes.get(0).status());
        assertEquals(SourceOutcome.Status.FAILED, outcomes.get(1).status());
        assertTrue(outcomes.get(1).detail().startsWith("Unparseable timestamp 'yesterday' in field created_at"),
                outcomes.get(1).detail());
    }

    private static MultiSourceLoader loader(StubInterceptor stub, int maxPages) {
        GitHubClient client = new GitHubClient(stub.client(), API, null, 1, maxPages);
        Map<SourceType, SourceLoader> loaders = new EnumMap<>(SourceType.class);
        loaders.put(SourceType.GITHUB, new GitHubSourceLoader(new GitHubActivityFetcher(client, 2), null));
        loaders.put(SourceType.FILE, (descriptor, since) ->
                List.of(new Document("file:" + descriptor.locator(), descriptor.canonical(), "notes", null, null)));
        return new MultiSourceLoader(loaders, 2);
    }
}
