package com.docloom.git;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.docloom.model.Document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GitRepositoryLoaderTest {
    private static final String URL = "https://github.com/acme/widget.git";

    @TempDir
    Path tempDir;

    @Test
    void shouldReadTextFilesAndSkipGitDirectoryBinariesAndLargeFiles() throws Exception {
        RecordingRunner runner = new RecordingRunner()
                .answer("rev-parse", RecordingRunner.ok("0123abcd"))
                .onRun("clone", command -> populate(Path.of(command[command.length - 1])));
        GitRepositoryLoader loader = new GitRepositoryLoader(new GitRepositoryManager(runner), tempDir, 64);

        List<Document> documents = loader.load(URL, "github:" + URL);

        assertEquals(List.of("github:file:" + URL + ":README.md", "github:file:" + URL + ":src/Main.java"),
                documents.stream().map(Document::id).toList());
        Document readme = documents.get(0);
        assertEquals("github:" + URL, readme.sourceId());
        assertEquals("# Widget", readme.content());
        assertEquals("github", readme.metadata().path("source_type").asText());
        assertEquals(URL, readme.metadata().path("source_url").asText());
        assertEquals("README.md", readme.metadata().path("path").asText());
        assertEquals("0123abcd", readme.metadata().path("commit").asText());
        assertFalse(documents.stream().anyMatch(document -> document.id().contains(".git/")));
    }

    @Test
    void shouldDetectNulBytesAsBinary() {
        assertTrue(GitRepositoryLoader.isBinary(new byte[] { 'a', 0, 'b' }));
        assertFalse(GitRepositoryLoader.isBinary("plain text".getBytes(StandardCharsets.UTF_8)));
        assertFalse(GitRepositoryLoader.isBinary(new byte[0]));
    }

    private static void populate(Path checkout) {
        try {
            Files.createDirectories(checkout.resolve(".git"));
            Files.writeString(checkout.resolve(".git/config"), "[core]");
            Files.writeString(checkout.resolve("README.md"), "# Widget");
            Files.createDirectories(checkout.resolve("src"));
            Files.writeString(checkout.resolve("src/Main.java"), "class Main {}");
            Files.write(checkout.resolve("logo.png"), new byte[] { (byte) 0x89, 'P', 'N', 'G', 0, 0 });
            Files.writeString(checkout.resolve("huge.txt"), "x".repeat(65));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
