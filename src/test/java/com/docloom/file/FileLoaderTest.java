package com.docloom.file;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.docloom.model.Document;
import com.docloom.source.SourceDescriptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileLoaderTest {

    @TempDir
    Path tempDir;

    private String root;

    @BeforeEach
    void setUp() throws Exception {
        root = tempDir.toString().replace('\\', '/');
        Files.createDirectories(tempDir.resolve("docs/guides"));
        Files.writeString(tempDir.resolve("docs/intro.md"), "# Intro");
        Files.writeString(tempDir.resolve("docs/notes.txt"), "plain notes");
        Files.writeString(tempDir.resolve("docs/guides/setup.md"), "# Setup");
        Files.write(tempDir.resolve("docs/broken.md"), new byte[] { (byte) 0xC3, (byte) 0x28 });
    }

    @Test
    void shouldMatchGlobBelowLiteralPrefix() throws Exception {
        List<FileLoader.LoadedFile> files = FileLoader.withGlob(root + "/docs/*.md").readWithPath();

        assertEquals(List.of(tempDir.resolve("docs/intro.md")), files.stream().map(FileLoader.LoadedFile::path).toList());
        assertEquals("# Intro", files.get(0).content());
    }

    @Test
    void shouldCrossDirectoriesWithDoubleStar() throws Exception {
        List<Path> paths = FileLoader.withGlob(root + "/docs/**.md").matchingPaths();

        assertEquals(List.of(
                tempDir.resolve("docs/broken.md"),
                tempDir.resolve("docs/guides/setup.md"),
                tempDir.resolve("docs/intro.md")), paths);
    }

    @Test
    void shouldLetDoubleStarSegmentMatchZeroDirectories() throws Exception {
        List<Path> paths = FileLoader.withGlob(root + "/docs/**/*.md").matchingPaths();

        assertEquals(List.of(
                tempDir.resolve("docs/broken.md"),
                tempDir.resolve("docs/guides/setup.md"),
                tempDir.resolve("docs/intro.md")), paths);
    }

    @Test
    void shouldExpandEveryDoubleStarSegment() {
        assertEquals(List.of("**/a/**/*.md", "a/**/*.md", "**/a/*.md", "a/*.md"), FileLoader.globVariants("**/a/**/*.md"));
        assertEquals(List.of("*.md"), FileLoader.globVariants("*.md"));
    }

    @Test
    void shouldSkipFilesThatAreNotUtf8() throws Exception {
        List<FileLoader.LoadedFile> files = FileLoader.withGlob(root + "/docs/**.md").readWithPath();

        assertEquals(2, files.size());
        assertTrue(files.stream().noneMatch(file -> file.path().endsWith("broken.md")));
    }

    @Test
    void shouldLoadLiteralFile() throws Exception {
        List<FileLoader.LoadedFile> files = FileLoader.withGlob(root + "/docs/notes.txt").readWithPath();

        assertEquals(1, files.size());
        assertEquals("plain notes", files.get(0).content());
    }

    @Test
    void shouldFailForMissingLiteralFile() {
        assertThrows(FileLoadException.class, () -> FileLoader.withGlob(root + "/docs/missing.txt").readWithPath());
        assertThrows(FileLoadException.class, () -> FileLoader.withGlob(" "));
    }

    @Test
    void shouldReturnNothingWhenGlobBaseIsMissing() throws Exception {
        assertTrue(FileLoader.withGlob(root + "/absent/*.md").readWithPath().isEmpty());
    }

    @Test
    void shouldBuildFileDocuments() throws Exception {
        String pattern = root + "/docs/*.txt";

        List<Document> documents = new FileSourceLoader().load(SourceDescriptor.parse("file:" + pattern), Instant.EPOCH);

        assertEquals(1, documents.size());
        Document document = documents.get(0);
        assertEquals("file:" + root + "/docs/notes.txt", document.id());
        assertEquals("file:" + pattern, document.sourceId());
        assertEquals("plain notes", document.content());
        assertEquals("file", document.metadata().path("source_type").asText());
        assertEquals(pattern, document.metadata().path("source_url").asText());
    }
}
