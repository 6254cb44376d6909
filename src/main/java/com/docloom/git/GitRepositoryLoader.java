package com.docloom.git;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docloom.model.Document;
import com.docloom.model.DocumentMetadata;
import com.docloom.model.SourceType;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Clones a repository into the sources cache and yields one document per text file.
 */
public class GitRepositoryLoader {
    private static final Logger log = LoggerFactory.getLogger(GitRepositoryLoader.class);
    private static final int BINARY_PROBE_BYTES = 8192;

    private final GitRepositoryManager repositoryManager;
    private final Path cacheDir;
    private final long maxFileBytes;

    public GitRepositoryLoader(GitRepositoryManager repositoryManager, Path cacheDir, long maxFileBytes) {
        this.repositoryManager = repositoryManager;
        this.cacheDir = cacheDir;
        this.maxFileBytes = maxFileBytes;
    }

    public List<Document> load(String repoUrl, String sourceId) throws GitLoadException {
        Path checkout = repositoryManager.prepareRepository(repoUrl, cacheDir);
        String commit = repositoryManager.headCommit(checkout);

        List<Path> files;
        try (Stream<Path> walk = Files.walk(checkout)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(path -> !checkout.relativize(path).startsWith(".git"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new GitLoadException("Failed to list files of " + repoUrl + " at " + checkout, e);
        }

        List<Document> documents = new ArrayList<>();
        int skipped = 0;
        for (Path file : files) {
            String relative = checkout.relativize(file).toString().replace('\\', '/');
            byte[] bytes;
            try {
                if (Files.size(file) > maxFileBytes) {
                    skipped++;
                    continue;
                }
                bytes = Files.readAllBytes(file);
            } catch (IOException e) {
                log.warn("Skipping unreadable file {} in {}", relative, repoUrl, e);
                skipped++;
                continue;
            }
            if (isBinary(bytes)) {
                skipped++;
                continue;
            }
            ObjectNode metadata = DocumentMetadata.of(SourceType.GITHUB, repoUrl);
            metadata.put("path", relative);
            metadata.put("commit", commit);
            documents.add(new Document(
                    "github:file:" + repoUrl + ":" + relative,
                    sourceId,
                    new String(bytes, StandardCharsets.UTF_8),
                    null,
                    metadata));
        }
        log.info("Read repository url={} commit={} files={} skipped={}", repoUrl, commit, documents.size(), skipped);
        return documents;
    }

    static boolean isBinary(byte[] bytes) {
        int limit = Math.min(bytes.length, BINARY_PROBE_BYTES);
        for (int i = 0; i < limit; i++) {
            if (bytes[i] == 0) {
                return true;
            }
        }
        return false;
    }
}
