package com.docloom.site;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.HttpUrl;

/**
 * Disk layout {@code <root>/sites/<host>/<path segments>/} holding {@code index.html} (stripped
 * page text) and {@code content.txt} (extracted content).
 */
public class SiteCache {
    private static final Logger log = LoggerFactory.getLogger(SiteCache.class);
    static final String PAGE_FILE = "index.html";
    static final String CONTENT_FILE = "content.txt";

    private final Path sitesRoot;

    public SiteCache(Path sourcesRoot) {
        this.sitesRoot = sourcesRoot.resolve("sites");
    }

    public Path directoryFor(HttpUrl url) {
        Path dir = sitesRoot.resolve(safeSegment(url.host()));
        for (String segment : url.pathSegments()) {
            if (!segment.isEmpty()) {
                dir = dir.resolve(safeSegment(segment));
            }
        }
        return dir;
    }

    public void writePage(HttpUrl url, String strippedText) {
        write(directoryFor(url).resolve(PAGE_FILE), strippedText);
    }

    public void writeContent(HttpUrl url, String content) {
        write(directoryFor(url).resolve(CONTENT_FILE), content);
    }

    /**
     * Cached extracted content younger than {@code ttl}, if any.
     */
    public Optional<String> readFresh(HttpUrl url, Duration ttl) {
        Path file = directoryFor(url).resolve(CONTENT_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            Instant modified = Files.getLastModifiedTime(file).toInstant();
            if (modified.plus(ttl).isBefore(Instant.now())) {
                return Optional.empty();
            }
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache entry path={}", file, e);
            return Optional.empty();
        }
    }

    private void write(Path file, String text) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to write cache entry path={}", file, e);
        }
    }

    private static String safeSegment(String segment) {
        if (segment.equals(".") || segment.equals("..")) {
            return "_";
        }
        return segment.replace('/', '_').replace('\\', '_');
    }
}
