package com.docloom.file;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the UTF-8 text files selected by a glob such as {@code docs/*.md}. The walk
 * starts at the longest literal directory prefix of the pattern. A {@code **}{@code /} segment
 * also matches zero directories, so {@code docs/**}{@code /*.md} includes {@code docs/intro.md}.
 */
public final class FileLoader {
    private static final Logger log = LoggerFactory.getLogger(FileLoader.class);
    private static final String GLOB_META = "*?[{";

    private final String pattern;
    private final Path base;
    private final boolean literalBase;
    private final PathMatcher matcher;

    private FileLoader(String pattern, Path base, boolean literalBase, PathMatcher matcher) {
        this.pattern = pattern;
        this.base = base;
        this.literalBase = literalBase;
        this.matcher = matcher;
    }

    public static FileLoader withGlob(String pattern) throws FileLoadException {
        if (pattern == null || pattern.isBlank()) {
            throw new FileLoadException("empty file pattern");
        }
        String normalized = pattern.replace('\\', '/');
        String[] segments = normalized.split("/", -1);
        int firstGlob = -1;
        for (int i = 0; i < segments.length; i++) {
            if (hasGlobMeta(segments[i])) {
                firstGlob = i;
                break;
            }
        }
        if (firstGlob < 0) {
            return new FileLoader(pattern, Path.of(normalized), true, null);
        }

        String prefix = String.join("/", Arrays.copyOfRange(segments, 0, firstGlob));
        String rest = String.join("/", Arrays.copyOfRange(segments, firstGlob, segments.length));
        Path base;
        if (firstGlob == 0) {
            base = Path.of(".");
        } else {
            base = Path.of(prefix.isEmpty() ? "/" : prefix);
        }
        List<PathMatcher> matchers = new ArrayList<>();
        try {
            for (String glob : globVariants(rest)) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            }
        } catch (IllegalArgumentException e) {
            throw new FileLoadException("Invalid glob pattern '" + pattern + "': " + e.getMessage(), e);
        }
        PathMatcher matcher = path -> matchers.stream().anyMatch(candidate -> candidate.matches(path));
        return new FileLoader(pattern, base, firstGlob > 0, matcher);
    }

    /**
     * The glob itself plus every form with one or more {@code **}{@code /} segments dropped.
     */
    static List<String> globVariants(String glob) {
        Set<String> variants = new LinkedHashSet<>();
        variants.add(glob);
        Deque<String> pending = new ArrayDeque<>(variants);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            for (int i = current.indexOf("**/"); i >= 0; i = current.indexOf("**/", i + 1)) {
                if (i == 0 || current.charAt(i - 1) == '/') {
                    String collapsed = current.substring(0, i) + current.substring(i + 3);
                    if (variants.add(collapsed)) {
                        pending.push(collapsed);
                    }
                }
            }
        }
        return List.copyOf(variants);
    }

    /**
     * Files whose contents could not be read as UTF-8 text are logged and left out.
     */
    public List<LoadedFile> readWithPath() throws FileLoadException {
        List<LoadedFile> files = new ArrayList<>();
        for (Path path : matchingPaths()) {
            try {
                files.add(new LoadedFile(path, Files.readString(path, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                log.warn("Skipping unreadable file path={} pattern={}: {}", path, pattern, e.toString());
            }
        }
        return files;
    }

    List<Path> matchingPaths() throws FileLoadException {
        if (matcher == null) {
            if (Files.isRegularFile(base)) {
                return List.of(base);
            }
            throw new FileLoadException("'" + pattern + "' is not a regular file");
        }
        if (!Files.isDirectory(base)) {
            log.debug("Base directory missing base={} pattern={}", base, pattern);
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(base)) {
            return walk.filter(Files::isRegularFile)
                    .filter(path -> matcher.matches(base.relativize(path)))
                    .map(path -> literalBase ? path : base.relativize(path))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new FileLoadException("Failed to list files for '" + pattern + "' under " + base, e);
        }
    }

    private static boolean hasGlobMeta(String segment) {
        for (int i = 0; i < segment.length(); i++) {
            if (GLOB_META.indexOf(segment.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    public record LoadedFile(Path path, String content) {
    }
}
