package com.docloom.git;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains local clones under a cache directory: clones on first use, otherwise fetches and
 * hard-resets to the remote default branch.
 */
public class GitRepositoryManager {
    private static final Logger log = LoggerFactory.getLogger(GitRepositoryManager.class);

    private final GitCommandRunner gitCommandRunner;

    public GitRepositoryManager(Duration timeout) {
        this(new GitCommandRunner(timeout));
    }

    GitRepositoryManager(GitCommandRunner gitCommandRunner) {
        this.gitCommandRunner = gitCommandRunner;
    }

    public Path prepareRepository(String repoUrl, Path cacheDir) throws GitLoadException {
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new IllegalArgumentException("repoUrl must not be blank");
        }
        Path checkout = cacheDir.resolve(directoryName(repoUrl));
        try {
            Files.createDirectories(cacheDir);
        } catch (IOException e) {
            throw new GitLoadException("Failed to create repository cache " + cacheDir, e);
        }

        if (!Files.isDirectory(checkout.resolve(".git"))) {
            log.info("Cloning repository url={} into {}", repoUrl, checkout);
            run("clone", "--depth", "1", repoUrl, checkout.toString());
            return checkout;
        }

        log.info("Updating repository url={} at {}", repoUrl, checkout);
        String dir = checkout.toString();
        run("-C", dir, "fetch", "--prune", "origin");
        String branch = defaultBranch(checkout);
        run("-C", dir, "reset", "--hard");
        run("-C", dir, "clean", "-fd");
        run("-C", dir, "checkout", branch);
        run("-C", dir, "reset", "--hard", "origin/" + branch);
        run("-C", dir, "clean", "-fd");
        return checkout;
    }

    public String headCommit(Path checkout) throws GitLoadException {
        return run("-C", checkout.toString(), "rev-parse", "HEAD").trim();
    }

    String defaultBranch(Path checkout) throws GitLoadException {
        String ref = run("-C", checkout.toString(), "symbolic-ref", "refs/remotes/origin/HEAD").trim();
        int slash = ref.lastIndexOf('/');
        return slash >= 0 ? ref.substring(slash + 1) : ref;
    }

    String directoryName(String repoUrl) {
        String normalized = repoUrl.strip();
        String baseName = normalized;
        int slash = Math.max(baseName.lastIndexOf('/'), baseName.lastIndexOf(':'));
        if (slash >= 0 && slash < baseName.length() - 1) {
            baseName = baseName.substring(slash + 1);
        }
        if (baseName.endsWith(".git")) {
            baseName = baseName.substring(0, baseName.length() - 4);
        }
        baseName = baseName.replaceAll("[^A-Za-z0-9._-]", "-");
        if (baseName.isBlank()) {
            baseName = "repo";
        }
        return baseName + "-" + shortSha256(normalized);
    }

    private static String shortSha256(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String run(String... args) throws GitLoadException {
        GitCommandResult result = gitCommandRunner.run(args);
        if (!result.isSuccess()) {
            log.error("git command failed command='{}' {}", result.commandLine(), result.describe());
            throw new GitLoadException(result.commandLine() + " failed: " + result.describe());
        }
        return result.stdout();
    }
}
