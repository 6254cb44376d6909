package com.docloom.github;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docloom.model.Document;
import com.docloom.source.UpstreamDataException;

/**
 * Incremental sync of GitHub activity. Repositories of an organization are fetched in parallel on
 * a bounded pool; the output keeps organization listing order and, per repository, the order
 * summary, pull requests, issues, commits.
 */
public class GitHubActivityFetcher {
    private static final Logger log = LoggerFactory.getLogger(GitHubActivityFetcher.class);

    private final GitHubClient client;
    private final int repositoryConcurrency;

    public GitHubActivityFetcher(GitHubClient client, int repositoryConcurrency) {
        if (repositoryConcurrency <= 0) {
            throw new IllegalArgumentException("repositoryConcurrency must be positive");
        }
        this.client = client;
        this.repositoryConcurrency = repositoryConcurrency;
    }

    public List<Document> syncOrganization(String org, Instant since) throws GitHubFetchException {
        String sourceId = "github:" + org;
        List<GitHubRepository> repositories = client.listOrgRepositories(org);
        List<RepositoryName> names = new ArrayList<>();
        for (GitHubRepository repository : repositories) {
            names.add(RepositoryName.parse(repository.fullName()).orElseThrow(() -> new UpstreamDataException(
                    "Repository name '" + repository.fullName() + "' in organization " + org + " is not owner/repo")));
        }
        log.info("Syncing organization={} repositories={} since={}", org, repositories.size(), since);
        if (repositories.isEmpty()) {
            return List.of();
        }

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(repositoryConcurrency, repositories.size()), new RepositoryThreadFactory(org));
        try {
            List<Future<List<Document>>> futures = new ArrayList<>();
            for (int i = 0; i < repositories.size(); i++) {
                GitHubRepository repository = repositories.get(i);
                RepositoryName name = names.get(i);
                futures.add(executor.submit(() -> fetchRepository(name, repository, since, sourceId)));
            }
            List<Document> documents = new ArrayList<>();
            for (Future<List<Document>> future : futures) {
                documents.addAll(join(future, org));
            }
            return documents;
        } finally {
            executor.shutdownNow();
        }
    }

    public List<Document> syncRepository(String owner, String repo, Instant since) throws GitHubFetchException {
        RepositoryName name = new RepositoryName(owner, repo);
        GitHubRepository repository = client.getRepository(owner, repo);
        return fetchRepository(name, repository, since, "github:" + name.qualified());
    }

    private List<Document> fetchRepository(RepositoryName name, GitHubRepository repository, Instant since, String sourceId)
            throws GitHubFetchException {
        List<Document> documents = new ArrayList<>();
        documents.add(GitHubDocuments.repository(name, repository, sourceId));

        List<GitHubPullRequest> pulls = client.listPullRequests(name.owner(), name.repo(), since);
        pulls.forEach(pull -> documents.add(GitHubDocuments.pullRequest(name, pull, sourceId)));

        List<GitHubIssue> issues = client.listIssues(name.owner(), name.repo(), since);
        issues.forEach(issue -> documents.add(GitHubDocuments.issue(name, issue, sourceId)));

        List<GitHubCommit> commits = client.listCommits(name.owner(), name.repo(), since);
        commits.forEach(commit -> documents.add(GitHubDocuments.commit(name, commit, sourceId)));

        log.info("Synced repository={} pulls={} issues={} commits={}",
                name.qualified(), pulls.size(), issues.size(), commits.size());
        return documents;
    }

    private static List<Document> join(Future<List<Document>> future, String org) throws GitHubFetchException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubFetchException("Interrupted while syncing organization " + org, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GitHubFetchException) {
                throw (GitHubFetchException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new GitHubFetchException("Failed to sync organization " + org, cause);
        }
    }

    private static final class RepositoryThreadFactory implements ThreadFactory {
        private final String org;
        private final AtomicInteger counter = new AtomicInteger();

        private RepositoryThreadFactory(String org) {
            this.org = org;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "github-" + org + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
