package com.docloom.github;

import java.time.Instant;
import java.util.List;

import com.docloom.git.GitRepositoryLoader;
import com.docloom.model.Document;
import com.docloom.source.SourceDescriptor;
import com.docloom.source.SourceLoadException;
import com.docloom.source.SourceLoader;

/**
 * {@code github:<org>} syncs an organization, {@code github:<owner>/<repo>} a single repository and
 * {@code github:<clone url>} reads the files of a clone.
 */
public class GitHubSourceLoader implements SourceLoader {
    private final GitHubActivityFetcher fetcher;
    private final GitRepositoryLoader repositoryLoader;

    public GitHubSourceLoader(GitHubActivityFetcher fetcher, GitRepositoryLoader repositoryLoader) {
        this.fetcher = fetcher;
        this.repositoryLoader = repositoryLoader;
    }

    @Override
    public List<Document> load(SourceDescriptor descriptor, Instant since) throws SourceLoadException {
        String locator = descriptor.locator();
        if (locator.contains("://")) {
            return repositoryLoader.load(locator, descriptor.canonical());
        }
        if (locator.contains("/")) {
            RepositoryName name = RepositoryName.parse(locator)
                    .orElseThrow(() -> new SourceLoadException("'" + locator + "' is not an owner/repo name"));
            return fetcher.syncRepository(name.owner(), name.repo(), since);
        }
        return fetcher.syncOrganization(locator, since);
    }
}
