package com.docloom.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private IngestConfig ingest = new IngestConfig();
    private GitHubConfig github = new GitHubConfig();
    private SiteConfig site = new SiteConfig();
    private ExtractionConfig extraction = new ExtractionConfig();
    private HttpConfig http = new HttpConfig();

    public IngestConfig getIngest() {
        return ingest;
    }

    public void setIngest(IngestConfig ingest) {
        this.ingest = ingest == null ? new IngestConfig() : ingest;
    }

    public GitHubConfig getGithub() {
        return github;
    }

    public void setGithub(GitHubConfig github) {
        this.github = github == null ? new GitHubConfig() : github;
    }

    public SiteConfig getSite() {
        return site;
    }

    public void setSite(SiteConfig site) {
        this.site = site == null ? new SiteConfig() : site;
    }

    public ExtractionConfig getExtraction() {
        return extraction;
    }

    public void setExtraction(ExtractionConfig extraction) {
        this.extraction = extraction == null ? new ExtractionConfig() : extraction;
    }

    public HttpConfig getHttp() {
        return http;
    }

    public void setHttp(HttpConfig http) {
        this.http = http == null ? new HttpConfig() : http;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestConfig {
        private List<String> sources = new ArrayList<>();
        private String since;
        private long deadlineMs = 600_000;
        private int sourceConcurrency = 4;
        private String sourcesPath = ".sources";
        private String storePath = ".docloom/store";
        private String statePath = ".docloom/watermarks.json";

        public List<String> getSources() {
            return sources;
        }

        public void setSources(List<String> sources) {
            this.sources = sources == null ? new ArrayList<>() : sources;
        }

        public String getSince() {
            return since;
        }

        public void setSince(String since) {
            this.since = since;
        }

        public long getDeadlineMs() {
            return deadlineMs;
        }

        public void setDeadlineMs(long deadlineMs) {
            this.deadlineMs = deadlineMs;
        }

        public int getSourceConcurrency() {
            return sourceConcurrency;
        }

        public void setSourceConcurrency(int sourceConcurrency) {
            this.sourceConcurrency = sourceConcurrency;
        }

        public String getSourcesPath() {
            return sourcesPath;
        }

        public void setSourcesPath(String sourcesPath) {
            this.sourcesPath = sourcesPath;
        }

        public String getStorePath() {
            return storePath;
        }

        public void setStorePath(String storePath) {
            this.storePath = storePath;
        }

        public String getStatePath() {
            return statePath;
        }

        public void setStatePath(String statePath) {
            this.statePath = statePath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitHubConfig {
        private String apiUrl = "https://api.github.com";
        private String tokenEnv = "GITHUB_TOKEN";
        private int repositoryConcurrency = 4;
        private int perPage = 100;
        private int maxPages = 10;
        private long gitTimeoutMs = 120_000;
        private long maxFileBytes = 1_048_576;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getTokenEnv() {
            return tokenEnv;
        }

        public void setTokenEnv(String tokenEnv) {
            this.tokenEnv = tokenEnv;
        }

        public int getRepositoryConcurrency() {
            return repositoryConcurrency;
        }

        public void setRepositoryConcurrency(int repositoryConcurrency) {
            this.repositoryConcurrency = repositoryConcurrency;
        }

        public int getPerPage() {
            return perPage;
        }

        public void setPerPage(int perPage) {
            this.perPage = perPage;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public long getGitTimeoutMs() {
            return gitTimeoutMs;
        }

        public void setGitTimeoutMs(long gitTimeoutMs) {
            this.gitTimeoutMs = gitTimeoutMs;
        }

        public long getMaxFileBytes() {
            return maxFileBytes;
        }

        public void setMaxFileBytes(long maxFileBytes) {
            this.maxFileBytes = maxFileBytes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SiteConfig {
        private long cacheTtlMs = 0;

        public long getCacheTtlMs() {
            return cacheTtlMs;
        }

        public void setCacheTtlMs(long cacheTtlMs) {
            this.cacheTtlMs = cacheTtlMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtractionConfig {
        private String endpoint = "https://api.openai.com/v1/chat/completions";
        private String model = "gpt-4o-mini";
        private String apiKeyEnv = "OPENAI_API_KEY";
        private int maxInputChars = 100_000;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getMaxInputChars() {
            return maxInputChars;
        }

        public void setMaxInputChars(int maxInputChars) {
            this.maxInputChars = maxInputChars;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HttpConfig {
        private long connectTimeoutMs = 10_000;
        private long readTimeoutMs = 30_000;
        private long callTimeoutMs = 120_000;

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(long readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }

        public long getCallTimeoutMs() {
            return callTimeoutMs;
        }

        public void setCallTimeoutMs(long callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
        }
    }
}
