package com.docloom;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docloom.extract.ContentExtractors;
import com.docloom.file.FileSourceLoader;
import com.docloom.git.GitRepositoryLoader;
import com.docloom.git.GitRepositoryManager;
import com.docloom.github.GitHubActivityFetcher;
import com.docloom.github.GitHubClient;
import com.docloom.github.GitHubSourceLoader;
import com.docloom.http.HttpClients;
import com.docloom.ingest.IngestionReport;
import com.docloom.ingest.IngestionService;
import com.docloom.model.SourceType;
import com.docloom.runtime.AppConfig;
import com.docloom.site.SiteSourceLoader;
import com.docloom.source.MultiSourceLoader;
import com.docloom.source.SourceLoader;
import com.docloom.source.SourceOutcome;
import com.docloom.state.WatermarkStore;
import com.docloom.storage.EmbeddingServices;
import com.docloom.storage.KnowledgeStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "docloom",
        mixinStandardHelpOptions = true,
        version = "docloom 0.1.0",
        description = "Loads GitHub activity, web pages and local files into the knowledge store.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = { "-s", "--source" }, description = "Source descriptor <type>:<locator>; replaces the configured list when given")
    List<String> sources;

    @Option(names = "--since", description = "ISO-8601 watermark for sources without a stored one")
    String since;

    @Option(names = "--deadline-ms", description = "Budget for loading all sources")
    Long deadlineMs;

    @Option(names = "--store-path", description = "Directory of the knowledge store tables")
    Path storePath;

    @Option(names = "--state-path", description = "Path of the watermark state file")
    Path statePath;

    @Option(names = "--sources-path", description = "Directory for site caches and repository clones")
    Path sourcesPath;

    @Option(names = "--dry-run", description = "Load sources without storing documents or advancing watermarks", defaultValue = "false")
    boolean dryRun;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        AppConfig.IngestConfig ingest = config.getIngest();

        List<String> requested = sources == null || sources.isEmpty() ? ingest.getSources() : sources;
        if (requested.isEmpty()) {
            log.error("No sources given; pass --source or set ingest.sources in {}", configPath);
            return 2;
        }
        Instant defaultSince;
        try {
            defaultSince = parseSince(since != null ? since : ingest.getSince());
        } catch (DateTimeParseException e) {
            log.error("Invalid --since value '{}': {}", since != null ? since : ingest.getSince(), e.getMessage());
            return 2;
        }
        long deadline = deadlineMs != null ? deadlineMs : ingest.getDeadlineMs();
        if (deadline <= 0) {
            log.error("Deadline must be positive, got {} ms", deadline);
            return 2;
        }

        Path sourcesRoot = sourcesPath != null ? sourcesPath : Path.of(ingest.getSourcesPath());
        Path store = storePath != null ? storePath : Path.of(ingest.getStorePath());
        Path state = statePath != null ? statePath : Path.of(ingest.getStatePath());
        log.info("Using config file: {}", configPath);
        log.info("Ingest sources={} since={} deadlineMs={} store={} state={} dryRun={}",
                requested.size(), defaultSince, deadline, store, state, dryRun);

        OkHttpClient httpClient = HttpClients.create(config.getHttp());
        MultiSourceLoader loader = new MultiSourceLoader(loaders(config, httpClient, sourcesRoot), ingest.getSourceConcurrency());
        KnowledgeStore knowledgeStore = KnowledgeStore.open(store, EmbeddingServices.fromEnvironment(httpClient));
        IngestionService ingestionService = new IngestionService(loader, knowledgeStore, new WatermarkStore(state));

        IngestionReport report = ingestionService.ingest(requested, defaultSince, Duration.ofMillis(deadline), dryRun);
        for (SourceOutcome outcome : report.loadReport().outcomes()) {
            log.info("Source source={} status={} documents={} detail={}",
                    outcome.source(),
                    outcome.status(),
                    outcome.documentCount(),
                    outcome.detail().isBlank() ? "none" : outcome.detail());
        }
        return report.loadReport().hasFailures() ? 1 : 0;
    }

    static Map<SourceType, SourceLoader> loaders(AppConfig config, OkHttpClient httpClient, Path sourcesRoot) {
        AppConfig.GitHubConfig github = config.getGithub();
        String tokenEnv = github.getTokenEnv();
        String token = tokenEnv == null ? null : System.getenv(tokenEnv);
        GitHubClient client = new GitHubClient(httpClient, github.getApiUrl(), token, github.getPerPage(), github.getMaxPages());
        GitRepositoryLoader repositoryLoader = new GitRepositoryLoader(
                new GitRepositoryManager(Duration.ofMillis(github.getGitTimeoutMs())),
                sourcesRoot.resolve("repos"),
                github.getMaxFileBytes());

        Map<SourceType, SourceLoader> loaders = new EnumMap<>(SourceType.class);
        loaders.put(SourceType.GITHUB, new GitHubSourceLoader(
                new GitHubActivityFetcher(client, github.getRepositoryConcurrency()), repositoryLoader));
        loaders.put(SourceType.SITE, new SiteSourceLoader(
                httpClient,
                ContentExtractors.fromConfig(config.getExtraction(), httpClient),
                sourcesRoot,
                Duration.ofMillis(config.getSite().getCacheTtlMs())));
        loaders.put(SourceType.FILE, new FileSourceLoader());
        return loaders;
    }

    static Instant parseSince(String value) {
        return value == null || value.isBlank() ? Instant.EPOCH : Instant.parse(value.trim());
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
