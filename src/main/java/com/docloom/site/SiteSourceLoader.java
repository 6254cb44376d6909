package com.docloom.site;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.docloom.extract.ContentExtractor;
import com.docloom.model.Document;
import com.docloom.model.DocumentMetadata;
import com.docloom.model.SourceType;
import com.docloom.source.SourceDescriptor;
import com.docloom.source.SourceLoader;

import okhttp3.OkHttpClient;

public class SiteSourceLoader implements SourceLoader {
    private final OkHttpClient httpClient;
    private final ContentExtractor extractor;
    private final SiteCache cache;
    private final Duration cacheTtl;

    public SiteSourceLoader(OkHttpClient httpClient, ContentExtractor extractor, Path sourcesRoot, Duration cacheTtl) {
        this.httpClient = httpClient;
        this.extractor = extractor;
        this.cache = new SiteCache(sourcesRoot);
        this.cacheTtl = cacheTtl;
    }

    /**
     * Sites have no incremental mode; {@code since} is ignored.
     */
    @Override
    public List<Document> load(SourceDescriptor descriptor, Instant since) throws SiteLoadException {
        String url = descriptor.locator();
        String content = new SiteContentExtractor(url, httpClient, extractor, cache, cacheTtl).extractContent();
        String id = descriptor.canonical();
        return List.of(new Document(id, id, content, null, DocumentMetadata.of(SourceType.SITE, url)));
    }
}
