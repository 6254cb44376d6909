package com.docloom.site;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docloom.extract.ContentExtractor;
import com.docloom.extract.ExtractionException;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Fetches one page, strips it to text and has the extractor keep only the main content.
 */
public class SiteContentExtractor {
    private static final Logger log = LoggerFactory.getLogger(SiteContentExtractor.class);

    private final HttpUrl url;
    private final OkHttpClient httpClient;
    private final ContentExtractor extractor;
    private final SiteCache cache;
    private final Duration cacheTtl;

    public SiteContentExtractor(String url,
            OkHttpClient httpClient,
            ContentExtractor extractor,
            SiteCache cache,
            Duration cacheTtl) throws SiteLoadException {
        HttpUrl parsed = url == null ? null : HttpUrl.parse(url);
        if (parsed == null) {
            throw new SiteLoadException("Invalid site url '" + url + "'");
        }
        this.url = parsed;
        this.httpClient = httpClient;
        this.extractor = extractor;
        this.cache = cache;
        this.cacheTtl = cacheTtl == null ? Duration.ZERO : cacheTtl;
    }

    public String extractContent() throws SiteLoadException {
        if (!cacheTtl.isZero() && !cacheTtl.isNegative()) {
            Optional<String> cached = cache.readFresh(url, cacheTtl);
            if (cached.isPresent()) {
                log.debug("Using cached content url={}", url);
                return cached.get();
            }
        }

        String html = fetch();
        String text = HtmlStripper.strip(HtmlStripper.isolateBody(html));
        cache.writePage(url, text);

        String content;
        try {
            content = extractor.extract(text).content();
        } catch (ExtractionException e) {
            throw new SiteLoadException("Failed to extract content of " + url + ": " + e.getMessage(), e);
        }
        cache.writeContent(url, content);
        log.info("Extracted site url={} strippedChars={} contentChars={}", url, text.length(), content.length());
        return content;
    }

    private String fetch() throws SiteLoadException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new SiteLoadException("Failed to fetch " + url + ": HTTP " + response.code());
            }
            return response.body() == null ? "" : response.body().string();
        } catch (IOException e) {
            throw new SiteLoadException("Failed to fetch " + url + ": " + e.getMessage(), e);
        }
    }
}
