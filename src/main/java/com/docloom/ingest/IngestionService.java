package com.docloom.ingest;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docloom.source.InvalidSourceException;
import com.docloom.source.LoadRequest;
import com.docloom.source.LoadResult;
import com.docloom.source.MultiSourceLoader;
import com.docloom.source.SourceDescriptor;
import com.docloom.source.SourceOutcome;
import com.docloom.state.WatermarkStore;
import com.docloom.storage.DocumentSink;
import com.docloom.storage.StorageException;

/**
 * One ingestion run: load every source since its watermark, store the documents, then move the
 * watermark of each fully loaded source to the instant the run started.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final MultiSourceLoader loader;
    private final DocumentSink sink;
    private final WatermarkStore watermarkStore;
    private final Clock clock;

    public IngestionService(MultiSourceLoader loader, DocumentSink sink, WatermarkStore watermarkStore) {
        this(loader, sink, watermarkStore, Clock.systemUTC());
    }

    IngestionService(MultiSourceLoader loader, DocumentSink sink, WatermarkStore watermarkStore, Clock clock) {
        this.loader = loader;
        this.sink = sink;
        this.watermarkStore = watermarkStore;
        this.clock = clock;
    }

    /**
     * @param defaultSince watermark for sources that have none stored yet; epoch when null
     * @param dryRun       load only; neither the sink nor the watermarks are touched
     */
    public IngestionReport ingest(List<String> sources, Instant defaultSince, Duration deadline, boolean dryRun)
            throws IOException, StorageException {
        Instant runStartedAt = clock.instant();
        Map<String, Instant> watermarks = watermarkStore.load();
        LoadResult result = loader.load(new LoadRequest(sources, defaultSince, watermarks, deadline));

        if (dryRun) {
            log.info("Dry run: loaded documents={} nothing stored", result.documents().size());
            return new IngestionReport(result.report(), 0, runStartedAt);
        }

        if (!result.documents().isEmpty()) {
            sink.addDocuments(result.documents());
        }

        Map<String, Instant> advanced = new TreeMap<>(watermarks);
        int moved = 0;
        for (SourceOutcome outcome : result.report().outcomes()) {
            if (outcome.status() == SourceOutcome.Status.LOADED) {
                advanced.put(canonical(outcome.source()), runStartedAt);
                moved++;
            }
        }
        watermarkStore.save(advanced);
        log.info("Ingestion finished stored={} watermarksAdvanced={} runStartedAt={}",
                result.documents().size(), moved, runStartedAt);
        return new IngestionReport(result.report(), result.documents().size(), runStartedAt);
    }

    private static String canonical(String raw) {
        try {
            return SourceDescriptor.parse(raw).canonical();
        } catch (InvalidSourceException e) {
            throw new IllegalStateException("Loaded source has an invalid descriptor: " + raw, e);
        }
    }
}
