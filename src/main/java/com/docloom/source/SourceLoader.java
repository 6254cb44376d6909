package com.docloom.source;

import java.time.Instant;
import java.util.List;

import com.docloom.model.Document;

public interface SourceLoader {
    /**
     * @param since watermark; loaders without incremental support ignore it
     */
    List<Document> load(SourceDescriptor descriptor, Instant since) throws SourceLoadException;
}
