package com.docloom.source;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * @param since      watermark used for sources without a stored one
 * @param watermarks per-source watermarks keyed by {@link SourceDescriptor#canonical()}
 * @param deadline   budget for the whole load
 */
public record LoadRequest(List<String> sources, Instant since, Map<String, Instant> watermarks, Duration deadline) {

    public LoadRequest {
        sources = List.copyOf(sources);
        since = since == null ? Instant.EPOCH : since;
        watermarks = watermarks == null ? Map.of() : Map.copyOf(watermarks);
        if (deadline == null || deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException("deadline must be positive");
        }
    }

    public static LoadRequest of(List<String> sources, Instant since, Duration deadline) {
        return new LoadRequest(sources, since, Map.of(), deadline);
    }

    public Instant sinceFor(SourceDescriptor descriptor) {
        return watermarks.getOrDefault(descriptor.canonical(), since);
    }
}
