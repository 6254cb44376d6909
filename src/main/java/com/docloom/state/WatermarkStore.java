package com.docloom.state;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Last successful sync instant per canonical source, stored as a JSON object of ISO-8601 strings.
 */
public class WatermarkStore {
    private static final Logger log = LoggerFactory.getLogger(WatermarkStore.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path path;

    public WatermarkStore(Path path) {
        this.path = path;
    }

    public Map<String, Instant> load() throws IOException {
        Map<String, Instant> watermarks = new TreeMap<>();
        if (!Files.exists(path)) {
            return watermarks;
        }
        Map<String, String> raw = mapper.readValue(path.toFile(), new TypeReference<Map<String, String>>() {
        });
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            if (entry.getValue() == null) {
                log.warn("Dropping empty watermark source={}", entry.getKey());
                continue;
            }
            try {
                watermarks.put(entry.getKey(), Instant.parse(entry.getValue()));
            } catch (DateTimeParseException e) {
                log.warn("Dropping unreadable watermark source={} value={}", entry.getKey(), entry.getValue());
            }
        }
        return watermarks;
    }

    public void save(Map<String, Instant> watermarks) throws IOException {
        Map<String, String> raw = new TreeMap<>();
        watermarks.forEach((source, instant) -> raw.put(source, instant.toString()));
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), raw);
    }

    public Path path() {
        return path;
    }
}
