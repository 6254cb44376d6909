package com.docloom.ingest;

import java.time.Instant;

import com.docloom.source.LoadReport;

public record IngestionReport(LoadReport loadReport, int storedDocuments, Instant runStartedAt) {
}
