package com.docloom.source;

import java.util.List;

public record LoadReport(List<SourceOutcome> outcomes) {

    public LoadReport {
        outcomes = List.copyOf(outcomes);
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(SourceOutcome::isFailure);
    }

    public long count(SourceOutcome.Status status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }

    public int totalDocuments() {
        return outcomes.stream().mapToInt(SourceOutcome::documentCount).sum();
    }
}
