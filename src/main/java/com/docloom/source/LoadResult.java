package com.docloom.source;

import java.util.List;

import com.docloom.model.Document;

public record LoadResult(List<Document> documents, LoadReport report) {

    public LoadResult {
        documents = List.copyOf(documents);
    }
}
