package com.docloom.extract;

import java.util.Objects;

public record ExtractedContent(String content) {
    public ExtractedContent {
        Objects.requireNonNull(content, "content");
    }
}
