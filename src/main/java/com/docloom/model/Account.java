package com.docloom.model;

import java.time.Instant;

public record Account(
        long id,
        String sourceId,
        String name,
        MessageSource source,
        Instant createdAt,
        Instant updatedAt) {
}
