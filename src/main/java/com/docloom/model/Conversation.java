package com.docloom.model;

import java.time.Instant;

public record Conversation(
        String id,
        String userId,
        String title,
        Instant createdAt,
        Instant updatedAt) {
}
