package com.docloom.model;

import java.time.Instant;

public record Channel(
        String id,
        String channelId,
        ChannelType channelType,
        MessageSource source,
        String name,
        Instant createdAt,
        Instant updatedAt) {
}
