package com.docloom.model;

import java.time.Instant;

public record Message(
        String id,
        MessageSource source,
        String sourceId,
        ChannelType channelType,
        String channelId,
        String accountId,
        String role,
        String content,
        Instant createdAt) {
}
