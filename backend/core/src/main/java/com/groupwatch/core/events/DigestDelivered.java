package com.groupwatch.core.events;

import java.time.Instant;

public record DigestDelivered(
        Instant timestamp,
        String source,
        String channel,
        boolean success,
        int parts
) implements Event {
    @Override
    public String type() {
        return "DigestDelivered";
    }
}
