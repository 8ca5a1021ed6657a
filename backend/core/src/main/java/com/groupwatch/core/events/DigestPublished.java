package com.groupwatch.core.events;

import java.time.Instant;

/**
 * A collector found new items for {@code source} and handed a digest of {@code itemCount} entries to delivery.
 */
public record DigestPublished(Instant timestamp, String source, int itemCount) implements Event {
    @Override
    public String type() {
        return "DigestPublished";
    }
}
