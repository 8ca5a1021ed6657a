package com.groupwatch.collectors.config;

import java.time.Duration;
import java.util.List;

public record FeedConfig(
        Duration interval,
        List<FeedSourceConfig> feeds,
        boolean announceBacklog
) {
    public FeedConfig {
        feeds = feeds == null ? List.of() : List.copyOf(feeds);
    }
}
