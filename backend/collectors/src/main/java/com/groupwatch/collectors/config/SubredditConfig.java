package com.groupwatch.collectors.config;

import java.time.Duration;
import java.util.List;

public record SubredditConfig(
        Duration interval,
        String baseUrl,
        String sort,
        int limit,
        String userAgent,
        List<String> subreddits,
        boolean announceBacklog
) {
    public static final String DEFAULT_BASE_URL = "https://www.reddit.com";

    public SubredditConfig {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl;
        sort = sort == null || sort.isBlank() ? "new" : sort;
        limit = limit <= 0 ? 25 : limit;
        userAgent = userAgent == null || userAgent.isBlank() ? "group-watch/1.0" : userAgent;
        subreddits = subreddits == null ? List.of() : List.copyOf(subreddits);
    }
}
