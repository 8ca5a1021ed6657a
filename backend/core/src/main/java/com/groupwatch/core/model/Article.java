package com.groupwatch.core.model;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A feed entry. {@code publishedAt} keeps the zone reported by the feed.
 */
public record Article(String title, String description, String url, ZonedDateTime publishedAt) {
    public Article {
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(publishedAt, "publishedAt is required");
        description = description == null ? "" : description;
    }
}
