package com.groupwatch.collectors.config;

/**
 * @param title shown as the digest title; the feed's own title is used when blank
 */
public record FeedSourceConfig(String title, String url) {
}
