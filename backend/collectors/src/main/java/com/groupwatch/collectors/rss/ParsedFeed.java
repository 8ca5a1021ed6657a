package com.groupwatch.collectors.rss;

import com.groupwatch.core.model.Article;

import java.util.List;

/**
 * @param title the channel (RSS) or feed (Atom) title, empty when absent
 */
public record ParsedFeed(String title, List<Article> articles) {
}
