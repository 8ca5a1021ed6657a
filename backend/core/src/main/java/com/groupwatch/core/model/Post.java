package com.groupwatch.core.model;

import java.util.Objects;

/**
 * A subreddit submission. Self posts carry no separate comments link; link posts point their comments link at
 * the supplied discussion URL, or at {@code url} when none was supplied.
 */
public record Post(String title, String url, boolean isSelf, String comments) {
    public Post {
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(url, "url is required");
        if (isSelf) {
            comments = null;
        } else if (comments == null || comments.isBlank()) {
            comments = url;
        }
    }

    public Post(String title, String url, boolean isSelf) {
        this(title, url, isSelf, null);
    }

    public boolean hasComments() {
        return comments != null;
    }
}
