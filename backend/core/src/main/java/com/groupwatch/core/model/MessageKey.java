package com.groupwatch.core.model;

import java.util.Objects;

/**
 * Identity of an archived mail. Archive URLs embed the message id, so the URL alone identifies the message.
 */
public record MessageKey(String url) {
    public MessageKey {
        Objects.requireNonNull(url, "url is required");
    }
}
