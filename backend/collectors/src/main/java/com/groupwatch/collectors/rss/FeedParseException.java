package com.groupwatch.collectors.rss;

public class FeedParseException extends RuntimeException {
    public FeedParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
