package com.groupwatch.collectors.api;

public record SourceOutcome(String source, boolean success, int fetchedItems, int newItems) {
    public static SourceOutcome failed(String source) {
        return new SourceOutcome(source, false, 0, 0);
    }
}
