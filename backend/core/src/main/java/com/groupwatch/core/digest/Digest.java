package com.groupwatch.core.digest;

/**
 * A per-poll collection of new items from one source, rendered once for delivery.
 */
public interface Digest {
    /**
     * Human name of the source, e.g. the list name, {@code r/java}, or the feed title.
     */
    String title();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Short count line such as {@code "3 new mails in 2 threads"}.
     */
    String summary();

    String renderText(DigestRenderer renderer);

    String renderHtml(DigestRenderer renderer);

    default String renderText() {
        return renderText(DigestRenderer.plain());
    }

    default String renderHtml() {
        return renderHtml(DigestRenderer.plain());
    }
}
