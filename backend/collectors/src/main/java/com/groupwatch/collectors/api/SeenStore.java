package com.groupwatch.collectors.api;

/**
 * Remembers which items were already announced, per source, across poll cycles.
 */
public interface SeenStore {
    /**
     * Makes {@code source} known.
     *
     * @return {@code true} if the source had never been registered before
     */
    boolean register(String source);

    /**
     * @return {@code true} the first time {@code key} is marked for {@code source}
     */
    boolean markSeen(String source, String key);
}
