package com.groupwatch.service.delivery;

import com.groupwatch.core.digest.Digest;

/**
 * One outbound channel for digests.
 */
public interface DigestSender {
    /**
     * Short channel name used in events and logs, e.g. {@code telegram}.
     */
    String channel();

    /**
     * Delivers {@code digest}.
     *
     * @return the number of messages that went out
     * @throws IllegalStateException if the channel rejected or could not be reached
     */
    int send(String heading, Digest digest);
}
