package com.groupwatch.collectors.config;

import java.time.Duration;

/**
 * @param archiveUrl pipermail {@code date.html} URL; {@code $Y} and {@code $M} stand for the current year and
 *                   English month name, e.g. {@code https://lists.example.org/pipermail/dev/$Y-$M/date.html}
 */
public record MailingListConfig(
        Duration interval,
        String listName,
        String archiveUrl,
        boolean announceBacklog
) {
}
