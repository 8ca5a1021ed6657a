package com.groupwatch.collectors.mail;

import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Pipermail keeps one archive per month, e.g. {@code .../pipermail/dev/2026-October/date.html}.
 */
public final class ArchiveUrlTemplate {
    public static final String YEAR = "$Y";
    public static final String MONTH = "$M";

    private ArchiveUrlTemplate() {
    }

    public static String resolve(String template, ZonedDateTime now) {
        return template
                .replace(YEAR, String.valueOf(now.getYear()))
                .replace(MONTH, now.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
    }
}
