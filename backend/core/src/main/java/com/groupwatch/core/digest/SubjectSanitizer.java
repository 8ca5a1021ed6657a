package com.groupwatch.core.digest;

import java.util.regex.Pattern;

/**
 * Strips the list tag Mailman prepends to subjects, e.g. {@code "[Dev] Build broke"} becomes {@code "Build broke"}.
 */
public final class SubjectSanitizer {
    private static final Pattern REPLY_PREFIX = Pattern.compile(
            "^(?:(?:re|fw|fwd)\\s*(?:\\[\\d+])?\\s*:\\s*)+",
            Pattern.CASE_INSENSITIVE
    );

    private SubjectSanitizer() {
    }

    /**
     * Returns the text starting two characters after the first {@code ']'} (the bracket and one separator).
     * Subjects without a bracket are returned unchanged; a cut past the end yields the empty string.
     */
    public static String sanitize(String rawSubject) {
        int bracket = rawSubject.indexOf(']');
        if (bracket < 0) {
            return rawSubject;
        }
        int start = bracket + 2;
        if (start >= rawSubject.length()) {
            return "";
        }
        return rawSubject.substring(start);
    }

    /**
     * Key under which a sanitized subject is threaded: leading reply and forward markers ({@code Re:},
     * {@code Fwd:}, {@code Re[2]:}) are dropped so a reply joins the thread it answers.
     */
    public static String threadKey(String subject) {
        return REPLY_PREFIX.matcher(subject).replaceFirst("");
    }
}
