package com.groupwatch.core.util;

public final class TextUtils {
    private TextUtils() {
    }

    /**
     * Drops leading characters that are neither letters nor digits and upper-cases the first remaining one.
     * {@code "re: build broke"} becomes {@code "Re: build broke"}, {@code "-- weekly"} becomes {@code "Weekly"}.
     */
    public static String capitalizeNoSymbols(String text) {
        int start = 0;
        while (start < text.length()) {
            int codePoint = text.codePointAt(start);
            if (Character.isLetterOrDigit(codePoint)) {
                break;
            }
            start += Character.charCount(codePoint);
        }
        if (start >= text.length()) {
            return "";
        }
        int first = text.codePointAt(start);
        int next = start + Character.charCount(first);
        return new String(Character.toChars(Character.toUpperCase(first))) + text.substring(next);
    }
}
