package com.groupwatch.core.util;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HtmlUtils {
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]*>", Pattern.DOTALL);
    private static final Pattern ENTITY_PATTERN = Pattern.compile("&(#x[0-9a-fA-F]+|#[0-9]+|[a-zA-Z]+);");
    private static final Map<String, String> NAMED_ENTITIES = Map.of(
            "amp", "&",
            "lt", "<",
            "gt", ">",
            "quot", "\"",
            "apos", "'",
            "nbsp", " "
    );

    private HtmlUtils() {
    }

    /**
     * Escapes text for use as HTML element content or a double-quoted attribute value.
     */
    public static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#x27;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    public static String unescape(String html) {
        Matcher matcher = ENTITY_PATTERN.matcher(html);
        StringBuilder out = new StringBuilder(html.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(decodeEntity(matcher.group(1), matcher.group())));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Removes markup, decodes entities and collapses whitespace.
     */
    public static String toPlainText(String html) {
        String withoutTags = TAG_PATTERN.matcher(html).replaceAll(" ");
        return unescape(withoutTags).replaceAll("\\s+", " ").trim();
    }

    private static String decodeEntity(String body, String original) {
        try {
            if (body.startsWith("#x") || body.startsWith("#X")) {
                return new String(Character.toChars(Integer.parseInt(body.substring(2), 16)));
            }
            if (body.startsWith("#")) {
                return new String(Character.toChars(Integer.parseInt(body.substring(1))));
            }
        } catch (IllegalArgumentException ex) {
            return original;
        }
        return NAMED_ENTITIES.getOrDefault(body.toLowerCase(java.util.Locale.ROOT), original);
    }
}
