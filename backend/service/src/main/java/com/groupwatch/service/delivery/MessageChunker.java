package com.groupwatch.service.delivery;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long messages on line boundaries. A single line longer than the limit is cut before
 * any tag or entity the cut would split, or hard when there is no such point.
 */
public final class MessageChunker {
    public static final int TELEGRAM_LIMIT = 4096;

    private MessageChunker() {
    }

    public static List<String> chunk(String text, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (text.length() <= limit) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            int needed = current.length() == 0 ? line.length() : current.length() + 1 + line.length();
            if (needed <= limit) {
                if (current.length() > 0) {
                    current.append('\n');
                }
                current.append(line);
                continue;
            }
            if (current.length() > 0) {
                chunks.add(current.toString());
                current.setLength(0);
            }
            String rest = line;
            while (rest.length() > limit) {
                int cut = safeCut(rest, limit);
                chunks.add(rest.substring(0, cut));
                rest = rest.substring(cut);
            }
            current.append(rest);
        }
        if (current.length() > 0) {
            chunks.add(current.toString());
        }
        return chunks;
    }

    static int safeCut(String line, int limit) {
        int cut = limit;
        int tag = line.lastIndexOf('<', limit - 1);
        if (tag >= 0) {
            int close = line.indexOf('>', tag);
            if (close < 0 || close >= limit) {
                cut = tag;
            }
        }
        int entity = line.lastIndexOf('&', limit - 1);
        if (entity >= 0 && entity < cut) {
            int end = line.indexOf(';', entity);
            if (end < 0 || end >= limit) {
                cut = entity;
            }
        }
        return cut > 0 ? cut : limit;
    }
}
