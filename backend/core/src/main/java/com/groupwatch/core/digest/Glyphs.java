package com.groupwatch.core.digest;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The one place renderers turn glyph aliases into text. Anything the resolver cannot supply becomes
 * {@link #FALLBACK}.
 */
public final class Glyphs {
    public static final String MARKER = "point_right";
    public static final String CLOCK = "watch";
    public static final String MAIL = "email";
    public static final String DISCUSSION = "speech_balloon";
    public static final String NEWS = "newspaper";
    public static final String FALLBACK = "-";

    private static final Logger LOGGER = Logger.getLogger(Glyphs.class.getName());

    private Glyphs() {
    }

    public static String resolve(GlyphResolver resolver, String alias) {
        if (resolver == null) {
            return FALLBACK;
        }
        try {
            Optional<String> glyph = resolver.resolve(alias);
            return glyph == null ? FALLBACK : glyph.filter(value -> !value.isBlank()).orElse(FALLBACK);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.FINE, "Glyph resolver failed for alias " + alias, ex);
            return FALLBACK;
        }
    }
}
