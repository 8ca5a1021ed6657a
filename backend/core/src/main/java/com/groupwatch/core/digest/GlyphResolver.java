package com.groupwatch.core.digest;

import java.util.Optional;

/**
 * Optional capability mapping a glyph alias (for example {@code "point_right"}) to its literal text.
 */
@FunctionalInterface
public interface GlyphResolver {
    Optional<String> resolve(String alias);

    static GlyphResolver none() {
        return alias -> Optional.empty();
    }
}
