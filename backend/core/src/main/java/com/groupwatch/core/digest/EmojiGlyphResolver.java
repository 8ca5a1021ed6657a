package com.groupwatch.core.digest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.groupwatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves emoji aliases from a JSON table of {@code alias -> emoji}. The bundled table lives at
 * {@value #DEFAULT_RESOURCE}.
 */
public final class EmojiGlyphResolver implements GlyphResolver {
    public static final String DEFAULT_RESOURCE = "emoji-aliases.json";
    private static final Logger LOGGER = Logger.getLogger(EmojiGlyphResolver.class.getName());

    private final Map<String, String> aliases;

    public EmojiGlyphResolver(Map<String, String> aliases) {
        this.aliases = Map.copyOf(aliases);
    }

    /**
     * Loads the bundled table, or returns {@link GlyphResolver#none()} when it is missing or unreadable so that
     * renderers fall back to plain markers.
     */
    public static GlyphResolver fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    static GlyphResolver fromClasspath(String resource) {
        try (InputStream in = EmojiGlyphResolver.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                LOGGER.info("Emoji table " + resource + " not found; using plain markers");
                return GlyphResolver.none();
            }
            Map<String, String> table = JsonUtils.objectMapper().readValue(in, new TypeReference<>() {
            });
            return new EmojiGlyphResolver(table);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Unreadable emoji table " + resource + "; using plain markers", e);
            return GlyphResolver.none();
        }
    }

    @Override
    public Optional<String> resolve(String alias) {
        return Optional.ofNullable(aliases.get(alias));
    }
}
