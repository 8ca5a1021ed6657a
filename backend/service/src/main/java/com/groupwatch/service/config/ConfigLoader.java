package com.groupwatch.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.groupwatch.collectors.config.FeedConfig;
import com.groupwatch.collectors.config.MailingListConfig;
import com.groupwatch.collectors.config.SubredditConfig;
import com.groupwatch.core.model.CollectorConfig;
import com.groupwatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static List<CollectorConfig> loadCollectors(Path configDir) {
        return read(configDir.resolve("collectors.json"), new TypeReference<>() {
        });
    }

    public static MailingListConfig loadMailingList(Path configDir) {
        MailingListConfig config = read(configDir.resolve("mailing-list.json"), new TypeReference<>() {
        });
        if (config.archiveUrl() == null || config.archiveUrl().isBlank()) {
            throw new IllegalStateException("archiveUrl is required in " + configDir.resolve("mailing-list.json"));
        }
        return config;
    }

    public static SubredditConfig loadSubreddits(Path configDir) {
        return read(configDir.resolve("subreddits.json"), new TypeReference<>() {
        });
    }

    public static FeedConfig loadFeeds(Path configDir) {
        return read(configDir.resolve("feeds.json"), new TypeReference<>() {
        });
    }

    public static DeliveryConfig loadDelivery(Path configDir, Map<String, String> env) {
        DeliveryConfig config = read(configDir.resolve("delivery.json"), new TypeReference<DeliveryConfig>() {
        });
        return config.withEnvironment(env);
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
