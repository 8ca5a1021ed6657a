package com.groupwatch.service.config;

/**
 * @param chatId numeric group id or {@code @channelname}
 */
public record TelegramConfig(
        boolean enabled,
        String apiBaseUrl,
        String token,
        String chatId,
        boolean disableWebPagePreview
) {
    public static final String DEFAULT_API_BASE_URL = "https://api.telegram.org";

    public TelegramConfig {
        apiBaseUrl = apiBaseUrl == null || apiBaseUrl.isBlank() ? DEFAULT_API_BASE_URL : apiBaseUrl;
        token = token == null ? "" : token.trim();
        chatId = chatId == null ? "" : chatId.trim();
    }

    public TelegramConfig withToken(String override) {
        return new TelegramConfig(enabled, apiBaseUrl, override, chatId, disableWebPagePreview);
    }
}
