package com.groupwatch.service.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groupwatch.core.digest.Digest;
import com.groupwatch.core.digest.DigestRenderer;
import com.groupwatch.core.util.JsonUtils;
import com.groupwatch.service.config.TelegramConfig;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts digests to a Telegram chat through the Bot API {@code sendMessage} method, as HTML, split into as many
 * messages as the 4096 character limit requires.
 */
public final class TelegramSender implements DigestSender {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final HttpClient httpClient;
    private final TelegramConfig config;
    private final DigestRenderer renderer;
    private final Duration timeout;

    public TelegramSender(HttpClient httpClient, TelegramConfig config, DigestRenderer renderer, Duration timeout) {
        if (config.token().isBlank()) {
            throw new IllegalStateException("Telegram token is not configured");
        }
        if (config.chatId().isBlank()) {
            throw new IllegalStateException("Telegram chatId is not configured");
        }
        this.httpClient = httpClient;
        this.config = config;
        this.renderer = renderer;
        this.timeout = timeout;
    }

    @Override
    public String channel() {
        return "telegram";
    }

    @Override
    public int send(String heading, Digest digest) {
        String text = renderer.renderHeadingHtml(digest) + "\n\n" + digest.renderHtml(renderer);
        List<String> chunks = MessageChunker.chunk(text.strip(), MessageChunker.TELEGRAM_LIMIT);
        for (String chunk : chunks) {
            sendMessage(chunk);
        }
        return chunks.size();
    }

    private void sendMessage(String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", config.chatId());
        payload.put("text", text);
        payload.put("parse_mode", "HTML");
        payload.put("disable_web_page_preview", config.disableWebPagePreview());

        try {
            HttpRequest request = HttpRequest.newBuilder(endpoint())
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(payload)))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            JsonNode body = parseBody(response.body());
            if (response.statusCode() / 100 != 2 || !body.path("ok").asBoolean(false)) {
                throw new IllegalStateException("Telegram sendMessage failed with status " + response.statusCode()
                        + ": " + body.path("description").asText("no description"));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while sending Telegram message", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Telegram sendMessage request failed", e);
        }
    }

    private URI endpoint() {
        // The token is part of the path, so it never goes into log or exception messages.
        return URI.create(config.apiBaseUrl() + "/bot" + config.token() + "/sendMessage");
    }

    private static JsonNode parseBody(String body) {
        try {
            return MAPPER.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (Exception e) {
            return MAPPER.createObjectNode();
        }
    }
}
