package com.groupwatch.service.config;

import java.util.Map;

/**
 * @param emoji render decorative glyphs as emoji; when off every glyph falls back to a dash
 */
public record DeliveryConfig(TelegramConfig telegram, SmtpConfig smtp, boolean emoji) {
    public static final String TELEGRAM_TOKEN_ENV = "TELEGRAM_TOKEN";
    public static final String SMTP_PASSWORD_ENV = "SMTP_PASSWORD";

    public DeliveryConfig {
        telegram = telegram == null ? new TelegramConfig(false, null, null, null, false) : telegram;
        smtp = smtp == null ? new SmtpConfig(false, null, 0, null, null, null, null, false, null) : smtp;
    }

    /**
     * Secrets set in the environment win over the values written in {@code delivery.json}.
     */
    public DeliveryConfig withEnvironment(Map<String, String> env) {
        TelegramConfig resolvedTelegram = telegram;
        String token = env.get(TELEGRAM_TOKEN_ENV);
        if (token != null && !token.isBlank()) {
            resolvedTelegram = telegram.withToken(token);
        }
        SmtpConfig resolvedSmtp = smtp;
        String password = env.get(SMTP_PASSWORD_ENV);
        if (password != null && !password.isBlank()) {
            resolvedSmtp = smtp.withPassword(password);
        }
        return new DeliveryConfig(resolvedTelegram, resolvedSmtp, emoji);
    }
}
