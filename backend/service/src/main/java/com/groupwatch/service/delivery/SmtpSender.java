package com.groupwatch.service.delivery;

import com.groupwatch.core.digest.Digest;
import com.groupwatch.core.digest.DigestRenderer;
import com.groupwatch.service.config.SmtpConfig;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.Properties;

/**
 * Mails the plain-text rendering of each digest to the configured recipients.
 */
public final class SmtpSender implements DigestSender {
    private final SmtpConfig config;
    private final DigestRenderer renderer;
    private final Session session;
    private final MailTransport transport;
    private final Clock clock;

    public SmtpSender(SmtpConfig config, DigestRenderer renderer, Clock clock) {
        this(config, renderer, clock, Transport::send);
    }

    SmtpSender(SmtpConfig config, DigestRenderer renderer, Clock clock, MailTransport transport) {
        if (config.to().isEmpty()) {
            throw new IllegalStateException("SMTP delivery needs at least one recipient");
        }
        this.config = config;
        this.renderer = renderer;
        this.clock = clock;
        this.transport = transport;
        this.session = Session.getInstance(properties(config), authenticator(config));
    }

    @Override
    public String channel() {
        return "smtp";
    }

    @Override
    public int send(String heading, Digest digest) {
        try {
            transport.send(buildMessage(heading, digest));
            return 1;
        } catch (MessagingException e) {
            throw new IllegalStateException("SMTP delivery to " + config.host() + ":" + config.port() + " failed", e);
        }
    }

    MimeMessage buildMessage(String heading, Digest digest) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(config.from()));
        for (String recipient : config.to()) {
            message.addRecipient(Message.RecipientType.TO, new InternetAddress(recipient));
        }
        message.setSubject("[" + config.groupName() + "] " + heading, StandardCharsets.UTF_8.name());
        message.setSentDate(Date.from(clock.instant()));
        message.setText(heading + "\n\n" + digest.renderText(renderer), StandardCharsets.UTF_8.name());
        return message;
    }

    private static Properties properties(SmtpConfig config) {
        Properties props = new Properties();
        props.put("mail.smtp.host", config.host());
        props.put("mail.smtp.port", String.valueOf(config.port()));
        props.put("mail.smtp.auth", String.valueOf(!config.username().isBlank()));
        props.put("mail.smtp.starttls.enable", String.valueOf(config.startTls()));
        props.put("mail.smtp.connectiontimeout", "10000");
        props.put("mail.smtp.timeout", "10000");
        return props;
    }

    private static Authenticator authenticator(SmtpConfig config) {
        if (config.username().isBlank()) {
            return null;
        }
        return new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(config.username(), config.password());
            }
        };
    }

    @FunctionalInterface
    interface MailTransport {
        void send(Message message) throws MessagingException;
    }
}
