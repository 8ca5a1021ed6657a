package com.groupwatch.core.model;

import com.groupwatch.core.digest.SubjectSanitizer;

import java.util.Objects;

/**
 * A message observed in a mailing-list archive.
 *
 * <p>Two mails are equal when their {@link MessageKey} is equal; subject and author take no part in equality.
 */
public final class MailItem {
    private final String subject;
    private final String author;
    private final MessageKey key;

    private MailItem(String subject, String author, MessageKey key) {
        this.subject = subject;
        this.author = author;
        this.key = key;
    }

    /**
     * Builds a mail from the subject as shown in the archive; a leading list tag such as {@code [Dev]} is removed.
     */
    public static MailItem of(String rawSubject, String author, String url) {
        Objects.requireNonNull(rawSubject, "subject is required");
        Objects.requireNonNull(author, "author is required");
        return new MailItem(SubjectSanitizer.sanitize(rawSubject), author, new MessageKey(url));
    }

    public String subject() {
        return subject;
    }

    public String author() {
        return author;
    }

    public String url() {
        return key.url();
    }

    public MessageKey key() {
        return key;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof MailItem mail && key.equals(mail.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return "MailItem[subject=" + subject + ", author=" + author + ", url=" + key.url() + "]";
    }
}
