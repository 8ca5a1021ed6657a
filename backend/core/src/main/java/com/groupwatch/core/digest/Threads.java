package com.groupwatch.core.digest;

import com.groupwatch.core.model.MailItem;
import com.groupwatch.core.model.MessageKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mails grouped by sanitized subject, with reply markers ignored (see {@link SubjectSanitizer#threadKey}). Subjects keep their creation order and each subject keeps its append order;
 * renderers walk both in reverse so the newest activity comes first.
 */
public class Threads implements Digest {
    private final String name;
    private final Map<String, MailThread> threads = new LinkedHashMap<>();
    private int mailCount;

    public Threads() {
        this("mailing list");
    }

    public Threads(String name) {
        this.name = Objects.requireNonNull(name, "name is required");
    }

    /**
     * Adds {@code mail} to its subject's thread, creating the thread on first use.
     *
     * @return {@code false} if a mail with the same URL is already in that thread, in which case nothing changes
     */
    public boolean append(MailItem mail) {
        MailThread thread = threads.computeIfAbsent(SubjectSanitizer.threadKey(mail.subject()), ignored -> new MailThread());
        if (!thread.keys.add(mail.key())) {
            return false;
        }
        thread.mails.add(mail);
        mailCount++;
        return true;
    }

    public int countThreads() {
        return threads.size();
    }

    public int countMails() {
        return mailCount;
    }

    /**
     * Subjects in creation order.
     */
    public List<String> subjects() {
        return List.copyOf(threads.keySet());
    }

    /**
     * Mails of one subject in append order; empty for an unknown subject.
     */
    public List<MailItem> mails(String subject) {
        MailThread thread = threads.get(SubjectSanitizer.threadKey(subject));
        return thread == null ? List.of() : Collections.unmodifiableList(thread.mails);
    }

    @Override
    public String title() {
        return name;
    }

    @Override
    public int size() {
        return mailCount;
    }

    @Override
    public String summary() {
        return mailCount + (mailCount == 1 ? " new mail" : " new mails")
                + " in " + threads.size() + (threads.size() == 1 ? " thread" : " threads");
    }

    @Override
    public String renderText(DigestRenderer renderer) {
        return renderer.renderText(this);
    }

    @Override
    public String renderHtml(DigestRenderer renderer) {
        return renderer.renderHtml(this);
    }

    @Override
    public String toString() {
        return "Threads[" + name + ", threads=" + threads.size() + ", mails=" + mailCount + "]";
    }

    private static final class MailThread {
        private final List<MailItem> mails = new ArrayList<>();
        private final Set<MessageKey> keys = new HashSet<>();
    }
}
