package com.groupwatch.collectors.mail;

import com.groupwatch.core.model.MailItem;
import com.groupwatch.core.util.HtmlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the message index of a pipermail archive page ({@code date.html}, {@code thread.html}, ...). Each entry
 * looks like {@code <LI><A HREF="000123.html">[Dev] Subject</A><A NAME="123">&nbsp;</A><I>Author</I>}.
 */
public final class MailmanArchiveParser {
    private static final Pattern ENTRY_PATTERN = Pattern.compile(
            "<li>\\s*<a\\s+href\\s*=\\s*\"([^\"]+)\"[^>]*>(.*?)</a>(?:(?!<li>).)*?<i>(.*?)</i>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    private MailmanArchiveParser() {
    }

    /**
     * Returns the archived mails in page order, with links resolved against {@code pageUrl}.
     */
    public static List<MailItem> parse(String html, String pageUrl) {
        URI base = URI.create(pageUrl);
        Matcher matcher = ENTRY_PATTERN.matcher(html);
        List<MailItem> mails = new ArrayList<>();
        while (matcher.find()) {
            String href = matcher.group(1).trim();
            String subject = HtmlUtils.toPlainText(matcher.group(2));
            String author = HtmlUtils.toPlainText(matcher.group(3));
            if (href.isEmpty()) {
                continue;
            }
            mails.add(MailItem.of(subject, author, base.resolve(href).toString()));
        }
        return mails;
    }
}
