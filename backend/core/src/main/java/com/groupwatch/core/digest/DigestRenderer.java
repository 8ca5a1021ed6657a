package com.groupwatch.core.digest;

import com.groupwatch.core.model.Article;
import com.groupwatch.core.model.MailItem;
import com.groupwatch.core.model.Post;
import com.groupwatch.core.util.HtmlUtils;
import com.groupwatch.core.util.TextUtils;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns digests into plain text or Telegram-flavoured HTML. Every renderer lists the most recently appended
 * entries first; decorative markers come from the injected {@link GlyphResolver} through {@link Glyphs}.
 */
public class DigestRenderer {
    static final DateTimeFormatter PUBLISHED_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yy HH:mm", Locale.ROOT);
    private static final String INDENT = "    ";
    private static final DigestRenderer PLAIN = new DigestRenderer(GlyphResolver.none());

    private final GlyphResolver glyphs;

    public DigestRenderer(GlyphResolver glyphs) {
        this.glyphs = Objects.requireNonNull(glyphs, "glyphs is required");
    }

    /**
     * A renderer without a glyph capability; every marker is the ASCII fallback.
     */
    public static DigestRenderer plain() {
        return PLAIN;
    }

    /**
     * {@code <title>: <summary>}, used as the mail subject and as the first line of plain-text messages.
     */
    public String renderHeadingText(Digest digest) {
        return digest.title() + ": " + digest.summary();
    }

    public String renderHeadingHtml(Digest digest) {
        return Glyphs.resolve(glyphs, headingGlyph(digest)) + " <b>" + HtmlUtils.escape(digest.title()) + "</b>: "
                + HtmlUtils.escape(digest.summary());
    }

    public String renderText(Threads threads) {
        StringBuilder out = new StringBuilder();
        for (String subject : reversed(threads.subjects())) {
            out.append(subject).append(":\n");
            for (MailItem mail : reversed(threads.mails(subject))) {
                out.append('\t').append(mail.author()).append(" - <").append(mail.url()).append(">\n");
            }
            out.append('\n');
        }
        return out.toString();
    }

    public String renderHtml(Threads threads) {
        String marker = Glyphs.resolve(glyphs, Glyphs.MARKER);
        StringBuilder out = new StringBuilder();
        for (String subject : reversed(threads.subjects())) {
            out.append(marker).append(" <b>")
                    .append(HtmlUtils.escape(TextUtils.capitalizeNoSymbols(subject)))
                    .append("</b>\n");
            for (MailItem mail : reversed(threads.mails(subject))) {
                out.append(INDENT).append(link(mail.url(), mail.author())).append('\n');
            }
        }
        return out.toString();
    }

    public String renderText(Subreddit subreddit) {
        List<String> lines = new ArrayList<>();
        for (Post post : reversed(subreddit.posts())) {
            StringBuilder line = new StringBuilder(post.title()).append(" - <").append(post.url()).append('>');
            if (post.hasComments()) {
                line.append("\n\tcomments: <").append(post.comments()).append('>');
            }
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    public String renderHtml(Subreddit subreddit) {
        String marker = Glyphs.resolve(glyphs, Glyphs.MARKER);
        List<String> lines = new ArrayList<>();
        for (Post post : reversed(subreddit.posts())) {
            StringBuilder line = new StringBuilder(marker).append(' ').append(link(post.url(), post.title()));
            if (post.hasComments()) {
                line.append(" (").append(link(post.comments(), "comments")).append(')');
            }
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    public String renderText(Feed feed) {
        List<String> entries = new ArrayList<>();
        for (Article article : reversed(feed.articles())) {
            entries.add(article.title() + " - <" + article.url() + ">\n\t" + published(article));
        }
        return String.join("\n", entries);
    }

    public String renderHtml(Feed feed) {
        String marker = Glyphs.resolve(glyphs, Glyphs.MARKER);
        String clock = Glyphs.resolve(glyphs, Glyphs.CLOCK);
        List<String> entries = new ArrayList<>();
        for (Article article : reversed(feed.articles())) {
            entries.add(marker + " " + link(article.url(), article.title())
                    + "\n" + INDENT + clock + " " + published(article));
        }
        return String.join("\n", entries);
    }

    private static String headingGlyph(Digest digest) {
        if (digest instanceof Threads) {
            return Glyphs.MAIL;
        }
        if (digest instanceof Subreddit) {
            return Glyphs.DISCUSSION;
        }
        if (digest instanceof Feed) {
            return Glyphs.NEWS;
        }
        return Glyphs.MARKER;
    }

    private static String published(Article article) {
        return PUBLISHED_FORMAT.format(article.publishedAt());
    }

    private static String link(String url, String text) {
        return "<a href=\"" + HtmlUtils.escape(url) + "\">" + HtmlUtils.escape(text) + "</a>";
    }

    private static <T> List<T> reversed(List<T> items) {
        List<T> copy = new ArrayList<>(items);
        Collections.reverse(copy);
        return copy;
    }
}
