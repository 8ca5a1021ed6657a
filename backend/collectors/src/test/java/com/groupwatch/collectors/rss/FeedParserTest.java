package com.groupwatch.collectors.rss;

import com.groupwatch.collectors.support.FixtureUtils;
import com.groupwatch.core.model.Article;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedParserTest {
    @Test
    void parsesRssItemsInFeedOrderKeepingReportedOffsets() throws Exception {
        ParsedFeed feed = FeedParser.parse(FixtureUtils.fixture("fixtures/sample-rss.xml"));

        assertEquals("Project Blog", feed.title());
        List<Article> articles = feed.articles();
        assertEquals(3, articles.size());

        Article release = articles.get(0);
        assertEquals("Release 2.0 is out", release.title());
        assertEquals("The 2.0 release & notes.", release.description());
        assertEquals(ZoneOffset.ofHours(2), release.publishedAt().getOffset());
        assertEquals(18, release.publishedAt().getHour());

        assertEquals(ZoneOffset.UTC, articles.get(1).publishedAt().getOffset());
        assertEquals(FeedParser.UNDATED, articles.get(2).publishedAt());
    }

    @Test
    void parsesAtomEntriesPreferringAlternateLinksAndPublishedDates() throws Exception {
        ParsedFeed feed = FeedParser.parse(FixtureUtils.fixture("fixtures/sample-atom.xml"));

        assertEquals("Atom Weekly", feed.title());
        assertEquals(2, feed.articles().size());
        Article first = feed.articles().get(0);
        assertEquals("https://atom.example.org/1", first.url());
        assertEquals("First summary", first.description());
        assertEquals(14, first.publishedAt().getDayOfMonth());
        assertEquals(ZoneOffset.ofHours(-4), first.publishedAt().getOffset());

        Article second = feed.articles().get(1);
        assertEquals("https://atom.example.org/2", second.url());
        assertEquals("Second body", second.description());
        assertEquals(ZoneOffset.ofHours(9), second.publishedAt().getOffset());
    }

    @Test
    void malformedXmlIsReported() {
        assertThrows(FeedParseException.class, () -> FeedParser.parse("<rss><channel><item><title>broken"));
    }

    @Test
    void doctypeIsRefused() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE rss [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><rss>&x;</rss>";

        assertThrows(FeedParseException.class, () -> FeedParser.parse(xml));
    }

    @Test
    void unknownRootYieldsEmptyFeed() {
        ParsedFeed feed = FeedParser.parse("<html><body/></html>");

        assertTrue(feed.articles().isEmpty());
        assertEquals("", feed.title());
    }

    @Test
    void unparseableDatesFallBackToEpoch() {
        assertEquals(FeedParser.UNDATED, FeedParser.parseDate("yesterday-ish"));
        assertEquals(FeedParser.UNDATED, FeedParser.parseDate(" "));
        assertEquals(2026, FeedParser.parseDate("2026-10-15T10:00:00Z").getYear());
    }

    @Test
    void rfc822ZoneNamesKeepTheirOffset() {
        ZonedDateTime pacific = FeedParser.parseDate("Wed, 14 Oct 2026 18:45:00 PDT");
        ZonedDateTime eastern = FeedParser.parseDate("15 Oct 2026 07:05 EST");

        assertEquals(ZoneOffset.ofHours(-7), pacific.getOffset());
        assertEquals(18, pacific.getHour());
        assertEquals(ZoneOffset.ofHours(-5), eastern.getOffset());
        assertEquals(15, eastern.getDayOfMonth());
        assertEquals(FeedParser.UNDATED, FeedParser.parseDate("Wed, 14 Oct 2026 18:45:00 XYZ"));
    }
}
