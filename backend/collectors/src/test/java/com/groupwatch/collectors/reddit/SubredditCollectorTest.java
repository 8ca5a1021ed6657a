package com.groupwatch.collectors.reddit;

import com.groupwatch.collectors.api.CollectorContext;
import com.groupwatch.collectors.api.CollectorResult;
import com.groupwatch.collectors.config.SubredditConfig;
import com.groupwatch.collectors.support.CollectingDigestSink;
import com.groupwatch.collectors.support.EventCapture;
import com.groupwatch.collectors.support.FixtureUtils;
import com.groupwatch.collectors.support.InMemorySeenStore;
import com.groupwatch.collectors.support.TestContexts;
import com.groupwatch.collectors.support.TestServer;
import com.groupwatch.core.bus.EventBus;
import com.groupwatch.core.digest.Subreddit;
import com.groupwatch.core.events.AlertRaised;
import com.groupwatch.core.model.Post;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubredditCollectorTest {
    private TestServer server;
    private EventBus bus;
    private EventCapture capture;
    private CollectingDigestSink sink;

    @BeforeEach
    void setUp() throws Exception {
        server = new TestServer();
        bus = TestContexts.strictBus();
        capture = new EventCapture(bus);
        sink = new CollectingDigestSink();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void listingMapsToPostsWithCommentsLinks() throws Exception {
        List<Post> posts = RedditListingParser.parse(FixtureUtils.fixture("fixtures/reddit-new.json"), "https://www.reddit.com");

        assertEquals(2, posts.size());
        Post link = posts.get(0);
        assertEquals("JDK 25 & you", link.title());
        assertEquals("https://openjdk.org/projects/jdk/25/", link.url());
        assertEquals("https://www.reddit.com/r/java/comments/abc123/jdk_25_you/", link.comments());
        Post self = posts.get(1);
        assertTrue(self.isSelf());
        assertNull(self.comments());
    }

    @Test
    void malformedListingIsRejected() {
        assertThrows(IOException.class, () -> RedditListingParser.parse("{not json", "https://www.reddit.com"));
    }

    @Test
    void publishesOneDigestPerSubredditAndSendsUserAgent() throws Exception {
        server.respond("/r/java/new.json", FixtureUtils.fixture("fixtures/reddit-new.json"));
        CollectorContext ctx = context(List.of("java"));

        CollectorResult result = new SubredditCollector().poll(ctx).join();

        assertTrue(result.success());
        Subreddit java = sink.byType(Subreddit.class).get(0);
        assertEquals("r/java", java.title());
        assertEquals(2, java.size());
        assertEquals(
                "- <a href=\"https://openjdk.org/projects/jdk/25/\">JDK 25 &amp; you</a> (<a href=\""
                        + server.url("/r/java/comments/abc123/jdk_25_you/") + "\">comments</a>)\n"
                        + "- <a href=\"https://www.reddit.com/r/java/comments/def456/how_do_i_read_a_file/\">How do I read a file?</a>",
                java.renderHtml()
        );
        assertEquals("group-watch-test", server.lastHeader("User-Agent"));

        new SubredditCollector().poll(ctx).join();
        assertEquals(1, sink.digests().size());
    }

    @Test
    void newPostLinkingAnAlreadyAnnouncedArticleIsStillAnnounced() {
        server.respond("/r/java/new.json", listing(child("b", "Original share", "https://x/2")));
        CollectorContext ctx = context(List.of("java"));
        SubredditCollector collector = new SubredditCollector();
        collector.poll(ctx).join();

        server.respond("/r/java/new.json", listing(
                child("c", "Same article again", "https://x/2"),
                child("b", "Original share", "https://x/2")
        ));
        collector.poll(ctx).join();

        List<Subreddit> digests = sink.byType(Subreddit.class);
        assertEquals(2, digests.size());
        assertEquals(1, digests.get(1).size());
        assertEquals("Same article again", digests.get(1).posts().get(0).title());
        assertEquals(server.url("/r/java/comments/c/"), SubredditCollector.postKey(digests.get(1).posts().get(0)));
    }

    @Test
    void newestListedPostRendersFirst() {
        server.respond("/r/java/new.json", listing(
                child("b", "NEWEST", "https://x/2"),
                child("a", "OLDEST", "https://x/1")
        ));

        new SubredditCollector().poll(context(List.of("java"))).join();

        String html = sink.byType(Subreddit.class).get(0).renderHtml();
        assertTrue(html.indexOf(">NEWEST<") < html.indexOf(">OLDEST<"));
        assertTrue(html.startsWith("- <a href=\"https://x/2\">NEWEST</a>"));
    }

    @Test
    void failingSubredditDoesNotStopTheOthers() throws Exception {
        server.respond("/r/java/new.json", FixtureUtils.fixture("fixtures/reddit-new.json"));
        server.respond("/r/broken/new.json", "<html>rate limited</html>");
        CollectorContext ctx = context(List.of("java", "broken", "missing"));

        CollectorResult result = new SubredditCollector().poll(ctx).join();

        assertFalse(result.success());
        assertEquals(1, sink.digests().size());
        List<AlertRaised> alerts = capture.byType(AlertRaised.class);
        assertEquals(2, alerts.size());
        assertTrue(alerts.stream().anyMatch(alert -> alert.message().startsWith("Invalid listing JSON for reddit:broken")));
        assertTrue(alerts.stream().anyMatch(alert -> alert.message().contains("HTTP status 404")));
    }

    @Test
    void listingUrlAddsTimeWindowForTopSort() {
        SubredditConfig top = new SubredditConfig(null, null, "top", 5, null, List.of("java"), false);
        SubredditConfig defaults = new SubredditConfig(null, null, null, 0, null, null, false);

        assertEquals("https://www.reddit.com/r/java/top.json?limit=5&raw_json=1&t=day", SubredditCollector.listingUrl(top, "java"));
        assertEquals("https://www.reddit.com/r/java/new.json?limit=25&raw_json=1", SubredditCollector.listingUrl(defaults, "java"));
        assertTrue(defaults.subreddits().isEmpty());
    }

    private CollectorContext context(List<String> subreddits) {
        SubredditConfig cfg = new SubredditConfig(
                Duration.ofMinutes(30),
                server.url(""),
                "new",
                10,
                "group-watch-test",
                subreddits,
                true
        );
        return TestContexts.context(bus, new InMemorySeenStore(), sink, Map.of(SubredditCollector.CONFIG_KEY, cfg));
    }

    private static String listing(String... children) {
        return "{\"data\":{\"children\":[" + String.join(",", children) + "]}}";
    }

    private static String child(String id, String title, String url) {
        return "{\"kind\":\"t3\",\"data\":{\"name\":\"t3_" + id + "\",\"title\":\"" + title + "\",\"url\":\"" + url
                + "\",\"is_self\":false,\"permalink\":\"/r/java/comments/" + id + "/\"}}";
    }
}
