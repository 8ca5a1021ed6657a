package com.groupwatch.collectors.rss;

import com.groupwatch.collectors.api.AbstractCollector;
import com.groupwatch.collectors.api.CollectorContext;
import com.groupwatch.collectors.api.CollectorResult;
import com.groupwatch.collectors.api.SourceOutcome;
import com.groupwatch.collectors.config.FeedConfig;
import com.groupwatch.collectors.config.FeedSourceConfig;
import com.groupwatch.core.digest.Feed;
import com.groupwatch.core.model.Article;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class RssFeedCollector extends AbstractCollector {
    public static final String CONFIG_KEY = "rssFeedCollector";

    public RssFeedCollector() {
        this(Duration.ofMinutes(30));
    }

    public RssFeedCollector(Duration interval) {
        super("rssFeedCollector", interval);
    }

    @Override
    protected CompletableFuture<CollectorResult> collect(CollectorContext ctx) {
        FeedConfig cfg = ctx.requiredConfig(CONFIG_KEY, FeedConfig.class);
        List<CompletableFuture<SourceOutcome>> tasks = cfg.feeds().stream()
                .map(feed -> pollFeed(ctx, cfg, feed))
                .toList();
        return allOf(tasks).thenApply(outcomes -> summarize("RSS", outcomes));
    }

    private CompletableFuture<SourceOutcome> pollFeed(CollectorContext ctx, FeedConfig cfg, FeedSourceConfig feed) {
        String source = "feed:" + feed.url();
        return fetchBody(ctx, source, feed.url(), Map.of())
                .thenApply(body -> body
                        .map(xml -> process(ctx, cfg, feed, source, xml))
                        .orElseGet(() -> SourceOutcome.failed(source)));
    }

    private SourceOutcome process(CollectorContext ctx, FeedConfig cfg, FeedSourceConfig feed, String source, String xml) {
        ParsedFeed parsed;
        try {
            parsed = FeedParser.parse(xml);
        } catch (FeedParseException e) {
            raiseAlert(ctx, "Invalid RSS/Atom XML for source " + source, source, feed.url());
            return SourceOutcome.failed(source);
        }

        Feed digest = new Feed(titleFor(feed, parsed));
        for (Article article : unseen(ctx, source, parsed.articles(), Article::url, cfg.announceBacklog())) {
            digest.append(article);
        }
        publishDigest(ctx, digest);
        return new SourceOutcome(source, true, parsed.articles().size(), digest.size());
    }

    private static String titleFor(FeedSourceConfig feed, ParsedFeed parsed) {
        if (feed.title() != null && !feed.title().isBlank()) {
            return feed.title();
        }
        return parsed.title().isBlank() ? feed.url() : parsed.title();
    }
}
