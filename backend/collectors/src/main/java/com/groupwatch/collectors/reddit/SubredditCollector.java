package com.groupwatch.collectors.reddit;

import com.groupwatch.collectors.api.AbstractCollector;
import com.groupwatch.collectors.api.CollectorContext;
import com.groupwatch.collectors.api.CollectorResult;
import com.groupwatch.collectors.api.SourceOutcome;
import com.groupwatch.collectors.config.SubredditConfig;
import com.groupwatch.core.digest.Subreddit;
import com.groupwatch.core.model.Post;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class SubredditCollector extends AbstractCollector {
    public static final String CONFIG_KEY = "subredditCollector";

    public SubredditCollector() {
        this(Duration.ofMinutes(30));
    }

    public SubredditCollector(Duration interval) {
        super("subredditCollector", interval);
    }

    @Override
    protected CompletableFuture<CollectorResult> collect(CollectorContext ctx) {
        SubredditConfig cfg = ctx.requiredConfig(CONFIG_KEY, SubredditConfig.class);
        List<CompletableFuture<SourceOutcome>> tasks = cfg.subreddits().stream()
                .map(name -> pollSubreddit(ctx, cfg, name))
                .toList();
        return allOf(tasks).thenApply(outcomes -> summarize("Subreddit", outcomes));
    }

    static String listingUrl(SubredditConfig cfg, String name) {
        String url = cfg.baseUrl() + "/r/" + name + "/" + cfg.sort() + ".json?limit=" + cfg.limit() + "&raw_json=1";
        return "top".equals(cfg.sort()) ? url + "&t=day" : url;
    }

    /**
     * The post's own thread. Link posts share their target URL with every other post of the same article.
     */
    static String postKey(Post post) {
        return post.hasComments() ? post.comments() : post.url();
    }

    private CompletableFuture<SourceOutcome> pollSubreddit(CollectorContext ctx, SubredditConfig cfg, String name) {
        String source = "reddit:" + name;
        String url = listingUrl(cfg, name);
        return fetchBody(ctx, source, url, Map.of("User-Agent", cfg.userAgent(), "Accept", "application/json"))
                .thenApply(body -> body
                        .map(json -> process(ctx, cfg, name, source, url, json))
                        .orElseGet(() -> SourceOutcome.failed(source)));
    }

    private SourceOutcome process(CollectorContext ctx, SubredditConfig cfg, String name, String source, String url, String json) {
        List<Post> posts;
        try {
            posts = RedditListingParser.parse(json, cfg.baseUrl());
        } catch (IOException e) {
            raiseAlert(ctx, "Invalid listing JSON for " + source + ": " + rootMessage(e), source, url);
            return SourceOutcome.failed(source);
        }

        // Listings put the newest (or best ranked) post first; the digest is filled oldest first.
        List<Post> oldestFirst = new ArrayList<>(posts);
        Collections.reverse(oldestFirst);
        Subreddit subreddit = new Subreddit(name);
        for (Post post : unseen(ctx, source, oldestFirst, SubredditCollector::postKey, cfg.announceBacklog())) {
            subreddit.append(post);
        }
        publishDigest(ctx, subreddit);
        return new SourceOutcome(source, true, posts.size(), subreddit.size());
    }
}
