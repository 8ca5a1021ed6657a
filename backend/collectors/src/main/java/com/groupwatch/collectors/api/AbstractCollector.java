package com.groupwatch.collectors.api;

import com.groupwatch.core.digest.Digest;
import com.groupwatch.core.events.AlertRaised;
import com.groupwatch.core.events.CollectorTickCompleted;
import com.groupwatch.core.events.CollectorTickStarted;
import com.groupwatch.core.events.DigestPublished;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Wraps every poll in exactly one {@link CollectorTickStarted} / {@link CollectorTickCompleted} pair and never lets
 * a failure escape as an exception: failures become {@link AlertRaised} events and an unsuccessful result.
 */
public abstract class AbstractCollector implements Collector {
    private static final Logger LOGGER = Logger.getLogger(AbstractCollector.class.getName());

    private final String name;
    private final Duration interval;

    protected AbstractCollector(String name, Duration interval) {
        this.name = name;
        this.interval = interval;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public final CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant tickStartedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(tickStartedAt, name()));

        CompletableFuture<CollectorResult> pipeline;
        try {
            pipeline = collect(ctx);
        } catch (RuntimeException ex) {
            pipeline = CompletableFuture.failedFuture(ex);
        }

        return pipeline.handle((result, error) -> {
            long durationMillis = Duration.between(tickStartedAt, ctx.clock().instant()).toMillis();
            if (error != null) {
                ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), false, durationMillis));
                return CollectorResult.failure(name() + " failed: " + rootMessage(error), Map.of());
            }
            ctx.eventBus().publish(new CollectorTickCompleted(
                    ctx.clock().instant(),
                    name(),
                    result.success(),
                    durationMillis
            ));
            return result;
        });
    }

    protected abstract CompletableFuture<CollectorResult> collect(CollectorContext ctx);

    /**
     * GETs {@code url}. Transport errors and HTTP statuses of 400 and above raise an alert and yield empty.
     */
    protected CompletableFuture<Optional<String>> fetchBody(
            CollectorContext ctx,
            String source,
            String url,
            Map<String, String> headers
    ) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .GET()
                .timeout(ctx.requestTimeout());
        headers.forEach(builder::header);

        return ctx.httpClient().sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        raiseAlert(ctx, "Fetch failed for " + source + ": " + rootMessage(error), source, url);
                        return Optional.empty();
                    }
                    if (response.statusCode() >= 400) {
                        raiseAlert(ctx, "HTTP status " + response.statusCode() + " from " + url, source, url);
                        return Optional.empty();
                    }
                    return Optional.of(response.body());
                });
    }

    /**
     * Keeps the items whose key was never seen for {@code source}, in their original order. The first
     * successful poll of a source only records what is there unless {@code announceBacklog} is set.
     */
    protected <T> List<T> unseen(
            CollectorContext ctx,
            String source,
            List<T> items,
            Function<T, String> key,
            boolean announceBacklog
    ) {
        boolean firstPoll = ctx.seenStore().register(source);
        List<T> fresh = new ArrayList<>();
        for (T item : items) {
            if (ctx.seenStore().markSeen(source, key.apply(item))) {
                fresh.add(item);
            }
        }
        if (firstPoll && !announceBacklog) {
            LOGGER.info("Primed " + source + " with " + fresh.size() + " existing items");
            return List.of();
        }
        return fresh;
    }

    protected void publishDigest(CollectorContext ctx, Digest digest) {
        if (digest.isEmpty()) {
            return;
        }
        ctx.digestSink().publish(digest);
        ctx.eventBus().publish(new DigestPublished(ctx.clock().instant(), digest.title(), digest.size()));
    }

    protected void raiseAlert(CollectorContext ctx, String message, String source, String url) {
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "collector",
                message,
                Map.of("collector", name(), "source", source, "url", url)
        ));
    }

    protected CollectorResult summarize(String what, List<SourceOutcome> outcomes) {
        long successes = outcomes.stream().filter(SourceOutcome::success).count();
        int fetched = outcomes.stream().mapToInt(SourceOutcome::fetchedItems).sum();
        int fresh = outcomes.stream().mapToInt(SourceOutcome::newItems).sum();
        Map<String, Object> stats = new HashMap<>();
        stats.put("sources", outcomes.stream().map(SourceOutcome::source).toList());
        stats.put("successes", successes);
        stats.put("fetched", fetched);
        stats.put("newItems", fresh);
        if (successes == outcomes.size()) {
            return CollectorResult.success(what + " polling completed", stats);
        }
        return CollectorResult.failure(what + " polling had failures", stats);
    }

    protected static <T> CompletableFuture<List<T>> allOf(List<CompletableFuture<T>> tasks) {
        return CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> tasks.stream().map(CompletableFuture::join).toList());
    }

    protected static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
