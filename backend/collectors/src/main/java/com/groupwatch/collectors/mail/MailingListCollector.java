package com.groupwatch.collectors.mail;

import com.groupwatch.collectors.api.AbstractCollector;
import com.groupwatch.collectors.api.CollectorContext;
import com.groupwatch.collectors.api.CollectorResult;
import com.groupwatch.collectors.api.SourceOutcome;
import com.groupwatch.collectors.config.MailingListConfig;
import com.groupwatch.core.digest.Threads;
import com.groupwatch.core.model.MailItem;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Scrapes the current month's archive page and publishes the mails not announced yet, grouped into
 * {@link Threads}.
 */
public class MailingListCollector extends AbstractCollector {
    public static final String CONFIG_KEY = "mailingListCollector";
    private static final Logger LOGGER = Logger.getLogger(MailingListCollector.class.getName());

    public MailingListCollector() {
        this(Duration.ofMinutes(10));
    }

    public MailingListCollector(Duration interval) {
        super("mailingListCollector", interval);
    }

    @Override
    protected CompletableFuture<CollectorResult> collect(CollectorContext ctx) {
        MailingListConfig cfg = ctx.requiredConfig(CONFIG_KEY, MailingListConfig.class);
        String pageUrl = ArchiveUrlTemplate.resolve(
                cfg.archiveUrl(),
                ZonedDateTime.ofInstant(ctx.clock().instant(), ctx.clock().getZone())
        );
        String source = "mail:" + cfg.listName();

        return fetchBody(ctx, source, pageUrl, Map.of())
                .thenApply(body -> body
                        .map(html -> process(ctx, cfg, source, pageUrl, html))
                        .orElseGet(() -> SourceOutcome.failed(source)))
                .thenApply(outcome -> summarize("Mailing list", List.of(outcome)));
    }

    private SourceOutcome process(CollectorContext ctx, MailingListConfig cfg, String source, String pageUrl, String html) {
        List<MailItem> mails = MailmanArchiveParser.parse(html, pageUrl);
        Threads threads = new Threads(cfg.listName());
        for (MailItem mail : unseen(ctx, source, mails, MailItem::url, cfg.announceBacklog())) {
            if (!threads.append(mail)) {
                LOGGER.fine("Skipping duplicate mail " + mail.url());
            }
        }
        publishDigest(ctx, threads);
        return new SourceOutcome(source, true, mails.size(), threads.countMails());
    }
}
