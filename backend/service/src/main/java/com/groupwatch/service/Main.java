package com.groupwatch.service;

import com.groupwatch.collectors.api.CollectorContext;
import com.groupwatch.collectors.config.FeedConfig;
import com.groupwatch.collectors.config.MailingListConfig;
import com.groupwatch.collectors.config.SubredditConfig;
import com.groupwatch.collectors.mail.MailingListCollector;
import com.groupwatch.collectors.reddit.SubredditCollector;
import com.groupwatch.collectors.rss.RssFeedCollector;
import com.groupwatch.core.bus.EventBus;
import com.groupwatch.core.digest.DigestRenderer;
import com.groupwatch.core.digest.EmojiGlyphResolver;
import com.groupwatch.core.digest.GlyphResolver;
import com.groupwatch.core.model.CollectorConfig;
import com.groupwatch.service.config.ConfigLoader;
import com.groupwatch.service.config.DeliveryConfig;
import com.groupwatch.service.delivery.DigestDispatcher;
import com.groupwatch.service.delivery.DigestSender;
import com.groupwatch.service.delivery.SmtpSender;
import com.groupwatch.service.delivery.TelegramSender;
import com.groupwatch.service.http.HttpClientFactory;
import com.groupwatch.service.runtime.EventLogger;
import com.groupwatch.service.runtime.SchedulerService;
import com.groupwatch.service.store.InMemorySeenStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    static final String APP_NAME = "Group Watch";

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        if (printVersionIfRequested(args, System.out)) {
            return;
        }
        configureLogging();

        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("GROUP_WATCH_CONFIG_DIR", "config"));
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        EventLogger.attach(eventBus);

        List<CollectorConfig> collectorConfigs = ConfigLoader.loadCollectors(configDir);
        MailingListConfig mailingListConfig = ConfigLoader.loadMailingList(configDir);
        SubredditConfig subredditConfig = ConfigLoader.loadSubreddits(configDir);
        FeedConfig feedConfig = ConfigLoader.loadFeeds(configDir);
        DeliveryConfig deliveryConfig = ConfigLoader.loadDelivery(configDir, env);

        Map<String, CollectorConfig> collectorConfigByName = new HashMap<>();
        for (CollectorConfig cfg : collectorConfigs) {
            collectorConfigByName.put(cfg.name(), cfg);
        }

        MailingListCollector mailingListCollector = new MailingListCollector(
                intervalFor(collectorConfigByName, "mailingListCollector", mailingListConfig.interval(), Duration.ofMinutes(10))
        );
        SubredditCollector subredditCollector = new SubredditCollector(
                intervalFor(collectorConfigByName, "subredditCollector", subredditConfig.interval(), Duration.ofMinutes(30))
        );
        RssFeedCollector feedCollector = new RssFeedCollector(
                intervalFor(collectorConfigByName, "rssFeedCollector", feedConfig.interval(), Duration.ofMinutes(30))
        );

        HttpClient sharedHttpClient = HttpClientFactory.create(Duration.ofSeconds(5));
        DigestRenderer renderer = new DigestRenderer(
                deliveryConfig.emoji() ? EmojiGlyphResolver.fromClasspath() : GlyphResolver.none()
        );
        DigestDispatcher dispatcher = new DigestDispatcher(
                senders(deliveryConfig, sharedHttpClient, renderer, clock),
                renderer,
                eventBus,
                clock
        );

        CollectorContext context = new CollectorContext(
                sharedHttpClient,
                eventBus,
                new InMemorySeenStore(),
                dispatcher,
                clock,
                Duration.ofSeconds(10),
                Map.of(
                        MailingListCollector.CONFIG_KEY, mailingListConfig,
                        SubredditCollector.CONFIG_KEY, subredditConfig,
                        RssFeedCollector.CONFIG_KEY, feedConfig
                )
        );

        SchedulerService scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledCollector(
                        mailingListCollector,
                        mailingListCollector.interval(),
                        isEnabled(collectorConfigByName, "mailingListCollector", true)
                ),
                new SchedulerService.ScheduledCollector(
                        subredditCollector,
                        subredditCollector.interval(),
                        isEnabled(collectorConfigByName, "subredditCollector", !subredditConfig.subreddits().isEmpty())
                ),
                new SchedulerService.ScheduledCollector(
                        feedCollector,
                        feedCollector.interval(),
                        isEnabled(collectorConfigByName, "rssFeedCollector", !feedConfig.feeds().isEmpty())
                )
        ), context);

        LOGGER.info("Starting " + APP_NAME + " " + version() + " with delivery via " + dispatcher.channels());
        scheduler.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static boolean printVersionIfRequested(String[] args, PrintStream out) {
        if (args.length > 0 && ("-v".equals(args[0]) || "--version".equals(args[0]))) {
            out.println(APP_NAME);
            out.println("Version " + version());
            return true;
        }
        return false;
    }

    static String version() {
        Properties props = new Properties();
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("group-watch-version.properties")) {
            if (in == null) {
                return "unknown";
            }
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read version resource", e);
        }
        return props.getProperty("version", "unknown");
    }

    static List<DigestSender> senders(DeliveryConfig config, HttpClient httpClient, DigestRenderer renderer, Clock clock) {
        List<DigestSender> senders = new ArrayList<>();
        if (config.telegram().enabled()) {
            senders.add(new TelegramSender(httpClient, config.telegram(), renderer, Duration.ofSeconds(10)));
        }
        if (config.smtp().enabled()) {
            senders.add(new SmtpSender(config.smtp(), renderer, clock));
        }
        return senders;
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Unable to load logging.properties: " + e.getMessage());
        }
    }

    private static Duration intervalFor(Map<String, CollectorConfig> map, String name, Duration configured, Duration fallback) {
        CollectorConfig config = map.get(name);
        if (config != null && config.intervalSeconds() > 0) {
            return Duration.ofSeconds(config.intervalSeconds());
        }
        return configured == null ? fallback : configured;
    }

    private static boolean isEnabled(Map<String, CollectorConfig> map, String name, boolean fallback) {
        CollectorConfig config = map.get(name);
        return config == null ? fallback : config.enabled();
    }
}
