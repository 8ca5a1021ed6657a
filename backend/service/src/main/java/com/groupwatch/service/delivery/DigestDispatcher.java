package com.groupwatch.service.delivery;

import com.groupwatch.collectors.api.DigestSink;
import com.groupwatch.core.bus.EventBus;
import com.groupwatch.core.digest.Digest;
import com.groupwatch.core.digest.DigestRenderer;
import com.groupwatch.core.events.AlertRaised;
import com.groupwatch.core.events.DigestDelivered;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans each published digest out to every configured sender. A failing channel raises an alert and does not
 * keep the digest from the remaining channels.
 */
public class DigestDispatcher implements DigestSink {
    private static final Logger LOGGER = Logger.getLogger(DigestDispatcher.class.getName());

    private final List<DigestSender> senders;
    private final DigestRenderer renderer;
    private final EventBus eventBus;
    private final Clock clock;

    public DigestDispatcher(List<DigestSender> senders, DigestRenderer renderer, EventBus eventBus, Clock clock) {
        this.senders = List.copyOf(senders);
        this.renderer = renderer;
        this.eventBus = eventBus;
        this.clock = clock;
        if (this.senders.isEmpty()) {
            LOGGER.warning("No delivery channel is enabled; digests will only be logged");
        }
    }

    @Override
    public void publish(Digest digest) {
        if (digest.isEmpty()) {
            return;
        }
        String heading = renderer.renderHeadingText(digest);
        if (senders.isEmpty()) {
            LOGGER.info(heading + "\n" + digest.renderText(renderer));
            return;
        }
        for (DigestSender sender : senders) {
            deliver(sender, heading, digest);
        }
    }

    public List<String> channels() {
        return senders.stream().map(DigestSender::channel).toList();
    }

    private void deliver(DigestSender sender, String heading, Digest digest) {
        try {
            int parts = sender.send(heading, digest);
            eventBus.publish(new DigestDelivered(clock.instant(), digest.title(), sender.channel(), true, parts));
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Delivery of '" + digest.title() + "' via " + sender.channel() + " failed", ex);
            eventBus.publish(new DigestDelivered(clock.instant(), digest.title(), sender.channel(), false, 0));
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "delivery",
                    "Delivery via " + sender.channel() + " failed: " + ex.getMessage(),
                    Map.of("channel", sender.channel(), "source", digest.title())
            ));
        }
    }
}
