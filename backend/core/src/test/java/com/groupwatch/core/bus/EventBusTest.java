package com.groupwatch.core.bus;

import com.groupwatch.core.events.CollectorTickStarted;
import com.groupwatch.core.events.DigestPublished;
import com.groupwatch.core.events.Event;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger tickHits = new AtomicInteger();
        AtomicInteger digestHits = new AtomicInteger();

        bus.subscribe(CollectorTickStarted.class, event -> tickHits.incrementAndGet());
        bus.subscribe(DigestPublished.class, event -> digestHits.incrementAndGet());

        bus.publish(new CollectorTickStarted(NOW, "rssFeedCollector"));
        bus.publish(new DigestPublished(NOW, "Planet", 5));
        bus.publish(new DigestPublished(NOW, "r/java", 2));

        assertEquals(1, tickHits.get());
        assertEquals(2, digestHits.get());
    }

    @Test
    void wildcardSubscriberSeesEveryEventInOrder() {
        EventBus bus = new EventBus();
        List<Event> seen = new CopyOnWriteArrayList<>();
        bus.subscribeAll(seen::add);

        CollectorTickStarted started = new CollectorTickStarted(NOW, "mailingListCollector");
        DigestPublished published = new DigestPublished(NOW, "dev", 3);
        bus.publish(started);
        bus.publish(published);

        assertEquals(List.of(started, published), seen);
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(CollectorTickStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(CollectorTickStarted.class, event -> safeHits.incrementAndGet());
        bus.subscribeAll(event -> safeHits.incrementAndGet());

        bus.publish(new CollectorTickStarted(NOW, "subredditCollector"));

        assertEquals(2, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }
}
