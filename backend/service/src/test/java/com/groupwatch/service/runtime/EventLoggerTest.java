package com.groupwatch.service.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.groupwatch.core.bus.EventBus;
import com.groupwatch.core.events.AlertRaised;
import com.groupwatch.core.events.DigestDelivered;
import com.groupwatch.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventLoggerTest {
    @Test
    void eventsBecomeSingleJsonLines() throws Exception {
        String line = EventLogger.toJsonLine(new DigestDelivered(
                Instant.parse("2026-10-16T12:00:00Z"), "r/java", "telegram", true, 2));

        assertFalse(line.contains("\n"));
        JsonNode node = JsonUtils.objectMapper().readTree(line);
        assertEquals("DigestDelivered", node.path("type").asText());
        assertEquals("2026-10-16T12:00:00Z", node.path("timestamp").asText());
        assertEquals("telegram", node.path("event").path("channel").asText());
        assertEquals(2, node.path("event").path("parts").asInt());
    }

    @Test
    void alertsAreLoggedAtWarning() {
        Logger logger = Logger.getLogger(EventLogger.class.getName());
        List<LogRecord> records = new CopyOnWriteArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
        try {
            EventBus bus = new EventBus();
            EventLogger.attach(bus);
            bus.publish(new AlertRaised(Instant.parse("2026-10-16T12:00:00Z"), "collector", "HTTP status 503", Map.of()));

            assertEquals(1, records.size());
            assertEquals(Level.WARNING, records.get(0).getLevel());
            assertTrue(records.get(0).getMessage().contains("\"message\":\"HTTP status 503\""));
        } finally {
            logger.removeHandler(handler);
        }
    }
}
