package com.groupwatch.service.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groupwatch.core.bus.EventBus;
import com.groupwatch.core.events.AlertRaised;
import com.groupwatch.core.events.Event;
import com.groupwatch.core.util.JsonUtils;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes every bus event to the log as a single JSON line. Alerts go out at WARNING, everything else at INFO.
 */
public final class EventLogger {
    private static final Logger LOGGER = Logger.getLogger(EventLogger.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private EventLogger() {
    }

    public static void attach(EventBus bus) {
        bus.subscribeAll(EventLogger::log);
    }

    static void log(Event event) {
        Level level = event instanceof AlertRaised ? Level.WARNING : Level.INFO;
        if (LOGGER.isLoggable(level)) {
            LOGGER.log(level, toJsonLine(event));
        }
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new LoggedEvent(event.type(), event.timestamp(), event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    private record LoggedEvent(String type, Instant timestamp, Event event) {
    }
}
