package com.hts.telemetry.collector.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hts.telemetry.codec.event.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.net.SocketAddress;

/**
 * One JSON line per event on the {@value #EVENT_LOGGER} logger; logback decides where it goes.
 */
@Singleton
public class LoggingEventPublisher implements EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(LoggingEventPublisher.class);

    public static final String EVENT_LOGGER = "telemetry.events";
    private static final Logger events = LoggerFactory.getLogger(EVENT_LOGGER);

    private final ObjectMapper objectMapper;

    @Inject
    public LoggingEventPublisher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(SocketAddress source, TelemetryEvent event) {
        if (!events.isInfoEnabled()) {
            return;
        }
        try {
            events.info(objectMapper.writeValueAsString(event.fields()));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize event: source={} fields={}", source, event.fields().keySet(), e);
        }
    }
}
