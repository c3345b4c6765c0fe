package com.hts.telemetry.codec.event;

/**
 * Receives events synchronously, in the order frames arrived on the connection.
 */
@FunctionalInterface
public interface EventSink {
    void emit(TelemetryEvent event);
}
