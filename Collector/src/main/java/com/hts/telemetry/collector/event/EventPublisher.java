package com.hts.telemetry.collector.event;

import com.hts.telemetry.codec.event.TelemetryEvent;

import java.net.SocketAddress;

/**
 * Downstream for decoded events. Called on the channel's event loop, so implementations
 * must not block.
 */
public interface EventPublisher {
    void publish(SocketAddress source, TelemetryEvent event);
}
