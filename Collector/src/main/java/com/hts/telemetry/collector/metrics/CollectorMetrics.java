package com.hts.telemetry.collector.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.concurrent.atomic.AtomicInteger;

@Singleton
public final class CollectorMetrics {

    private final MeterRegistry registry;
    private final Counter events;
    private final Counter.Builder connectionErrorsBuilder;
    private final AtomicInteger activeConnections = new AtomicInteger();

    @Inject
    public CollectorMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.events = Counter.builder("telemetry_events_total")
                .description("Decoded telemetry events")
                .register(registry);

        this.connectionErrorsBuilder = Counter.builder("telemetry_connection_errors_total")
                .description("Connections torn down by an error");

        registry.gauge("telemetry_connections_active", activeConnections);
    }

    public void recordEvent() {
        events.increment();
    }

    public void recordConnectionError(String exceptionType) {
        connectionErrorsBuilder
                .tag("exception", exceptionType)
                .register(registry)
                .increment();
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }
}
