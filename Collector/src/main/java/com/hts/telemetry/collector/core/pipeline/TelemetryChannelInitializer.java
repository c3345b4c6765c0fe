package com.hts.telemetry.collector.core.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hts.telemetry.codec.CodecSettings;
import com.hts.telemetry.codec.schema.SchemaRegistry;
import com.hts.telemetry.collector.event.EventPublisher;
import com.hts.telemetry.collector.metrics.CollectorMetrics;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;

/**
 * connection → decoder (per channel) → event dispatch → exception
 */
public final class TelemetryChannelInitializer extends ChannelInitializer<Channel> {

    private final CodecSettings settings;
    private final SchemaRegistry registry;
    private final ObjectMapper mapper;

    private final ConnectionHandler connectionHandler;
    private final EventDispatchHandler dispatchHandler;
    private final ExceptionHandler exceptionHandler;

    public TelemetryChannelInitializer(CodecSettings settings, SchemaRegistry registry, ObjectMapper mapper,
                                       EventPublisher publisher, CollectorMetrics metrics) {
        this.settings = settings;
        this.registry = registry;
        this.mapper = mapper;
        this.connectionHandler = new ConnectionHandler(metrics);
        this.dispatchHandler = new EventDispatchHandler(publisher, metrics);
        this.exceptionHandler = new ExceptionHandler(metrics);
    }

    @Override
    protected void initChannel(Channel ch) {
        ChannelPipeline p = ch.pipeline();
        p.addLast(connectionHandler);
        p.addLast(new TelemetryChannelHandler(settings, registry, mapper));
        p.addLast(dispatchHandler);
        p.addLast(exceptionHandler);
    }
}
