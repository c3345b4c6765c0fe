package com.hts.telemetry.collector.core.pipeline;

import com.hts.telemetry.codec.event.TelemetryEvent;
import com.hts.telemetry.collector.event.EventPublisher;
import com.hts.telemetry.collector.metrics.CollectorMetrics;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

@ChannelHandler.Sharable
public final class EventDispatchHandler extends SimpleChannelInboundHandler<TelemetryEvent> {

    private final EventPublisher publisher;
    private final CollectorMetrics metrics;

    public EventDispatchHandler(EventPublisher publisher, CollectorMetrics metrics) {
        this.publisher = publisher;
        this.metrics = metrics;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TelemetryEvent event) {
        metrics.recordEvent();
        publisher.publish(ctx.channel().remoteAddress(), event);
    }
}
