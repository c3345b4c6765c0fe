package com.hts.telemetry.collector.core.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hts.telemetry.codec.CodecSettings;
import com.hts.telemetry.codec.TelemetryDecoder;
import com.hts.telemetry.codec.schema.SchemaRegistry;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the connection's {@link TelemetryDecoder}; one instance per channel.
 *
 * Inbound ByteBufs are decoded and released here. Every decoded event is fired down the
 * pipeline as a {@code TelemetryEvent}. Decoder exceptions surface through
 * {@code exceptionCaught}.
 */
public final class TelemetryChannelHandler extends ChannelInboundHandlerAdapter {
    private static final Logger log = LoggerFactory.getLogger(TelemetryChannelHandler.class);

    private final TelemetryDecoder decoder;

    public TelemetryChannelHandler(CodecSettings settings, SchemaRegistry registry, ObjectMapper mapper) {
        this.decoder = new TelemetryDecoder(settings, registry, mapper);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof ByteBuf buf)) {
            ctx.fireChannelRead(msg);
            return;
        }
        try {
            if (decoder.isFailed()) {
                // connection is being closed, drop what is still in flight
                log.debug("Discarding {} bytes from failed connection {}", buf.readableBytes(), ctx.channel().remoteAddress());
                return;
            }
            decoder.decode(buf, ctx::fireChannelRead);
        } finally {
            ReferenceCountUtil.release(buf);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (decoder.getBufferedBytes() > 0) {
            log.debug("Connection closed with partial frame: remote={} buffered={} state={}",
                    ctx.channel().remoteAddress(), decoder.getBufferedBytes(), decoder.getState());
        }
        decoder.close();
        ctx.fireChannelInactive();
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        decoder.close();
    }
}
