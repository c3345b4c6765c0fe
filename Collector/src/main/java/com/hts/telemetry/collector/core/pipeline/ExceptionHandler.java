package com.hts.telemetry.collector.core.pipeline;

import com.hts.telemetry.codec.exception.CodecException;
import com.hts.telemetry.collector.metrics.CollectorMetrics;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Tail of the pipeline. Routers expect no reply, so errors are only logged and counted
 * before the channel is closed.
 */
@ChannelHandler.Sharable
public final class ExceptionHandler extends ChannelInboundHandlerAdapter {
    private static final Logger log = LoggerFactory.getLogger(ExceptionHandler.class);

    private final CollectorMetrics metrics;

    public ExceptionHandler(CollectorMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        metrics.recordConnectionError(cause.getClass().getSimpleName());

        if (cause instanceof CodecException ex) {
            log.warn("Telemetry decode error: remote={} code={} {}",
                    ctx.channel().remoteAddress(), ex.getErrorCode(), ex.getMessage(), ex);
            if (ex.shouldCloseConnection()) {
                ctx.close();
            }
        } else if (cause instanceof IOException) {
            log.info("Connection error: remote={} {}", ctx.channel().remoteAddress(), cause.getMessage());
            ctx.close();
        } else {
            log.error("Unexpected error: remote={}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
