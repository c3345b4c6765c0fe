package com.hts.telemetry.collector.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hts.telemetry.codec.CodecSettings;
import com.hts.telemetry.codec.schema.SchemaRegistry;
import com.hts.telemetry.collector.config.ServerConfig;
import com.hts.telemetry.collector.core.pipeline.TelemetryChannelInitializer;
import com.hts.telemetry.collector.event.EventPublisher;
import com.hts.telemetry.collector.metrics.CollectorMetrics;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import java.util.concurrent.atomic.AtomicBoolean;

@Singleton
public class ServerBootstrap {
    private static final Logger log = LoggerFactory.getLogger(ServerBootstrap.class);

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerConfig serverConfig;
    private final SchemaRegistry schemaRegistry;
    private final io.netty.bootstrap.ServerBootstrap bootstrap;

    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile Channel serverChannel;

    @Inject
    public ServerBootstrap(
            @Named("bossGroup") EventLoopGroup bossGroup,
            @Named("workerGroup") EventLoopGroup workerGroup,
            Class<? extends ServerChannel> channelClass,
            ServerConfig serverConfig,
            CodecSettings codecSettings,
            SchemaRegistry schemaRegistry,
            ObjectMapper objectMapper,
            EventPublisher eventPublisher,
            CollectorMetrics metrics) {

        this.bossGroup = bossGroup;
        this.workerGroup = workerGroup;
        this.serverConfig = serverConfig;
        this.schemaRegistry = schemaRegistry;

        this.bootstrap = new io.netty.bootstrap.ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(channelClass)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new TelemetryChannelInitializer(
                        codecSettings, schemaRegistry, objectMapper, eventPublisher, metrics));
    }

    public void start() {
        try {
            String host = serverConfig.getHost();
            int port = serverConfig.getPort();
            serverChannel = bootstrap.bind(host, port).sync().channel();

            log.info("Telemetry collector listening on {}:{}", host, port);
            log.info("Boss threads: {}, Worker threads: {}, Schemas: {}",
                    serverConfig.getBossThreads(),
                    serverConfig.getWorkerThreads(),
                    schemaRegistry.size());

            serverChannel.closeFuture().sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Collector interrupted while serving");
        } finally {
            stop();
        }
    }

    /**
     * Closes the listener and drains both event loop groups. Runs once; later calls from
     * the shutdown hook or from {@link #start()} returning are no-ops.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down telemetry collector...");

        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            bossGroup.shutdownGracefully().sync();
            workerGroup.shutdownGracefully().sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down, event loops may still be draining");
            return;
        }

        log.info("Collector shutdown complete");
    }

    public boolean isStopped() {
        return stopped.get();
    }
}
