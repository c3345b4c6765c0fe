package com.hts.telemetry.collector.module;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.hts.telemetry.collector.config.ServerConfig;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import javax.inject.Named;
import javax.inject.Singleton;

/**
 * Native epoll transport on Linux, NIO elsewhere.
 */
public final class NettyModule extends AbstractModule {

    @Provides
    @Singleton
    @Named("bossGroup")
    EventLoopGroup provideBossGroup(ServerConfig config) {
        return Epoll.isAvailable()
                ? new EpollEventLoopGroup(config.getBossThreads())
                : new NioEventLoopGroup(config.getBossThreads());
    }

    @Provides
    @Singleton
    @Named("workerGroup")
    EventLoopGroup provideWorkerGroup(ServerConfig config) {
        return Epoll.isAvailable()
                ? new EpollEventLoopGroup(config.getWorkerThreads())
                : new NioEventLoopGroup(config.getWorkerThreads());
    }

    @Provides
    @Singleton
    Class<? extends ServerChannel> provideServerChannelClass() {
        return Epoll.isAvailable() ? EpollServerSocketChannel.class : NioServerSocketChannel.class;
    }
}
