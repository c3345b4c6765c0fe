package com.hts.telemetry.collector.config;

import com.typesafe.config.Config;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * {@code server} block: where routers dial in and how many event loops serve them.
 */
@Singleton
public final class ServerConfig {
    private final String host;
    private final int port;
    private final int bossThreads;
    private final int workerThreads;

    @Inject
    public ServerConfig(Config config) {
        Config server = config.getConfig("server");
        this.host = server.getString("host");
        this.port = server.getInt("port");
        this.bossThreads = server.getInt("netty.boss-threads");
        this.workerThreads = server.getInt("netty.worker-threads");
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public int getBossThreads() { return bossThreads; }

    /**
     * 0 lets Netty pick twice the available processors.
     */
    public int getWorkerThreads() { return workerThreads; }
}
