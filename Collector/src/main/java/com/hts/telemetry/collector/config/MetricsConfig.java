package com.hts.telemetry.collector.config;

import com.typesafe.config.Config;

import javax.inject.Inject;
import javax.inject.Singleton;

@Singleton
public final class MetricsConfig {
    private final int port;
    private final String path;

    @Inject
    public MetricsConfig(Config config) {
        Config metrics = config.getConfig("metrics");
        this.port = metrics.getInt("port");
        this.path = metrics.getString("path");
    }

    public int getPort() { return port; }

    /** scrape context, e.g. "/metrics" */
    public String getPath() { return path; }
}
