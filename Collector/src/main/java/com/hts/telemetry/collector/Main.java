package com.hts.telemetry.collector;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.hts.telemetry.collector.core.ServerBootstrap;
import com.hts.telemetry.collector.metrics.PrometheusHttpServer;
import com.hts.telemetry.collector.module.CodecModule;
import com.hts.telemetry.collector.module.ConfigModule;
import com.hts.telemetry.collector.module.MetricsModule;
import com.hts.telemetry.collector.module.NettyModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Initializing telemetry collector...");

        Injector injector = Guice.createInjector(
                new ConfigModule(),
                new CodecModule(),
                new NettyModule(),
                new MetricsModule()
        );

        ServerBootstrap server = injector.getInstance(ServerBootstrap.class);
        PrometheusHttpServer prometheusServer = injector.getInstance(PrometheusHttpServer.class);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered");
            prometheusServer.stop();
            server.stop();
        }));

        prometheusServer.start();
        server.start();
    }
}
