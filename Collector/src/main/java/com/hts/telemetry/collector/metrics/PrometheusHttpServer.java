package com.hts.telemetry.collector.metrics;

import com.hts.telemetry.collector.config.MetricsConfig;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Prometheus text exposition of the meter registry over the JDK HTTP server.
 */
@Singleton
public class PrometheusHttpServer {
    private static final Logger log = LoggerFactory.getLogger(PrometheusHttpServer.class);

    private final PrometheusMeterRegistry registry;
    private final int port;
    private final String path;
    private HttpServer server;

    @Inject
    public PrometheusHttpServer(PrometheusMeterRegistry registry, MetricsConfig config) {
        this.registry = registry;
        this.port = config.getPort();
        this.path = config.getPath();
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext(path, exchange -> {
                byte[] body = registry.scrape().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, body.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(body);
                }
            });
            server.start();

            log.info("Metrics endpoint started: http://localhost:{}{}", port, path);
        } catch (IOException e) {
            log.error("Failed to start metrics endpoint on port {}", port, e);
            throw new UncheckedIOException("Failed to start metrics endpoint", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            log.info("Metrics endpoint stopped");
        }
    }
}
