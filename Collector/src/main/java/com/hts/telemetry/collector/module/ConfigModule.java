package com.hts.telemetry.collector.module;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Singleton;

/**
 * application.conf from the classpath; {@code -Dconfig.file} and the environment
 * overrides declared in it take precedence.
 */
public final class ConfigModule extends AbstractModule {
    private static final Logger log = LoggerFactory.getLogger(ConfigModule.class);

    private static final String[] REQUIRED = {"server", "telemetry", "metrics"};

    @Provides
    @Singleton
    Config provideConfig() {
        Config config = ConfigFactory.load();
        for (String path : REQUIRED) {
            if (!config.hasPath(path)) {
                throw new IllegalStateException("Missing configuration block: " + path);
            }
        }
        log.info("Configuration loaded: origin={}", config.origin().description());
        return config;
    }
}
