package com.hts.telemetry.collector.module;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.hts.telemetry.codec.CodecSettings;
import com.hts.telemetry.codec.schema.DefaultSchemaRegistry;
import com.hts.telemetry.codec.schema.SchemaRegistry;
import com.hts.telemetry.collector.config.TelemetryConfig;
import com.hts.telemetry.collector.event.EventPublisher;
import com.hts.telemetry.collector.event.LoggingEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Singleton;

public final class CodecModule extends AbstractModule {
    private static final Logger log = LoggerFactory.getLogger(CodecModule.class);

    @Override
    protected void configure() {
        bind(EventPublisher.class).to(LoggingEventPublisher.class);
    }

    @Provides
    @Singleton
    CodecSettings provideCodecSettings(TelemetryConfig config) {
        CodecSettings settings = config.toCodecSettings();
        log.info("Codec settings loaded: {}", settings);
        return settings;
    }

    /**
     * Schemas contributed by {@code SchemaProvider} jars on the classpath.
     */
    @Provides
    @Singleton
    SchemaRegistry provideSchemaRegistry() {
        return DefaultSchemaRegistry.fromServiceLoader(CodecModule.class.getClassLoader());
    }

    @Provides
    @Singleton
    ObjectMapper provideObjectMapper() {
        return new ObjectMapper();
    }
}
