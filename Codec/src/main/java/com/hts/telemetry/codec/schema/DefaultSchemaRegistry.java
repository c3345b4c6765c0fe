package com.hts.telemetry.codec.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Explicit registration map built once at startup.
 *
 * <pre>{@code
 * SchemaRegistry registry = DefaultSchemaRegistry.builder()
 *     .register(ProtobufRowDecoder.bind("RootOper.Interfaces.Latest", IfstatsbagGeneric.getDefaultInstance()))
 *     .build();
 * }</pre>
 */
public final class DefaultSchemaRegistry implements SchemaRegistry {
    private static final Logger log = LoggerFactory.getLogger(DefaultSchemaRegistry.class);

    private final Map<String, SchemaBinding> bindings;

    private DefaultSchemaRegistry(Map<String, SchemaBinding> bindings) {
        this.bindings = Map.copyOf(bindings);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DefaultSchemaRegistry empty() {
        return new DefaultSchemaRegistry(Map.of());
    }

    /**
     * Collects the bindings of every {@link SchemaProvider} visible to the class loader.
     */
    public static DefaultSchemaRegistry fromServiceLoader(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Builder builder = builder();
        for (SchemaProvider provider : ServiceLoader.load(SchemaProvider.class, cl)) {
            for (SchemaBinding binding : provider.schemas()) {
                builder.register(binding);
            }
            log.info("Loaded schema provider: {}", provider.getClass().getName());
        }
        return builder.build();
    }

    @Override
    public Optional<SchemaBinding> resolve(String schemaPath) {
        if (schemaPath == null) return Optional.empty();
        return Optional.ofNullable(bindings.get(schemaPath));
    }

    @Override
    public int size() {
        return bindings.size();
    }

    public static final class Builder {
        private final Map<String, SchemaBinding> bindings = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Register a binding. A later binding for the same path replaces the earlier one.
         */
        public Builder register(SchemaBinding binding) {
            Objects.requireNonNull(binding, "binding");
            SchemaBinding previous = bindings.put(binding.schemaPath(), binding);
            if (previous != null) {
                log.warn("Schema path registered twice, keeping the latest: path={} previous={} current={}",
                        binding.schemaPath(), previous.typeName(), binding.typeName());
            }
            return this;
        }

        public Builder register(String schemaPath, String typeName, RowDecoder decoder) {
            return register(new SchemaBinding(schemaPath, typeName, decoder));
        }

        public DefaultSchemaRegistry build() {
            DefaultSchemaRegistry registry = new DefaultSchemaRegistry(bindings);
            log.info("Schema registry built: {} paths {}", bindings.size(), bindings.keySet());
            return registry;
        }
    }
}
