package com.hts.telemetry.codec.schema;

import java.util.Collection;

/**
 * Contributes schema bindings at startup. Implementations are listed in
 * {@code META-INF/services/com.hts.telemetry.codec.schema.SchemaProvider}.
 */
public interface SchemaProvider {
    Collection<SchemaBinding> schemas();
}
