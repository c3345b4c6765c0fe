package com.hts.telemetry.codec.schema;

import java.util.Optional;

/**
 * Schema path → row decoder lookup for the compact format.
 * Read-only once built; shared by all connections.
 */
public interface SchemaRegistry {

    /**
     * @param schemaPath policy path as carried by the table, e.g. "RootOper.Interfaces.Interface.Latest"
     * @return binding, or empty when no decoder is registered (table is skipped)
     */
    Optional<SchemaBinding> resolve(String schemaPath);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
