package com.hts.telemetry.codec.schema;

/**
 * Schema path bound to the decoder for its rows and the type name events carry.
 */
public record SchemaBinding(String schemaPath, String typeName, RowDecoder decoder) {

    public SchemaBinding {
        if (schemaPath == null || schemaPath.isEmpty()) {
            throw new IllegalArgumentException("schemaPath must not be empty");
        }
        if (typeName == null) {
            throw new IllegalArgumentException("typeName must not be null");
        }
        if (decoder == null) {
            throw new IllegalArgumentException("decoder must not be null");
        }
    }
}
