package com.hts.telemetry.codec.schema;

import com.google.protobuf.ByteString;

import java.io.IOException;
import java.util.Map;

/**
 * Decodes one compact-format row into a nested field map.
 */
@FunctionalInterface
public interface RowDecoder {
    Map<String, Object> decode(ByteString row) throws IOException;
}
