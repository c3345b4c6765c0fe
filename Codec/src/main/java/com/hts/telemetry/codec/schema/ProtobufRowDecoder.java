package com.hts.telemetry.codec.schema;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import com.hts.telemetry.codec.gpb.ProtoMaps;

import java.util.Map;

/**
 * Row decoder backed by a compiled protobuf message.
 */
public final class ProtobufRowDecoder implements RowDecoder {
    private final Parser<? extends Message> parser;

    public ProtobufRowDecoder(Parser<? extends Message> parser) {
        this.parser = parser;
    }

    /**
     * Binds {@code schemaPath} to the message type of {@code prototype}; the event type
     * name is the message's simple name.
     */
    public static SchemaBinding bind(String schemaPath, Message prototype) {
        return new SchemaBinding(schemaPath, prototype.getDescriptorForType().getName(),
                new ProtobufRowDecoder(prototype.getParserForType()));
    }

    @Override
    public Map<String, Object> decode(ByteString row) throws InvalidProtocolBufferException {
        return ProtoMaps.toMap(parser.parseFrom(row));
    }
}
