package com.hts.telemetry.codec.gpb;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.hts.telemetry.codec.event.EventSink;
import com.hts.telemetry.codec.event.TelemetryEvent;
import com.hts.telemetry.codec.proto.TelemetryProto.TelemetryHeader;
import com.hts.telemetry.codec.proto.TelemetryProto.TelemetryTable;
import com.hts.telemetry.codec.schema.SchemaBinding;
import com.hts.telemetry.codec.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Compact GPB payload (type 3): header plus tables of opaque rows, one event per row.
 *
 * Failures stay local. A header that does not parse drops the message, an unregistered
 * policy path drops the table, a row that does not parse drops the row.
 */
public final class CompactTableDecoder {
    private static final Logger log = LoggerFactory.getLogger(CompactTableDecoder.class);

    // Envelope fields
    public static final String ENCODING = "encoding";
    public static final String POLICY_NAME = "policy_name";
    public static final String IDENTIFIER = "identifier";
    public static final String START_TIME = "start_time";
    public static final String END_TIME = "end_time";

    private final SchemaRegistry registry;

    public CompactTableDecoder(SchemaRegistry registry) {
        this.registry = registry;
    }

    public void decode(byte[] payload, EventSink sink) {
        if (registry.isEmpty()) {
            log.warn("No schemas registered, received compact content is dropped: bytes={}", payload.length);
            return;
        }

        TelemetryHeader header;
        try {
            header = TelemetryHeader.parseFrom(payload);
        } catch (InvalidProtocolBufferException e) {
            log.warn("Failed to decode telemetry header: bytes={}", payload.length, e);
            return;
        }

        Map<String, Object> envelope = envelope(header);
        for (TelemetryTable table : header.getTablesList()) {
            String policyPath = table.getPolicyPath();
            if (log.isDebugEnabled()) {
                log.debug("Message policy path: identifier={} policyName={} endTime={} policyPath={} rows={}",
                        header.getIdentifier(), header.getPolicyName(), header.getEndTime(), policyPath,
                        table.getRowCount());
            }

            Optional<SchemaBinding> binding = registry.resolve(policyPath);
            if (binding.isEmpty()) {
                log.debug("No decoder available: policyPath={}", policyPath);
                continue;
            }
            decodeRows(table, binding.get(), envelope, sink);
        }
    }

    private void decodeRows(TelemetryTable table, SchemaBinding binding, Map<String, Object> envelope, EventSink sink) {
        for (ByteString row : table.getRowList()) {
            Map<String, Object> content;
            try {
                content = binding.decoder().decode(row);
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to decode telemetry row: policyPath={} decoder={} rowBytes={}",
                        binding.schemaPath(), binding.typeName(), row.size(), e);
                continue;
            }

            Map<String, Object> fields = new LinkedHashMap<>(envelope);
            fields.put(TelemetryEvent.FIELD_CONTENT, content);
            fields.put(TelemetryEvent.FIELD_TYPE, binding.typeName());
            fields.put(TelemetryEvent.FIELD_PATH, table.getPolicyPath());
            sink.emit(TelemetryEvent.of(fields));
        }
    }

    static Map<String, Object> envelope(TelemetryHeader header) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        if (header.hasEncoding()) envelope.put(ENCODING, ProtoMaps.unsigned(header.getEncoding()));
        if (header.hasPolicyName()) envelope.put(POLICY_NAME, header.getPolicyName());
        if (header.hasIdentifier()) envelope.put(IDENTIFIER, header.getIdentifier());
        if (header.hasStartTime()) envelope.put(START_TIME, ProtoMaps.unsigned(header.getStartTime()));
        if (header.hasEndTime()) envelope.put(END_TIME, ProtoMaps.unsigned(header.getEndTime()));
        return envelope;
    }
}
