package com.hts.telemetry.codec.gpb;

import com.google.protobuf.InvalidProtocolBufferException;
import com.hts.telemetry.codec.event.EventSink;
import com.hts.telemetry.codec.event.TelemetryEvent;
import com.hts.telemetry.codec.proto.TelemetryKvProto.Telemetry;
import com.hts.telemetry.codec.proto.TelemetryKvProto.TelemetryField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Self-describing GPB payload (type 4).
 *
 * Every top-level field becomes one event. Below that, fields fold into a single map per
 * level: a leaf contributes {@code name → value}, an inner field contributes
 * {@code name → its own node map}. Nodes without a timestamp take their parent's.
 */
public final class KvTreeDecoder {
    private static final Logger log = LoggerFactory.getLogger(KvTreeDecoder.class);

    public static final String TIMESTAMP = "timestamp";

    // Envelope fields
    public static final String COLLECTION_ID = "collection_id";
    public static final String BASE_PATH = "base_path";
    public static final String SUBSCRIPTION_IDENTIFIER = "subscription_identifier";
    public static final String MODEL_VERSION = "model_version";
    public static final String COLLECTION_START_TIME = "collection_start_time";
    public static final String MSG_TIMESTAMP = "msg_timestamp";
    public static final String COLLECTION_END_TIME = "collection_end_time";

    public void decode(byte[] payload, EventSink sink) {
        Telemetry message;
        try {
            message = Telemetry.parseFrom(payload);
        } catch (InvalidProtocolBufferException e) {
            log.warn("Failed to decode telemetry kv: bytes={}", payload.length, e);
            return;
        }

        if (log.isDebugEnabled()) {
            log.debug("Message policy paths: collectionId={} basePath={} msgTimestamp={} tables={}",
                    message.getCollectionId(), message.getBasePath(), message.getMsgTimestamp(),
                    message.getTablesCount());
        }

        Map<String, Object> envelope = envelope(message);
        Object msgTimestamp = message.hasMsgTimestamp() ? ProtoMaps.unsigned(message.getMsgTimestamp()) : null;
        for (TelemetryField table : message.getTablesList()) {
            Map<String, Object> fields = node(table, msgTimestamp);
            fields.putAll(envelope);
            sink.emit(TelemetryEvent.of(fields));
        }
    }

    private static Map<String, Object> node(TelemetryField field, Object inheritedTimestamp) {
        Map<String, Object> ev = new LinkedHashMap<>();
        Object timestamp = field.hasTimestamp() ? ProtoMaps.unsigned(field.getTimestamp()) : inheritedTimestamp;
        if (timestamp != null) {
            ev.put(TIMESTAMP, timestamp);
        }

        Object value = scalar(field);
        if (value != null) {
            ev.put(field.getName(), value);
        }

        if (field.getTablesCount() > 0) {
            Map<String, Object> content = new LinkedHashMap<>();
            for (TelemetryField child : field.getTablesList()) {
                if (child.getTablesCount() == 0) {
                    Object childValue = scalar(child);
                    if (childValue != null) {
                        content.put(child.getName(), childValue);
                    }
                } else {
                    content.put(child.getName(), node(child, timestamp));
                }
            }
            ev.put(TelemetryEvent.FIELD_CONTENT, content);
        }
        return ev;
    }

    /**
     * @return the field's typed value, null when none is set
     */
    static Object scalar(TelemetryField field) {
        switch (field.getValueByTypeCase()) {
            case BYTES_VALUE:
                return field.getBytesValue().toStringUtf8();
            case STRING_VALUE:
                return field.getStringValue();
            case BOOL_VALUE:
                return field.getBoolValue();
            case UINT32_VALUE:
                return ProtoMaps.unsigned(field.getUint32Value());
            case UINT64_VALUE:
                return ProtoMaps.unsigned(field.getUint64Value());
            case SINT32_VALUE:
                return field.getSint32Value();
            case SINT64_VALUE:
                return field.getSint64Value();
            case DOUBLE_VALUE:
                return field.getDoubleValue();
            case FLOAT_VALUE:
                return field.getFloatValue();
            default:
                return null;
        }
    }

    static Map<String, Object> envelope(Telemetry message) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        if (message.hasCollectionId()) envelope.put(COLLECTION_ID, ProtoMaps.unsigned(message.getCollectionId()));
        if (message.hasBasePath()) envelope.put(BASE_PATH, message.getBasePath());
        if (message.hasSubscriptionIdentifier()) envelope.put(SUBSCRIPTION_IDENTIFIER, message.getSubscriptionIdentifier());
        if (message.hasModelVersion()) envelope.put(MODEL_VERSION, message.getModelVersion());
        if (message.hasCollectionStartTime()) {
            envelope.put(COLLECTION_START_TIME, ProtoMaps.unsigned(message.getCollectionStartTime()));
        }
        if (message.hasMsgTimestamp()) envelope.put(MSG_TIMESTAMP, ProtoMaps.unsigned(message.getMsgTimestamp()));
        if (message.hasCollectionEndTime()) {
            envelope.put(COLLECTION_END_TIME, ProtoMaps.unsigned(message.getCollectionEndTime()));
        }
        return envelope;
    }
}
