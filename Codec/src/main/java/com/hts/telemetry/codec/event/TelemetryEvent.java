package com.hts.telemetry.codec.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decoded telemetry unit handed to an {@link EventSink}.
 *
 * Field order is kept as produced: envelope fields first for binary formats,
 * document order for raw JSON.
 */
public final class TelemetryEvent {
    public static final String FIELD_PATH = "path";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_UNPARSED = "unparsed_message";

    private final Map<String, Object> fields;

    private TelemetryEvent(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static TelemetryEvent of(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields must not be null");
        }
        return new TelemetryEvent(new LinkedHashMap<>(fields));
    }

    public static TelemetryEvent unparsed(String text) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(FIELD_UNPARSED, text);
        return new TelemetryEvent(fields);
    }

    public Map<String, Object> fields() { return fields; }

    public Object get(String name) { return fields.get(name); }

    public String path() { return (String) fields.get(FIELD_PATH); }
    public String type() { return (String) fields.get(FIELD_TYPE); }
    public Object content() { return fields.get(FIELD_CONTENT); }

    public boolean isUnparsed() {
        return fields.containsKey(FIELD_UNPARSED);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TelemetryEvent other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "TelemetryEvent" + fields;
    }
}
