package com.hts.telemetry.codec.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.hts.telemetry.codec.event.EventSink;
import com.hts.telemetry.codec.event.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON payload (type 2). Parse failures never escape: the text is passed on as an
 * {@value TelemetryEvent#FIELD_UNPARSED} event and the stream continues.
 */
public final class JsonPayloadDecoder {
    private static final Logger log = LoggerFactory.getLogger(JsonPayloadDecoder.class);

    public static final String SEED_PATH = "DATA";

    // Document fields
    static final String DOC_PATH = "Path";
    static final String DOC_DATA = "Data";
    static final String DOC_IDENTIFIER = "Identifier";
    static final String DOC_POLICY = "Policy";
    static final String DOC_VERSION = "Version";
    static final String DOC_END_TIME = "End Time";
    // 6.0.1 documents
    static final String DOC_COLLECTION_END_TIME = "CollectionEndTime";
    static final String DOC_COLLECTION_START_TIME = "CollectionStartTime";
    static final String DOC_COLLECTION_ID = "CollectionID";

    // Event envelope fields
    public static final String IDENTIFIER = "identifier";
    public static final String POLICY_NAME = "policy_name";
    public static final String VERSION = "version";
    public static final String END_TIME = "end_time";
    public static final String START_TIME = "start_time";
    public static final String COLLECTION_ID = "collection_id";

    private final ObjectReader reader;
    private final XformMode mode;
    private final FlatteningEngine engine;

    public JsonPayloadDecoder(ObjectMapper mapper, XformMode mode, FilterTable filters) {
        // a document followed by anything but whitespace is malformed
        this.reader = mapper.readerFor(Object.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.mode = mode;
        this.engine = new FlatteningEngine(filters);
    }

    public void decode(byte[] payload, EventSink sink) {
        Map<String, Object> document = parse(payload);
        if (document == null) {
            String text = new String(payload, StandardCharsets.UTF_8);
            sink.emit(TelemetryEvent.unparsed(text));
            return;
        }

        switch (mode) {
            case RAW -> {
                if (log.isDebugEnabled()) {
                    log.debug("Yielding raw event: keys={}", document.keySet());
                }
                sink.emit(TelemetryEvent.of(document));
            }
            case FLAT -> flatten(document, sink);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> parse(byte[] payload) {
        try {
            Object parsed = reader.readValue(payload);
            if (parsed instanceof Map) {
                return (Map<String, Object>) parsed;
            }
            log.info("JSON payload is not an object, passing text on: type={}",
                    parsed == null ? "null" : parsed.getClass().getSimpleName());
        } catch (IOException e) {
            log.info("JSON parse error, passing text on: {}", e.getMessage());
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private void flatten(Map<String, Object> document, EventSink sink) {
        Object data = document.get(DOC_DATA);
        if (!(data instanceof Map)) {
            log.debug("No Data object in document, nothing to flatten");
            return;
        }
        Object sourcePath = document.get(DOC_PATH);
        Map<String, Object> envelope = envelope(document);

        engine.flatten(sourcePath == null ? null : sourcePath.toString(), SEED_PATH, (Map<String, Object>) data,
                (path, type, content) -> {
                    Map<String, Object> fields = new LinkedHashMap<>();
                    fields.put(TelemetryEvent.FIELD_PATH, path);
                    fields.put(TelemetryEvent.FIELD_TYPE, type);
                    fields.put(TelemetryEvent.FIELD_CONTENT, content);
                    fields.putAll(envelope);
                    TelemetryEvent event = TelemetryEvent.of(fields);
                    if (log.isDebugEnabled()) {
                        log.debug("Yielding flat event: path={} type={}", path, type);
                    }
                    sink.emit(event);
                });
    }

    private static Map<String, Object> envelope(Map<String, Object> document) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        putIfPresent(envelope, IDENTIFIER, document.get(DOC_IDENTIFIER));
        putIfPresent(envelope, POLICY_NAME, document.get(DOC_POLICY));
        putIfPresent(envelope, VERSION, document.get(DOC_VERSION));

        Object endTime = document.get(DOC_END_TIME);
        if (endTime != null) {
            envelope.put(END_TIME, endTime);
        } else {
            putIfPresent(envelope, END_TIME, document.get(DOC_COLLECTION_END_TIME));
            putIfPresent(envelope, START_TIME, document.get(DOC_COLLECTION_START_TIME));
            putIfPresent(envelope, COLLECTION_ID, document.get(DOC_COLLECTION_ID));
        }
        return envelope;
    }

    private static void putIfPresent(Map<String, Object> target, String field, Object value) {
        if (value != null) {
            target.put(field, value);
        }
    }
}
