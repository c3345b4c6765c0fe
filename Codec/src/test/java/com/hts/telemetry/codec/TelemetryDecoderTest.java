package com.hts.telemetry.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hts.telemetry.codec.event.TelemetryEvent;
import com.hts.telemetry.codec.exception.CompressionException;
import com.hts.telemetry.codec.exception.ProtocolException;
import com.hts.telemetry.codec.json.XformMode;
import com.hts.telemetry.codec.protocol.CodecState;
import com.hts.telemetry.codec.protocol.FrameHeader;
import com.hts.telemetry.codec.schema.DefaultSchemaRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryDecoderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final CodecSettings RAW = CodecSettings.builder().xform(XformMode.RAW).build();

    private final List<TelemetryDecoder> opened = new ArrayList<>();

    @AfterEach
    void closeDecoders() {
        opened.forEach(TelemetryDecoder::close);
    }

    private TelemetryDecoder decoder(CodecSettings settings) {
        TelemetryDecoder decoder = new TelemetryDecoder(settings, DefaultSchemaRegistry.empty(), MAPPER);
        opened.add(decoder);
        return decoder;
    }

    private static List<Map<String, Object>> decode(TelemetryDecoder decoder, byte[]... chunks) {
        List<Map<String, Object>> events = new ArrayList<>();
        for (byte[] chunk : chunks) {
            decoder.decode(chunk, e -> events.add(e.fields()));
        }
        return events;
    }

    @Test
    @DisplayName("v2 uncompressed JSON in raw mode yields the document")
    void v2RawJson() {
        byte[] frame = Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_NONE, Frames.utf8("{\"a\":1}"));

        TelemetryDecoder decoder = decoder(RAW);
        List<Map<String, Object>> events = decode(decoder, frame);

        assertEquals(List.of(Map.of("a", 1)), events);
        assertEquals(CodecState.AWAITING_HEADER, decoder.getState());
        assertEquals(0, decoder.getBufferedBytes());
    }

    @Test
    @DisplayName("Same events for every split point of the stream")
    void chunkBoundaryInvariance() {
        Frames.Compressor compressor = new Frames.Compressor();
        byte[] stream = Frames.concat(
                Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_NONE, Frames.utf8("{\"n\":1}")),
                Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_COMPRESSED,
                        compressor.compress(Frames.utf8("{\"n\":2}"))),
                Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_COMPRESSED,
                        compressor.compress(Frames.utf8("{\"n\":3}"))));

        List<Map<String, Object>> expected = List.of(Map.of("n", 1), Map.of("n", 2), Map.of("n", 3));
        assertEquals(expected, decode(decoder(RAW), stream));

        for (int split = 1; split < stream.length; split++) {
            byte[] head = Arrays.copyOfRange(stream, 0, split);
            byte[] tail = Arrays.copyOfRange(stream, split, stream.length);
            assertEquals(expected, decode(decoder(RAW), head, tail), "split at " + split);
        }
    }

    @Test
    @DisplayName("Reset frame lets a fresh zlib stream follow")
    void compressorReset() {
        Frames.Compressor compressor = new Frames.Compressor();
        byte[] first = compressor.compress(Frames.utf8("{\"seq\":\"before\"}"));
        compressor.reset();
        byte[] second = compressor.compress(Frames.utf8("{\"seq\":\"after\"}"));

        List<Map<String, Object>> events = decode(decoder(RAW),
                Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_COMPRESSED, first),
                Frames.v2Reset(),
                Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_COMPRESSED, second));

        assertEquals(List.of(Map.of("seq", "before"), Map.of("seq", "after")), events);
    }

    @Test
    @DisplayName("Reset frame recovers a stream cut off in the middle of a block")
    void compressorResetAfterTruncatedFrame() {
        StringBuilder sb = new StringBuilder("{\"rows\":[");
        for (int i = 0; i < 1000; i++) {
            sb.append(i == 0 ? "" : ",").append("{\"if\":\"Gi0/0/0/").append(i).append("\"}");
        }
        sb.append("]}");

        Frames.Compressor compressor = new Frames.Compressor();
        byte[] whole = compressor.compress(Frames.utf8(sb.toString()));
        byte[] truncated = Arrays.copyOf(whole, whole.length / 2);
        compressor.reset();
        byte[] fresh = compressor.compress(Frames.utf8("{\"seq\":\"after\"}"));

        TelemetryDecoder decoder = decoder(RAW);
        List<Map<String, Object>> events = decode(decoder,
                Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_COMPRESSED, truncated),
                Frames.v2Reset(),
                Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_COMPRESSED, fresh));

        assertEquals(2, events.size());
        assertTrue(events.get(0).containsKey(TelemetryEvent.FIELD_UNPARSED));
        assertEquals(Map.of("seq", "after"), events.get(1));
        assertFalse(decoder.isFailed());
    }

    @Test
    @DisplayName("Corrupt compressed payload is a fatal inflate error")
    void corruptCompressedPayload() {
        Frames.Compressor compressor = new Frames.Compressor();
        byte[] first = compressor.compress(Frames.utf8("{\"seq\":1}"));
        byte[] corrupt = {(byte) 0xff, (byte) 0xff, 0x00, 0x01};

        TelemetryDecoder decoder = decoder(RAW);
        assertEquals(List.of(Map.of("seq", 1)),
                decode(decoder, Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_COMPRESSED, first)));

        assertThrows(CompressionException.class,
                () -> decode(decoder, Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_COMPRESSED, corrupt)));
        assertTrue(decoder.isFailed());
    }

    @Test
    @DisplayName("v1 frames are always inflated")
    void v1CompressedJson() {
        Frames.Compressor compressor = new Frames.Compressor();
        byte[] frame = Frames.v1(FrameHeader.TYPE_JSON, compressor.compress(Frames.utf8("{\"v\":1}")));

        assertEquals(List.of(Map.of("v", 1)), decode(decoder(RAW), Frames.v1Reset(), frame));
    }

    @Test
    @DisplayName("flat mode through the full pipeline")
    void flatJson() {
        CodecSettings settings = CodecSettings.builder()
                .flatKey("IF", "Interfaces~(?<InterfaceName>.*)~Latest")
                .build();
        String json = "{\"Identifier\":\"r1\",\"Path\":\"RootOper.Interfaces\",\"Data\":"
                + "{\"Interfaces\":{\"Gi0\":{\"Latest\":{\"rx\":5}}}}}";

        List<Map<String, Object>> events = decode(decoder(settings),
                Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_NONE, Frames.utf8(json)));

        assertEquals(1, events.size());
        Map<String, Object> event = events.get(0);
        assertEquals("DATA~Interfaces~Gi0~Latest", event.get(TelemetryEvent.FIELD_PATH));
        assertEquals("IF", event.get(TelemetryEvent.FIELD_TYPE));
        assertEquals(Map.of("IF", Map.of("rx", 5), "key", Map.of("InterfaceName", "Gi0")),
                event.get(TelemetryEvent.FIELD_CONTENT));
        assertEquals("r1", event.get("identifier"));
    }

    @Test
    @DisplayName("Unknown v2 type yields nothing and rejects the connection")
    void unknownV2Type() {
        TelemetryDecoder decoder = decoder(RAW);
        List<Map<String, Object>> events = new ArrayList<>();

        ProtocolException e = assertThrows(ProtocolException.class,
                () -> decoder.decode(Frames.v2(0, FrameHeader.FLAG_NONE, Frames.utf8("{}")), ev -> events.add(ev.fields())));

        assertEquals(ProtocolException.UNKNOWN_PAYLOAD_TYPE, e.getErrorCode());
        assertTrue(e.shouldCloseConnection());
        assertTrue(events.isEmpty());

        byte[] good = Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_NONE, Frames.utf8("{\"ok\":true}"));
        assertEquals(List.of(Map.of("ok", true)), decode(decoder(RAW), good));
    }

    @Test
    @DisplayName("Unknown v1 inner type rejects the connection")
    void unknownV1Type() {
        TelemetryDecoder decoder = decoder(RAW);

        ProtocolException e = assertThrows(ProtocolException.class,
                () -> decode(decoder, Frames.v1(9, Frames.utf8("{}"))));
        assertEquals(ProtocolException.UNKNOWN_PAYLOAD_TYPE, e.getErrorCode());
    }

    @Test
    @DisplayName("Decoder refuses input after a fatal error and after close")
    void refusesInputWhenFailedOrClosed() {
        TelemetryDecoder failed = decoder(RAW);
        assertThrows(ProtocolException.class, () -> decode(failed, Frames.v2(0, FrameHeader.FLAG_NONE, new byte[0])));

        byte[] good = Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_NONE, Frames.utf8("{}"));
        ProtocolException refused = assertThrows(ProtocolException.class, () -> decode(failed, good));
        assertEquals(ProtocolException.DECODER_CLOSED, refused.getErrorCode());

        TelemetryDecoder closed = decoder(RAW);
        closed.close();
        assertThrows(ProtocolException.class, () -> decode(closed, good));
    }

    @Test
    @DisplayName("Malformed JSON does not break the stream")
    void unparsedJsonKeepsStreamAlive() {
        List<Map<String, Object>> events = decode(decoder(RAW),
                Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_NONE, Frames.utf8("not json")),
                Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_NONE, Frames.utf8("{\"x\":1}")));

        assertEquals(List.of(Map.of(TelemetryEvent.FIELD_UNPARSED, "not json"), Map.of("x", 1)), events);
    }

    @Test
    @DisplayName("Trailing partial frame is stashed until the next chunk")
    void partialFrameStashed() {
        byte[] frame = Frames.v2(FrameHeader.TYPE_JSON, FrameHeader.FLAG_NONE, Frames.utf8("{\"x\":1}"));
        TelemetryDecoder decoder = decoder(RAW);

        assertTrue(decode(decoder, Arrays.copyOf(frame, 15)).isEmpty());
        assertEquals(CodecState.AWAITING_PAYLOAD, decoder.getState());
        assertEquals(3, decoder.getBufferedBytes());
    }
}
