package com.hts.telemetry.codec;

import com.hts.telemetry.codec.event.EventSink;
import com.hts.telemetry.codec.exception.ProtocolException;
import com.hts.telemetry.codec.frame.Decompressor;
import com.hts.telemetry.codec.gpb.CompactTableDecoder;
import com.hts.telemetry.codec.gpb.KvTreeDecoder;
import com.hts.telemetry.codec.json.JsonPayloadDecoder;
import com.hts.telemetry.codec.protocol.Frame;
import com.hts.telemetry.codec.protocol.FrameHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a frame to the decoder for its payload type, inflating first when flagged.
 * Payload decoders are stateless; the decompressor belongs to the connection.
 */
final class PayloadDispatcher {
    private static final Logger log = LoggerFactory.getLogger(PayloadDispatcher.class);

    private final Decompressor decompressor;
    private final JsonPayloadDecoder jsonDecoder;
    private final CompactTableDecoder compactDecoder;
    private final KvTreeDecoder kvDecoder;

    PayloadDispatcher(Decompressor decompressor, JsonPayloadDecoder jsonDecoder,
                      CompactTableDecoder compactDecoder, KvTreeDecoder kvDecoder) {
        this.decompressor = decompressor;
        this.jsonDecoder = jsonDecoder;
        this.compactDecoder = compactDecoder;
        this.kvDecoder = kvDecoder;
    }

    void dispatch(Frame frame, EventSink sink) {
        switch (frame.type()) {
            case FrameHeader.TYPE_COMPRESSOR_RESET -> decompressor.reset();
            case FrameHeader.TYPE_JSON -> jsonDecoder.decode(unwrap(frame), sink);
            case FrameHeader.TYPE_GPB_COMPACT -> compactDecoder.decode(unwrap(frame), sink);
            case FrameHeader.TYPE_GPB_KV -> kvDecoder.decode(unwrap(frame), sink);
            default -> {
                log.error("Resetting connection on unknown type: {}", frame);
                throw new ProtocolException("Unexpected message type in TLV: " + frame.type(),
                        ProtocolException.UNKNOWN_PAYLOAD_TYPE);
            }
        }
    }

    private byte[] unwrap(Frame frame) {
        return frame.compressed() ? decompressor.inflate(frame.payload()) : frame.payload();
    }
}
