package com.hts.telemetry.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hts.telemetry.codec.event.EventSink;
import com.hts.telemetry.codec.exception.CodecException;
import com.hts.telemetry.codec.exception.ProtocolException;
import com.hts.telemetry.codec.frame.Decompressor;
import com.hts.telemetry.codec.frame.FrameReader;
import com.hts.telemetry.codec.gpb.CompactTableDecoder;
import com.hts.telemetry.codec.gpb.KvTreeDecoder;
import com.hts.telemetry.codec.json.JsonPayloadDecoder;
import com.hts.telemetry.codec.protocol.CodecState;
import com.hts.telemetry.codec.schema.SchemaRegistry;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * Per-connection telemetry stream decoder (not thread-safe, not Sharable)
 *
 * Chunks must arrive in transport order. Each call drains every frame that is complete
 * and emits its events before returning; a trailing partial frame is kept for the next
 * call. A {@link CodecException} that asks for the connection to close leaves the
 * decoder unusable.
 */
public final class TelemetryDecoder implements AutoCloseable {

    private final FrameReader reader;
    private final Decompressor decompressor;
    private final PayloadDispatcher dispatcher;
    private boolean failed;
    private boolean closed;

    public TelemetryDecoder(CodecSettings settings, SchemaRegistry registry, ObjectMapper mapper) {
        this.reader = new FrameReader(settings.getMaxFrameLength());
        this.decompressor = new Decompressor();
        this.dispatcher = new PayloadDispatcher(
                decompressor,
                new JsonPayloadDecoder(mapper, settings.getXform(), settings.getFilters()),
                new CompactTableDecoder(registry),
                new KvTreeDecoder());
    }

    public void decode(byte[] chunk, EventSink sink) {
        decode(Unpooled.wrappedBuffer(chunk), sink);
    }

    public void decode(ByteBuf chunk, EventSink sink) {
        if (failed || closed) {
            throw new ProtocolException("Decoder no longer accepts input", ProtocolException.DECODER_CLOSED);
        }
        try {
            reader.accept(chunk, frame -> dispatcher.dispatch(frame, sink));
        } catch (CodecException e) {
            if (e.shouldCloseConnection()) {
                failed = true;
            }
            throw e;
        }
    }

    public CodecState getState() { return reader.getState(); }
    public int getPendingBytes() { return reader.getPendingBytes(); }
    public int getBufferedBytes() { return reader.getBufferedBytes(); }
    public boolean isFailed() { return failed; }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        reader.close();
        decompressor.close();
    }
}
