package com.hts.telemetry.codec.frame;

import com.hts.telemetry.codec.exception.ProtocolException;
import com.hts.telemetry.codec.protocol.CodecState;
import com.hts.telemetry.codec.protocol.Frame;
import com.hts.telemetry.codec.protocol.FrameHeader;
import com.hts.telemetry.codec.protocol.WireFormat;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * TLV state machine (not thread-safe, one per connection)
 *
 * Transport chunks are appended to a cumulation buffer. Bytes are consumed only when
 * {@code pendingBytes} are available, so an incomplete header or payload stays in the
 * buffer until a later chunk completes it.
 *
 * AWAITING_HEADER --(header parsed)--> AWAITING_PAYLOAD --(frame delivered)--> AWAITING_HEADER
 */
public final class FrameReader implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FrameReader.class);

    private final int maxFrameLength;
    private final ByteBuf cumulation = Unpooled.buffer();

    private CodecState state = CodecState.AWAITING_HEADER;
    private int pendingBytes = FrameHeader.HEADER_LENGTH_V1;
    private FrameHeader header;
    private WireFormat wireFormat;

    public FrameReader(int maxFrameLength) {
        if (maxFrameLength < FrameHeader.V1_INNER_HEADER_LENGTH) {
            throw new IllegalArgumentException("maxFrameLength too small: " + maxFrameLength);
        }
        this.maxFrameLength = maxFrameLength;
    }

    public void accept(byte[] chunk, Consumer<Frame> out) {
        accept(Unpooled.wrappedBuffer(chunk), out);
    }

    /**
     * Drains every frame that is complete after appending {@code chunk}. The chunk's
     * reader index is advanced; ownership stays with the caller.
     */
    public void accept(ByteBuf chunk, Consumer<Frame> out) {
        if (log.isDebugEnabled()) {
            log.debug("Transport passing data down: length={} prepending={} waitingFor={}",
                    chunk.readableBytes(), cumulation.readableBytes(), pendingBytes);
        }
        cumulation.writeBytes(chunk);

        try {
            while (cumulation.readableBytes() >= pendingBytes) {
                if (state == CodecState.AWAITING_HEADER) {
                    readHeader();
                } else {
                    out.accept(readPayload());
                }
            }
        } finally {
            cumulation.discardReadBytes();
        }

        if (cumulation.isReadable() && log.isDebugEnabled()) {
            log.debug("Stashing data which has not been consumed: length={} waitingFor={}",
                    cumulation.readableBytes(), pendingBytes);
        }
    }

    private void readHeader() {
        WireFormat format = FrameHeader.peekFormat(cumulation);
        int headerLength = FrameHeader.headerLength(format);
        if (cumulation.readableBytes() < headerLength) {
            // v2 type seen, flags and length still in flight
            pendingBytes = headerLength;
            return;
        }

        header = FrameHeader.decode(cumulation, format);
        wireFormat = format;
        if (header.getLength() > maxFrameLength) {
            throw new ProtocolException("Frame length " + header.getLength()
                    + " exceeds limit " + maxFrameLength, ProtocolException.FRAME_TOO_LARGE);
        }
        if (format == WireFormat.V1 && header.getLength() < FrameHeader.V1_INNER_HEADER_LENGTH) {
            throw new ProtocolException("v1 frame shorter than inner header: " + header.getLength(),
                    ProtocolException.MALFORMED_FRAME);
        }
        changeState(CodecState.AWAITING_PAYLOAD, (int) header.getLength());
    }

    private Frame readPayload() {
        ByteBuf block = cumulation.readSlice(pendingBytes);
        Frame frame;
        if (wireFormat == WireFormat.V2) {
            frame = new Frame(WireFormat.V2, header.getType(), header.isCompressed(), toArray(block));
            changeState(CodecState.AWAITING_HEADER, FrameHeader.HEADER_LENGTH_V2);
        } else {
            int type = (int) block.readUnsignedInt();
            long innerLength = block.readUnsignedInt();
            if (innerLength > block.readableBytes()) {
                throw new ProtocolException("v1 inner length " + innerLength + " exceeds frame remainder "
                        + block.readableBytes(), ProtocolException.MALFORMED_FRAME);
            }
            frame = new Frame(WireFormat.V1, type, header.isCompressed(), toArray(block.readSlice((int) innerLength)));
            changeState(CodecState.AWAITING_HEADER, FrameHeader.HEADER_LENGTH_V1);
        }
        return frame;
    }

    private void changeState(CodecState next, int waitFor) {
        if (log.isDebugEnabled()) {
            log.debug("state transition: from={} to={} waitFor={}", state, next, waitFor);
        }
        state = next;
        pendingBytes = waitFor;
    }

    private static byte[] toArray(ByteBuf buf) {
        byte[] bytes = new byte[buf.readableBytes()];
        buf.readBytes(bytes);
        return bytes;
    }

    public CodecState getState() { return state; }
    public int getPendingBytes() { return pendingBytes; }
    public int getBufferedBytes() { return cumulation.readableBytes(); }

    @Override
    public void close() {
        cumulation.release();
    }
}
