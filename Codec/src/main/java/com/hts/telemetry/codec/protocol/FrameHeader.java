package com.hts.telemetry.codec.protocol;

import io.netty.buffer.ByteBuf;

/**
 * TLV frame header, both wire formats.
 *
 * v1 (4B):  length (N > 4). The payload starts with its own type and inner length.
 * v2 (12B): type (N <= 4), flags, length. Bit 0 of flags marks zlib compression.
 *
 * The first big-endian u32 is the only discriminator: a value above
 * {@link #V2_MAX_TYPE} can only be a v1 length.
 */
public final class FrameHeader {
    public static final int HEADER_LENGTH_V1 = 4;
    public static final int HEADER_LENGTH_V2 = 12;
    public static final int V1_INNER_HEADER_LENGTH = 8;
    public static final long V2_MAX_TYPE = 4;

    // Payload types
    public static final int TYPE_COMPRESSOR_RESET = 1;
    public static final int TYPE_JSON = 2;
    public static final int TYPE_GPB_COMPACT = 3;
    public static final int TYPE_GPB_KV = 4;

    // Flags
    public static final long FLAG_NONE = 0x0;
    public static final long FLAG_COMPRESSED = 0x1;

    private static final int TYPE_CARRIED_IN_PAYLOAD = -1;

    private final WireFormat wireFormat;
    private final int type;
    private final long flags;
    private final long length;

    private FrameHeader(WireFormat wireFormat, int type, long flags, long length) {
        this.wireFormat = wireFormat;
        this.type = type;
        this.flags = flags;
        this.length = length;
    }

    /**
     * Looks at the leading u32 without consuming it.
     */
    public static WireFormat peekFormat(ByteBuf buf) {
        long first = buf.getUnsignedInt(buf.readerIndex());
        return first > V2_MAX_TYPE ? WireFormat.V1 : WireFormat.V2;
    }

    public static int headerLength(WireFormat format) {
        return format == WireFormat.V1 ? HEADER_LENGTH_V1 : HEADER_LENGTH_V2;
    }

    /**
     * Consumes a header of the given format. The caller guarantees enough readable bytes.
     */
    public static FrameHeader decode(ByteBuf buf, WireFormat format) {
        if (buf.readableBytes() < headerLength(format)) {
            throw new IllegalArgumentException("Insufficient bytes for header: " + buf.readableBytes());
        }
        if (format == WireFormat.V1) {
            long length = buf.readUnsignedInt();
            // Format prior to v2 was always compressed
            return new FrameHeader(WireFormat.V1, TYPE_CARRIED_IN_PAYLOAD, FLAG_COMPRESSED, length);
        }
        int type = (int) buf.readUnsignedInt();
        long flags = buf.readUnsignedInt();
        long length = buf.readUnsignedInt();
        return new FrameHeader(WireFormat.V2, type, flags, length);
    }

    public long getLength() { return length; }

    /**
     * Payload type for v2 headers; v1 headers carry it inside the payload.
     */
    public int getType() { return type; }

    public boolean isCompressed() {
        return (flags & FLAG_COMPRESSED) != 0;
    }

    @Override
    public String toString() {
        return String.format("Header[%s type=%d flags=0x%x len=%d]", wireFormat, type, flags, length);
    }
}
