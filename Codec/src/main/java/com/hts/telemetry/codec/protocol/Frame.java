package com.hts.telemetry.codec.protocol;

/**
 * One complete TLV unit: payload type, compression flag and the (still compressed) value bytes.
 */
public record Frame(WireFormat wireFormat, int type, boolean compressed, byte[] payload) {

    public Frame {
        if (wireFormat == null) {
            throw new IllegalArgumentException("wireFormat must not be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
    }

    public boolean isCompressorReset() {
        return type == FrameHeader.TYPE_COMPRESSOR_RESET;
    }

    @Override
    public String toString() {
        return String.format("Frame[%s type=%d compressed=%s payloadBytes=%d]",
                wireFormat, type, compressed, payload.length);
    }
}
