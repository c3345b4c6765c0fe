package com.hts.telemetry.codec.exception;

/**
 * Framing violation. Once raised, the byte position of the stream can no longer
 * be trusted and the connection has to be dropped.
 */
public final class ProtocolException extends CodecException {
    public static final int UNKNOWN_PAYLOAD_TYPE = 1001;
    public static final int MALFORMED_FRAME = 1002;
    public static final int FRAME_TOO_LARGE = 1003;
    public static final int DECODER_CLOSED = 1004;

    public ProtocolException(String message, int code) {
        super(message, code);
    }

    @Override
    public boolean shouldCloseConnection() {
        return true;
    }
}
