package com.hts.telemetry.codec.exception;

public final class CompressionException extends CodecException {
    public static final int INFLATE_ERROR = 2001;

    public CompressionException(String message, Throwable cause) {
        super(message, INFLATE_ERROR, cause);
    }

    @Override
    public boolean shouldCloseConnection() {
        return true;  // inflate stream position is lost
    }
}
