package com.hts.telemetry.codec.exception;

public abstract class CodecException extends RuntimeException {
    private final int errorCode;

    protected CodecException(String message, int errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CodecException(String message, int errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getErrorCode() { return errorCode; }

    // Whether the owning connection must be torn down; subclasses override
    public boolean shouldCloseConnection() { return false; }
}
