package com.hts.telemetry.codec.exception;

public final class ConfigurationException extends CodecException {
    public static final int INVALID_FILTER = 3001;
    public static final int INVALID_SETTING = 3002;

    public ConfigurationException(String message, int code) {
        super(message, code);
    }

    public ConfigurationException(String message, int code, Throwable cause) {
        super(message, code, cause);
    }
}
