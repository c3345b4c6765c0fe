package com.hts.telemetry.codec.protocol;

public enum CodecState {
    AWAITING_HEADER,
    AWAITING_PAYLOAD
}
