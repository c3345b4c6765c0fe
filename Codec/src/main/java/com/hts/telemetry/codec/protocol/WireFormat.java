package com.hts.telemetry.codec.protocol;

public enum WireFormat {
    /** 6.0.x streams: [4B length][4B type][4B inner length][payload], always compressed JSON or reset */
    V1,
    /** 6.1.x streams: [4B type][4B flags][4B length][payload] */
    V2
}
