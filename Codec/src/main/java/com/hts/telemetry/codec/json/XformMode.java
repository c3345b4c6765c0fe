package com.hts.telemetry.codec.json;

import com.hts.telemetry.codec.exception.ConfigurationException;

import java.util.Locale;

/**
 * JSON output shape.
 */
public enum XformMode {
    /** path from root to claimed node, type, content per event */
    FLAT,
    /** the document as received, one event per message */
    RAW;

    public static XformMode fromConfig(String value) {
        if (value == null) {
            throw new ConfigurationException("xform must be one of flat|raw", ConfigurationException.INVALID_SETTING);
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported xform: " + value, ConfigurationException.INVALID_SETTING, e);
        }
    }
}
