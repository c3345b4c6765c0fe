package com.hts.telemetry.codec;

import com.hts.telemetry.codec.json.FilterTable;
import com.hts.telemetry.codec.json.XformMode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable decoder configuration, shared by every connection.
 */
public final class CodecSettings {
    public static final int DEFAULT_MAX_FRAME_LENGTH = 64 * 1024 * 1024;

    private final XformMode xform;
    private final FilterTable filters;
    private final int maxFrameLength;

    private CodecSettings(Builder builder) {
        this.xform = builder.xform;
        this.filters = FilterTable.compile(builder.flatKeys, builder.delimiter);
        this.maxFrameLength = builder.maxFrameLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    public XformMode getXform() { return xform; }
    public FilterTable getFilters() { return filters; }
    public int getMaxFrameLength() { return maxFrameLength; }

    @Override
    public String toString() {
        return String.format("CodecSettings[xform=%s maxFrameLength=%d %s]", xform, maxFrameLength, filters);
    }

    public static final class Builder {
        private XformMode xform = XformMode.FLAT;
        private String delimiter = FilterTable.DEFAULT_DELIMITER;
        private final Map<String, String> flatKeys = new LinkedHashMap<>();
        private int maxFrameLength = DEFAULT_MAX_FRAME_LENGTH;

        private Builder() {}

        public Builder xform(XformMode xform) {
            this.xform = xform;
            return this;
        }

        public Builder delimiter(String delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        /**
         * Adds a flattening filter; call order is match priority.
         */
        public Builder flatKey(String name, String filter) {
            this.flatKeys.put(name, filter);
            return this;
        }

        public Builder maxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public CodecSettings build() {
            return new CodecSettings(this);
        }
    }
}
