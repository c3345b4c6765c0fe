package com.hts.telemetry.collector.config;

import com.hts.telemetry.codec.CodecSettings;
import com.hts.telemetry.codec.exception.ConfigurationException;
import com.hts.telemetry.codec.json.XformMode;
import com.typesafe.config.Config;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code telemetry} block of application.conf.
 *
 * <pre>
 * telemetry {
 *   xform = flat
 *   xform-flat-delimiter = "~"
 *   xform-flat-keys = [
 *     { name = "IfCounters", filter = "Interfaces~(?&lt;InterfaceName&gt;.*)~Latest" }
 *   ]
 *   max-frame-length = 67108864
 * }
 * </pre>
 *
 * Filters are a list, not an object, so their declaration order survives parsing.
 */
@Singleton
public final class TelemetryConfig {
    private final Config config;

    @Inject
    public TelemetryConfig(Config config) {
        this.config = config.getConfig("telemetry");
    }

    public XformMode getXform() {
        return XformMode.fromConfig(config.getString("xform"));
    }

    public String getFlatDelimiter() {
        return config.getString("xform-flat-delimiter");
    }

    public Map<String, String> getFlatKeys() {
        Map<String, String> keys = new LinkedHashMap<>();
        for (Config entry : config.getConfigList("xform-flat-keys")) {
            String name = entry.getString("name");
            if (keys.put(name, entry.getString("filter")) != null) {
                throw new ConfigurationException("Duplicate xform-flat-keys name: " + name,
                        ConfigurationException.INVALID_FILTER);
            }
        }
        return Collections.unmodifiableMap(keys);
    }

    public int getMaxFrameLength() {
        return config.getInt("max-frame-length");
    }

    public CodecSettings toCodecSettings() {
        CodecSettings.Builder builder = CodecSettings.builder()
                .xform(getXform())
                .delimiter(getFlatDelimiter())
                .maxFrameLength(getMaxFrameLength());
        getFlatKeys().forEach(builder::flatKey);
        return builder.build();
    }
}
