package com.hts.telemetry.collector.config;

import com.hts.telemetry.codec.CodecSettings;
import com.hts.telemetry.codec.exception.ConfigurationException;
import com.hts.telemetry.codec.json.FilterEntry;
import com.hts.telemetry.codec.json.XformMode;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryConfigTest {

    private static TelemetryConfig parse(String hocon) {
        return new TelemetryConfig(ConfigFactory.parseString(hocon));
    }

    @Test
    @DisplayName("Filter list keeps declaration order")
    void filterOrder() {
        TelemetryConfig config = parse("""
                telemetry {
                  xform = flat
                  xform-flat-delimiter = "~"
                  xform-flat-keys = [
                    { name = "Z", filter = "z~y" }
                    { name = "A", filter = "a" }
                    { name = "M", filter = "m~(?<Name>.*)" }
                  ]
                  max-frame-length = 1048576
                }
                """);

        CodecSettings settings = config.toCodecSettings();

        assertEquals(XformMode.FLAT, settings.getXform());
        assertEquals(1048576, settings.getMaxFrameLength());
        assertEquals(List.of("Z", "A", "M"),
                settings.getFilters().entries().stream().map(FilterEntry::name).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Packaged application.conf loads")
    void packagedDefaults() {
        TelemetryConfig config = new TelemetryConfig(ConfigFactory.load());

        assertEquals("~", config.getFlatDelimiter());
        assertFalse(config.getFlatKeys().isEmpty());
        assertNotNull(config.toCodecSettings());
    }

    @Test
    void rawModeWithoutFilters() {
        TelemetryConfig config = parse("telemetry { xform = RAW, xform-flat-delimiter = \"|\","
                + " xform-flat-keys = [], max-frame-length = 4096 }");

        assertEquals(XformMode.RAW, config.getXform());
        assertTrue(config.toCodecSettings().getFilters().isEmpty());
    }

    @Test
    void unknownXformRejected() {
        TelemetryConfig config = parse("telemetry { xform = tree, xform-flat-delimiter = \"~\","
                + " xform-flat-keys = [], max-frame-length = 4096 }");

        assertThrows(ConfigurationException.class, config::getXform);
    }

    @Test
    void duplicateFilterNameRejected() {
        TelemetryConfig config = parse("telemetry { xform = flat, xform-flat-delimiter = \"~\","
                + " xform-flat-keys = [ { name = A, filter = a }, { name = A, filter = b } ],"
                + " max-frame-length = 4096 }");

        assertThrows(ConfigurationException.class, config::getFlatKeys);
    }

    @Test
    void invalidFilterRegexRejected() {
        TelemetryConfig config = parse("telemetry { xform = flat, xform-flat-delimiter = \"~\","
                + " xform-flat-keys = [ { name = A, filter = \"a~(b\" } ], max-frame-length = 4096 }");

        assertThrows(ConfigurationException.class, config::toCodecSettings);
    }
}
