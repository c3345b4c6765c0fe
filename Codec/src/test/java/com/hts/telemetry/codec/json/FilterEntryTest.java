package com.hts.telemetry.codec.json;

import com.hts.telemetry.codec.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;
import java.util.regex.Matcher;

import static org.junit.jupiter.api.Assertions.*;

class FilterEntryTest {

    @Test
    @DisplayName("Filter string is split on the delimiter, one anchored regex per depth")
    void splitsPerDepth() {
        FilterEntry entry = FilterEntry.compile("IF", "Interfaces~(?<InterfaceName>.*)~Latest", "~");

        assertEquals(3, entry.depth());
        assertNotNull(entry.match(0, "Interfaces"));
        assertNull(entry.match(0, "InterfacesX"), "regex is anchored at both ends");
        assertNull(entry.match(3, "anything"));
    }

    @Test
    @DisplayName("Named groups are collected without touching the incoming captures")
    void capturesNamedGroups() {
        FilterEntry entry = FilterEntry.compile("IF", "(?<Node>node\\d+)~(?<InterfaceName>.*)", "~");

        Matcher m0 = entry.match(0, "node7");
        Map<String, String> level0 = entry.capture(0, m0, Map.of());
        Matcher m1 = entry.match(1, "Gi0/0/0/1");
        Map<String, String> level1 = entry.capture(1, m1, level0);

        assertEquals(Map.of("Node", "node7"), level0);
        assertEquals(Map.of("Node", "node7", "InterfaceName", "Gi0/0/0/1"), level1);
    }

    @Test
    @DisplayName("Invalid regex is a configuration error")
    void invalidRegex() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> FilterEntry.compile("bad", "ok~(unclosed", "~"));
        assertEquals(ConfigurationException.INVALID_FILTER, ex.getErrorCode());
    }

    @ParameterizedTest
    @CsvSource({
            "RootOper.Interfaces.Latest, true",
            "RootOper.Anything.Latest,   true",
            "RootOper.Interfaces.Oldest, false",
            "RootOper.Interfaces,        false",
            "Other.Interfaces.Latest,    false",
    })
    @DisplayName("Source path segments match positionally; wildcard atoms match without evaluation")
    void positionalSegments(String sourcePath, boolean expected) {
        FilterEntry entry = FilterEntry.compile("IF", "RootOper~(?<x>.*)~Latest", "~");
        assertEquals(expected, entry.matchesSegments(sourcePath.split("\\.")));
    }

    @Test
    @DisplayName("The letter d alone does not make an atom a wildcard")
    void letterDIsNotAWildcard() {
        FilterEntry entry = FilterEntry.compile("N", "Node~Data", "~");

        assertFalse(entry.matchesSegments(new String[] {"Other", "Data"}));
        assertFalse(entry.matchesSegments(new String[] {"Node", "Other"}));
        assertTrue(entry.matchesSegments(new String[] {"Node", "Data"}));
    }

    @Test
    @DisplayName("An atom containing \\d counts as a positional match even when it would not match")
    void digitClassIsTreatedAsWildcard() {
        FilterEntry entry = FilterEntry.compile("N", "node\\d+~stats", "~");
        assertTrue(entry.matchesSegments(new String[] {"chassis", "stats"}));
    }
}
