package com.hts.telemetry.codec.json;

import com.hts.telemetry.codec.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ordered, immutable set of path filters. Declaration order is the only priority
 * between filters, so callers must hand in an ordered map.
 */
public final class FilterTable {
    public static final String DEFAULT_DELIMITER = "~";

    private final String delimiter;
    private final List<FilterEntry> entries;

    private FilterTable(String delimiter, List<FilterEntry> entries) {
        this.delimiter = delimiter;
        this.entries = entries;
    }

    public static FilterTable empty(String delimiter) {
        return compile(Map.of(), delimiter);
    }

    /**
     * @param keys filter name to delimiter-separated regex list, in priority order
     */
    public static FilterTable compile(Map<String, String> keys, String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new ConfigurationException("Flattening delimiter must not be empty",
                    ConfigurationException.INVALID_SETTING);
        }
        List<FilterEntry> entries = new ArrayList<>(keys.size());
        keys.forEach((name, filter) -> entries.add(FilterEntry.compile(name, filter, delimiter)));
        return new FilterTable(delimiter, List.copyOf(entries));
    }

    public String delimiter() { return delimiter; }
    public List<FilterEntry> entries() { return entries; }
    public boolean isEmpty() { return entries.isEmpty(); }

    @Override
    public String toString() {
        return "FilterTable[delimiter=" + delimiter + " " + entries + "]";
    }
}
