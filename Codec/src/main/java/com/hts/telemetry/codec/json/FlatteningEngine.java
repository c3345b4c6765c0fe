package com.hts.telemetry.codec.json;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a nested JSON object into (path, type, content) triples.
 *
 * Walk is depth first. At each key the candidate filters are tried in declaration order:
 * <ul>
 *   <li>complete match (no deeper regex): the key and its sub-tree become one triple,
 *       typed by the filter name, with named captures collected on the way under {@value #CAPTURES_FIELD}</li>
 *   <li>prefix match: the filter is carried into the next level with its captures</li>
 *   <li>no match: the filter is dropped for this branch</li>
 * </ul>
 * Objects nothing claimed are descended into; leaves nothing claimed are emitted on their own.
 *
 * Captures travel with each candidate as an immutable map, so sibling branches never see
 * each other's captures.
 */
public final class FlatteningEngine {
    public static final String CAPTURES_FIELD = "key";
    private static final Pattern SOURCE_PATH_SEPARATOR = Pattern.compile("\\.");

    private final FilterTable filters;

    public FlatteningEngine(FilterTable filters) {
        this.filters = filters;
    }

    @FunctionalInterface
    public interface TripleSink {
        void accept(String path, String type, Object content);
    }

    private record Candidate(FilterEntry entry, Map<String, String> captures) {
    }

    /**
     * @param sourcePath dotted schema path of the document ("RootOper.Interfaces.Latest"), may be null
     * @param seedPath   first segment of every rendered path
     * @param data       tree to flatten
     */
    public void flatten(String sourcePath, String seedPath, Map<String, Object> data, TripleSink sink) {
        List<Candidate> initial = new ArrayList<>(filters.entries().size());
        for (FilterEntry entry : filters.entries()) {
            initial.add(new Candidate(entry, Map.of()));
        }
        walk(new Walk(sourcePath, sink), seedPath, data, initial, 0);
    }

    private void walk(Walk walk, String path, Map<String, Object> data, List<Candidate> candidates, int depth) {
        String delimiter = filters.delimiter();

        for (Map.Entry<String, Object> branch : data.entrySet()) {
            String key = branch.getKey();
            Object value = branch.getValue();
            String pathAndBranch = path + delimiter + key;

            List<Candidate> carried = new ArrayList<>();
            boolean yielded = false;

            for (Candidate candidate : candidates) {
                FilterEntry entry = candidate.entry();
                Matcher m = entry.match(depth, key);
                if (m == null) {
                    continue;
                }
                Map<String, String> captures = entry.capture(depth, m, candidate.captures());

                if (!entry.hasDepth(depth + 1)) {
                    walk.sink.accept(pathAndBranch, entry.name(), wrap(entry, value, captures));
                    yielded = true;
                    break;
                }
                carried.add(new Candidate(entry, captures));
            }

            if (yielded) {
                continue;
            }

            if (value instanceof Map) {
                @SuppressWarnings("unchecked")
                Map<String, Object> child = (Map<String, Object>) value;
                walk(walk, pathAndBranch, child, carried, depth + 1);
            } else {
                emitLeaf(walk, pathAndBranch, key, value);
            }
        }
    }

    /**
     * Leaf (scalar or array) no filter claimed on the way down. The document source path
     * decides whether a configured filter still names it.
     */
    private void emitLeaf(Walk walk, String pathAndBranch, String key, Object value) {
        for (FilterEntry entry : filters.entries()) {
            if (entry.matchesSegments(walk.segments)) {
                walk.sink.accept(walk.sourcePath.replace(".", filters.delimiter()), entry.name(), value);
                return;
            }
        }
        walk.sink.accept(pathAndBranch, key, value);
    }

    private static Object wrap(FilterEntry entry, Object value, Map<String, String> captures) {
        if (entry.name().isEmpty()) {
            return value;
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put(entry.name(), value);
        content.put(CAPTURES_FIELD, new LinkedHashMap<>(captures));
        return content;
    }

    // Per-call state shared by every level of one walk
    private static final class Walk {
        final String sourcePath;
        final String[] segments;
        final TripleSink sink;

        Walk(String sourcePath, TripleSink sink) {
            this.sourcePath = sourcePath;
            this.segments = sourcePath == null || sourcePath.isEmpty()
                    ? new String[0]
                    : SOURCE_PATH_SEPARATOR.split(sourcePath);
            this.sink = sink;
        }
    }
}
